package org.glossa.workspace.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Persists one pretty-printed JSON object per namespace at
 * {@code <rootDirectory>/<namespace>/<storeName>.json}.
 * <p>
 * Writes are staged into a sibling {@code .<uuid>.tmp} file and moved over the target with
 * {@link StandardCopyOption#ATOMIC_MOVE}, so a reader sees either the old or the new content.
 *
 * @param <V> the value type of the mapping
 */
public class JsonFileKeyValueStore<V> implements IKeyValueStore<V> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileKeyValueStore.class);
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final Path rootDirectory;
    private final String storeName;
    private final ObjectMapper mapper;
    private final JavaType mappingType;

    /**
     * Creates a file-backed store.
     *
     * @param rootDirectory directory under which namespace directories are created
     * @param storeName     file base name, also used in log messages
     * @param mapper        the Jackson mapper used for both directions
     * @param valueType     the Jackson type of a single mapping value
     */
    public JsonFileKeyValueStore(final Path rootDirectory, final String storeName,
                                 final ObjectMapper mapper, final JavaType valueType) {
        this.rootDirectory = Objects.requireNonNull(rootDirectory, "rootDirectory");
        this.storeName = validateSegment(storeName, "storeName");
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.mappingType = mapper.getTypeFactory().constructMapType(LinkedHashMap.class,
            mapper.getTypeFactory().constructType(String.class), valueType);
    }

    @Override
    public String getStoreName() {
        return storeName;
    }

    @Override
    public void createNamespace(final String namespace) throws IOException {
        Files.createDirectories(namespaceDirectory(namespace));
    }

    @Override
    public Map<String, V> load(final String namespace) throws IOException {
        final Path file = storeFile(namespace);
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }

        final byte[] data = Files.readAllBytes(file);
        try {
            final Map<String, V> mapping = mapper.readValue(data, mappingType);
            return mapping != null ? mapping : new LinkedHashMap<>();
        } catch (final JsonProcessingException e) {
            log.warn("Store file {} is unreadable, treating it as empty: {}", file, e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    @Override
    public void save(final String namespace, final Map<String, V> mapping) throws IOException {
        final Path file = storeFile(namespace);
        Files.createDirectories(file.getParent());

        final byte[] data = mapper.writerFor(mappingType).writeValueAsBytes(mapping);
        final Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile, data);

        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (final IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }

    /**
     * Returns the file backing a namespace. Visible for diagnostics and tests.
     *
     * @param namespace the namespace identifier
     * @return the JSON file path
     */
    public Path storeFile(final String namespace) {
        return namespaceDirectory(namespace).resolve(storeName + ".json");
    }

    private Path namespaceDirectory(final String namespace) {
        return rootDirectory.resolve(validateSegment(namespace, "namespace"));
    }

    private static String validateSegment(final String segment, final String what) {
        if (segment == null || !SAFE_SEGMENT.matcher(segment).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + segment);
        }
        return segment;
    }
}
