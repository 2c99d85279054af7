package org.glossa.workspace.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.glossa.junit.extensions.logging.ExpectLog;
import org.glossa.junit.extensions.logging.LogLevel;
import org.glossa.junit.extensions.logging.LogWatchExtension;
import org.glossa.workspace.api.model.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class JsonFileKeyValueStoreTest {

    @TempDir
    Path root;

    private JsonFileKeyValueStore<Document> store;

    @BeforeEach
    void setUp() {
        final ObjectMapper mapper = new ObjectMapper();
        store = new JsonFileKeyValueStore<>(root, "documents", mapper, mapper.getTypeFactory().constructType(Document.class));
    }

    @Test
    @DisplayName("Should return an empty mapping for a namespace never written")
    void load_shouldReturnEmptyForMissingFile() throws Exception {
        assertThat(store.load("fresh")).isEmpty();
    }

    @Test
    @DisplayName("Should write pretty-printed JSON and read it back in insertion order")
    void save_shouldPersistMapping() throws Exception {
        final Map<String, Document> mapping = new LinkedHashMap<>();
        mapping.put("b.txt", new Document("b.txt", "b.txt", "bee", "bee"));
        mapping.put("a.txt", new Document("a.txt", "a.txt", "ay", "ay"));

        store.save("ns", mapping);

        assertThat(store.load("ns")).containsExactlyEntriesOf(mapping);
        final String json = Files.readString(store.storeFile("ns"), StandardCharsets.UTF_8);
        assertThat(json).contains("\n").contains("\"docId\"");
        assertThat(store.storeFile("ns")).isEqualTo(root.resolve("ns").resolve("documents.json"));
    }

    @Test
    @DisplayName("Should leave no temporary files behind after a write")
    void save_shouldNotLeaveTempFiles() throws Exception {
        store.save("ns", Map.of("a.txt", new Document("a.txt", "a.txt", "x", "x")));
        store.save("ns", Map.of("b.txt", new Document("b.txt", "b.txt", "y", "y")));

        try (Stream<Path> files = Files.list(root.resolve("ns"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("documents.json");
        }
        assertThat(store.load("ns")).containsOnlyKeys("b.txt");
    }

    @Test
    @DisplayName("Should treat a corrupt file as empty and warn")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Store file .* is unreadable.*")
    void load_shouldTreatCorruptFileAsEmpty() throws Exception {
        Files.createDirectories(root.resolve("ns"));
        Files.writeString(store.storeFile("ns"), "{ not json", StandardCharsets.UTF_8);

        assertThat(store.load("ns")).isEmpty();
    }

    @Test
    @DisplayName("Should refuse namespace names that could escape the root")
    void load_shouldRejectUnsafeNamespace() {
        assertThatThrownBy(() -> store.load("../escape")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.createNamespace("a/b")).isInstanceOf(IllegalArgumentException.class);
    }
}
