package org.glossa.workspace;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.glossa.utils.PathExpansion;
import org.glossa.workspace.annotations.AnnotationStore;
import org.glossa.workspace.api.model.Annotation;
import org.glossa.workspace.api.model.Document;
import org.glossa.workspace.api.model.UserCredential;
import org.glossa.workspace.api.storage.IKeyValueStore;
import org.glossa.workspace.auth.CredentialStore;
import org.glossa.workspace.auth.SessionRegistry;
import org.glossa.workspace.documents.ArchiveReader;
import org.glossa.workspace.documents.DocumentStore;
import org.glossa.workspace.documents.Previews;
import org.glossa.workspace.export.JsonAnnotationExporter;
import org.glossa.workspace.export.WordAnnotationExporter;
import org.glossa.workspace.labels.LabelStore;
import org.glossa.workspace.storage.InMemoryKeyValueStore;
import org.glossa.workspace.storage.JsonFileKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Owns every store and the session table of one running service.
 * <p>
 * A workspace is created once per process (by
 * {@link org.glossa.node.processes.workspace.WorkspaceProcess}) and handed to the HTTP
 * controllers explicitly. Its session table lives as long as the workspace does.
 * <p>
 * Configuration structure:
 * <pre>
 * storage {
 *   type = "file"                          # or "memory"
 *   rootDirectory = "${user.home}/glossa-data"
 * }
 * documents {
 *   previewLength = 120
 *   textExtensions = [".txt"]
 * }
 * </pre>
 */
public final class Workspace {

    private static final Logger LOGGER = LoggerFactory.getLogger(Workspace.class);

    static final String USERS_STORE = "users";
    static final String DOCUMENTS_STORE = "documents";
    static final String ANNOTATIONS_STORE = "annotations";
    static final String LABELS_STORE = "labels";

    private final SessionRegistry sessionRegistry;
    private final CredentialStore credentialStore;
    private final NamespaceResolver namespaceResolver;
    private final DocumentStore documentStore;
    private final AnnotationStore annotationStore;
    private final LabelStore labelStore;
    private final JsonAnnotationExporter jsonExporter;
    private final WordAnnotationExporter wordExporter;

    private Workspace(final StoreFactory stores, final ObjectMapper mapper, final List<String> textExtensions,
                      final int previewLength) {
        final NamespaceLocks locks = new NamespaceLocks();
        final IKeyValueStore<UserCredential> users = stores.create(USERS_STORE, new TypeReference<UserCredential>() {});
        final IKeyValueStore<Document> documents = stores.create(DOCUMENTS_STORE, new TypeReference<Document>() {});
        final IKeyValueStore<List<Annotation>> annotations =
            stores.create(ANNOTATIONS_STORE, new TypeReference<List<Annotation>>() {});
        final IKeyValueStore<String> labels = stores.create(LABELS_STORE, new TypeReference<String>() {});

        this.sessionRegistry = new SessionRegistry();
        this.credentialStore = new CredentialStore(users, locks);
        this.namespaceResolver = new NamespaceResolver(List.of(documents, annotations, labels));
        this.documentStore = new DocumentStore(documents, locks, new ArchiveReader(textExtensions), previewLength);
        this.annotationStore = new AnnotationStore(annotations, locks);
        this.labelStore = new LabelStore(labels, locks);
        this.jsonExporter = new JsonAnnotationExporter(annotationStore, mapper);
        this.wordExporter = new WordAnnotationExporter(documentStore, annotationStore);
    }

    /**
     * Builds a workspace from its configuration block.
     *
     * @param options the workspace options (see class documentation)
     * @param mapper  the mapper used for persistence and JSON export
     * @return the workspace
     * @throws IllegalArgumentException if the storage configuration is invalid
     */
    public static Workspace create(final Config options, final ObjectMapper mapper) {
        final String type = options.hasPath("storage.type") ? options.getString("storage.type") : "file";
        final StoreFactory stores;
        if ("memory".equalsIgnoreCase(type)) {
            LOGGER.warn("Workspace uses in-memory storage. All data is lost on shutdown.");
            stores = new StoreFactory() {
                @Override
                public <V> IKeyValueStore<V> create(final String name, final TypeReference<V> valueType) {
                    return new InMemoryKeyValueStore<>(name);
                }
            };
        } else if ("file".equalsIgnoreCase(type)) {
            if (!options.hasPath("storage.rootDirectory")) {
                throw new IllegalArgumentException("storage.rootDirectory is required for file storage");
            }
            final Path root = Paths.get(PathExpansion.expandPath(options.getString("storage.rootDirectory")))
                .toAbsolutePath();
            LOGGER.info("Workspace data directory: {}", root);
            stores = new StoreFactory() {
                @Override
                public <V> IKeyValueStore<V> create(final String name, final TypeReference<V> valueType) {
                    final JavaType javaType = mapper.getTypeFactory().constructType(valueType);
                    return new JsonFileKeyValueStore<>(root, name, mapper, javaType);
                }
            };
        } else {
            throw new IllegalArgumentException("Unknown storage.type '" + type + "', expected 'file' or 'memory'");
        }

        final List<String> textExtensions = options.hasPath("documents.textExtensions")
            ? options.getStringList("documents.textExtensions")
            : List.of(".txt");
        final int previewLength = options.hasPath("documents.previewLength")
            ? options.getInt("documents.previewLength")
            : Previews.DEFAULT_LENGTH;

        return new Workspace(stores, mapper, textExtensions, previewLength);
    }

    public SessionRegistry sessions() {
        return sessionRegistry;
    }

    public CredentialStore credentials() {
        return credentialStore;
    }

    public NamespaceResolver namespaces() {
        return namespaceResolver;
    }

    public DocumentStore documents() {
        return documentStore;
    }

    public AnnotationStore annotations() {
        return annotationStore;
    }

    public LabelStore labels() {
        return labelStore;
    }

    public JsonAnnotationExporter jsonExporter() {
        return jsonExporter;
    }

    public WordAnnotationExporter wordExporter() {
        return wordExporter;
    }

    private interface StoreFactory {
        <V> IKeyValueStore<V> create(String name, TypeReference<V> valueType);
    }
}
