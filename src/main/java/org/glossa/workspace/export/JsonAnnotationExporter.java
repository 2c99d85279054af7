package org.glossa.workspace.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.glossa.workspace.annotations.AnnotationStore;
import org.glossa.workspace.api.model.ExportArtifact;

import java.io.IOException;

/**
 * Exports the stored annotation list of a document as pretty-printed JSON, without any
 * transformation. A document without annotations exports as an empty array.
 */
public class JsonAnnotationExporter {

    static final String CONTENT_TYPE = "application/json";

    private final AnnotationStore annotationStore;
    private final ObjectMapper mapper;

    public JsonAnnotationExporter(final AnnotationStore annotationStore, final ObjectMapper mapper) {
        this.annotationStore = annotationStore;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ExportArtifact export(final String namespace, final String docId) throws IOException {
        final byte[] content = mapper.writeValueAsBytes(annotationStore.list(namespace, docId));
        return new ExportArtifact(ExportFilenames.of(docId, "json"), CONTENT_TYPE, content);
    }
}
