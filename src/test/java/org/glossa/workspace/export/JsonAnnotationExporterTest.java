package org.glossa.workspace.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.glossa.workspace.annotations.AnnotationStore;
import org.glossa.workspace.api.model.Annotation;
import org.glossa.workspace.api.model.ExportArtifact;
import org.glossa.workspace.storage.InMemoryKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class JsonAnnotationExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private AnnotationStore annotations;
    private JsonAnnotationExporter exporter;

    @BeforeEach
    void setUp() {
        annotations = new AnnotationStore(new InMemoryKeyValueStore<>("annotations"), new NamespaceLocks());
        exporter = new JsonAnnotationExporter(annotations, mapper);
    }

    @Test
    void export_shouldWriteStoredListAsPrettyJson() throws Exception {
        annotations.save("ns", "notes.txt", new Annotation(0, 5, "Hello", "GREETING", "2"));
        annotations.save("ns", "notes.txt", new Annotation(6, 11, "world", "PLACE", null));

        final ExportArtifact artifact = exporter.export("ns", "notes.txt");

        assertThat(artifact.filename()).isEqualTo("notes.txt_annotations.json");
        assertThat(artifact.contentType()).isEqualTo("application/json");
        final String json = new String(artifact.content(), StandardCharsets.UTF_8);
        assertThat(json).contains("\n");
        final List<Annotation> parsed = mapper.readValue(json, new TypeReference<List<Annotation>>() {});
        assertThat(parsed).containsExactlyElementsOf(annotations.list("ns", "notes.txt"));
    }

    @Test
    void export_shouldWriteEmptyArrayForUnannotatedDocument() throws Exception {
        final ExportArtifact artifact = exporter.export("ns", "unknown.txt");

        assertThat(new String(artifact.content(), StandardCharsets.UTF_8).trim()).isEqualTo("[ ]");
    }

    @Test
    void export_shouldNameFileAfterLastPathSegment() throws Exception {
        assertThat(exporter.export("ns", "folder/sub/doc.txt").filename()).isEqualTo("doc.txt_annotations.json");
    }
}
