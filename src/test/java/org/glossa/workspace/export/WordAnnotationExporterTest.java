package org.glossa.workspace.export;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.glossa.workspace.annotations.AnnotationStore;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.model.Annotation;
import org.glossa.workspace.api.model.ExportArtifact;
import org.glossa.workspace.api.model.TextEntry;
import org.glossa.workspace.documents.ArchiveReader;
import org.glossa.workspace.documents.DocumentStore;
import org.glossa.workspace.documents.Previews;
import org.glossa.workspace.storage.InMemoryKeyValueStore;
import org.glossa.workspace.storage.NamespaceLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class WordAnnotationExporterTest {

    private DocumentStore documents;
    private AnnotationStore annotations;
    private WordAnnotationExporter exporter;

    @BeforeEach
    void setUp() {
        final NamespaceLocks locks = new NamespaceLocks();
        documents = new DocumentStore(new InMemoryKeyValueStore<>("documents"), locks,
            new ArchiveReader(List.of(".txt")), Previews.DEFAULT_LENGTH);
        annotations = new AnnotationStore(new InMemoryKeyValueStore<>("annotations"), locks);
        exporter = new WordAnnotationExporter(documents, annotations);
    }

    @Test
    void export_shouldRenderHeadingAndColoredLines() throws Exception {
        documents.put("ns", new TextEntry("notes.txt", "Hello world".getBytes(StandardCharsets.UTF_8)));
        annotations.save("ns", "notes.txt", new Annotation(6, 11, "world", "PLACE", null));
        annotations.save("ns", "notes.txt", new Annotation(0, 5, "Hello", "GREETING", "1"));

        final ExportArtifact artifact = exporter.export("ns", "notes.txt");

        assertThat(artifact.filename()).isEqualTo("notes.txt_annotations.docx");
        assertThat(artifact.contentType()).isEqualTo(WordAnnotationExporter.CONTENT_TYPE);
        try (XWPFDocument docx = new XWPFDocument(new ByteArrayInputStream(artifact.content()))) {
            final List<XWPFParagraph> paragraphs = docx.getParagraphs();
            assertThat(paragraphs).extracting(XWPFParagraph::getText).containsExactly(
                "Annotations for notes.txt",
                "[GREETING] Hello (Rank=1)",
                "[PLACE] world (Rank=)");

            final XWPFRun heading = paragraphs.get(0).getRuns().get(0);
            assertThat(heading.isBold()).isTrue();
            assertThat(paragraphs.get(1).getRuns().get(0).getColor()).isEqualTo(WordAnnotationExporter.ANNOTATION_COLOR);
        }
    }

    @Test
    void export_shouldRenderOnlyHeadingWithoutAnnotations() throws Exception {
        documents.put("ns", new TextEntry("empty.txt", new byte[0]));

        final ExportArtifact artifact = exporter.export("ns", "empty.txt");

        try (XWPFDocument docx = new XWPFDocument(new ByteArrayInputStream(artifact.content()))) {
            assertThat(docx.getParagraphs()).hasSize(1);
        }
    }

    @Test
    void export_shouldFailForUnknownDocument() {
        assertThatThrownBy(() -> exporter.export("ns", "missing.txt")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void formatLine_shouldRenderMissingRankAsEmpty() {
        assertThat(WordAnnotationExporter.formatLine(new Annotation(0, 1, "a", "L", null))).isEqualTo("[L] a (Rank=)");
    }
}
