package org.glossa.workspace.export;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.glossa.workspace.annotations.AnnotationStore;
import org.glossa.workspace.api.errors.NotFoundException;
import org.glossa.workspace.api.model.Annotation;
import org.glossa.workspace.api.model.Document;
import org.glossa.workspace.api.model.ExportArtifact;
import org.glossa.workspace.documents.DocumentStore;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Renders the annotations of a document into a Word (.docx) file: a heading followed by one
 * colored line per annotation in stored order.
 */
public class WordAnnotationExporter {

    static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    static final String ANNOTATION_COLOR = "C80000";
    private static final int HEADING_FONT_SIZE = 16;

    private final DocumentStore documentStore;
    private final AnnotationStore annotationStore;

    public WordAnnotationExporter(final DocumentStore documentStore, final AnnotationStore annotationStore) {
        this.documentStore = documentStore;
        this.annotationStore = annotationStore;
    }

    /**
     * @param namespace the caller's namespace
     * @param docId     the document key
     * @return the rendered .docx
     * @throws NotFoundException if the document does not exist, regardless of its annotations
     * @throws IOException       if a store cannot be read or the file cannot be rendered
     */
    public ExportArtifact export(final String namespace, final String docId) throws IOException {
        final Document document = documentStore.get(namespace, docId);
        final List<Annotation> annotations = annotationStore.list(namespace, docId);

        try (XWPFDocument docx = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            final XWPFRun heading = docx.createParagraph().createRun();
            heading.setBold(true);
            heading.setFontSize(HEADING_FONT_SIZE);
            heading.setText("Annotations for " + document.docId());

            for (final Annotation annotation : annotations) {
                final XWPFParagraph paragraph = docx.createParagraph();
                final XWPFRun run = paragraph.createRun();
                run.setColor(ANNOTATION_COLOR);
                run.setText(formatLine(annotation));
            }

            docx.write(out);
            return new ExportArtifact(ExportFilenames.of(docId, "docx"), CONTENT_TYPE, out.toByteArray());
        }
    }

    static String formatLine(final Annotation annotation) {
        final String rank = annotation.rank() != null ? annotation.rank() : "";
        return "[" + annotation.label() + "] " + annotation.text() + " (Rank=" + rank + ")";
    }
}
