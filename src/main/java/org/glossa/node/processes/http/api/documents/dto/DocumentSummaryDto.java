package org.glossa.node.processes.http.api.documents.dto;

import org.glossa.workspace.api.model.Document;

/**
 * Entry of the document listing. Omits the full text.
 *
 * @param docId    the document key
 * @param filename the uploaded filename
 * @param preview  whitespace-normalized prefix of the text
 */
public record DocumentSummaryDto(
    String docId,
    String filename,
    String preview
) {
    public static DocumentSummaryDto from(final Document document) {
        return new DocumentSummaryDto(document.docId(), document.filename(), document.preview());
    }
}
