package org.glossa.node.processes.http.api.documents.dto;

/**
 * @param docId the document key
 * @param text  the full document text
 */
public record DocumentTextDto(
    String docId,
    String text
) {}
