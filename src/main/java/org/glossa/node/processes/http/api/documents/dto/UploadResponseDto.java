package org.glossa.node.processes.http.api.documents.dto;

/**
 * @param status outcome, always {@code "uploaded"}
 * @param docId  key of the stored document
 */
public record UploadResponseDto(
    String status,
    String docId
) {}
