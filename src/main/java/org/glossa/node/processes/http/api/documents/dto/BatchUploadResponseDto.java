package org.glossa.node.processes.http.api.documents.dto;

import java.util.List;

/**
 * @param status outcome, always {@code "uploaded"}
 * @param docIds keys of the stored documents in upload order
 */
public record BatchUploadResponseDto(
    String status,
    List<String> docIds
) {}
