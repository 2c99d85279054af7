package org.glossa.node.processes.http.api.dto;

/**
 * Acknowledgement body for successful writes, e.g. {@code {"status": "saved"}}.
 *
 * @param status short outcome description
 */
public record StatusResponseDto(
    String status
) {}
