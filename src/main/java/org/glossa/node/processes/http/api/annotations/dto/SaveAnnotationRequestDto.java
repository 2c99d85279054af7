package org.glossa.node.processes.http.api.annotations.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of a save-annotation request. Offsets are boxed so a missing field can be told apart
 * from zero.
 *
 * @param docId document the span belongs to (also accepted as {@code doc_id})
 * @param start inclusive start offset
 * @param end   exclusive end offset
 * @param text  the covered text
 * @param label label name
 * @param rank  optional rank
 */
public record SaveAnnotationRequestDto(
    @JsonAlias("doc_id") String docId,
    Integer start,
    Integer end,
    String text,
    String label,
    String rank
) {}
