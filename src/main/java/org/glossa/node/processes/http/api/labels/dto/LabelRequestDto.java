package org.glossa.node.processes.http.api.labels.dto;

/**
 * @param name  label name
 * @param color display color, stored verbatim
 */
public record LabelRequestDto(
    String name,
    String color
) {}
