package org.glossa.node.processes.http.api.annotations.dto;

import org.glossa.workspace.api.model.Annotation;

import java.util.List;

/**
 * @param status      outcome, always {@code "saved"}
 * @param annotations the document's annotation list after reconciliation
 */
public record SaveAnnotationResponseDto(
    String status,
    List<Annotation> annotations
) {}
