package org.glossa.workspace.api.model;

/**
 * A rendered export ready to be downloaded.
 *
 * @param filename    suggested download filename
 * @param contentType MIME type of the content
 * @param content     the rendered bytes
 */
public record ExportArtifact(
    String filename,
    String contentType,
    byte[] content
) {}
