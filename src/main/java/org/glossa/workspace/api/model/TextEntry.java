package org.glossa.workspace.api.model;

/**
 * A named piece of raw uploaded content, before decoding.
 *
 * @param name    the filename or archive entry path
 * @param content the raw bytes
 */
public record TextEntry(
    String name,
    byte[] content
) {}
