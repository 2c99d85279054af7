package org.glossa.workspace.api.model;

/**
 * An uploaded text document as persisted in a user's namespace.
 *
 * @param docId    unique key within the namespace, equal to the uploaded filename
 * @param filename the uploaded filename, or the entry path for archive uploads
 * @param text     the full decoded text
 * @param preview  whitespace-normalized prefix of the text
 */
public record Document(
    String docId,
    String filename,
    String text,
    String preview
) {}
