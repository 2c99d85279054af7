package org.glossa.workspace.api.errors;

/**
 * Raised when a registration collides with an existing user or carries blank credentials.
 */
public class ConflictException extends WorkspaceException {

    public ConflictException(final String message) {
        super(message);
    }
}
