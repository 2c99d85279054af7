package org.glossa.workspace.api.errors;

/**
 * Raised when a document, label or annotation index does not exist in the caller's namespace.
 */
public class NotFoundException extends WorkspaceException {

    public NotFoundException(final String message) {
        super(message);
    }
}
