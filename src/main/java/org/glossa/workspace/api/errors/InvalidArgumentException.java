package org.glossa.workspace.api.errors;

/**
 * Raised when a request carries a malformed span, a blank required field or an unreadable payload.
 */
public class InvalidArgumentException extends WorkspaceException {

    public InvalidArgumentException(final String message) {
        super(message);
    }
}
