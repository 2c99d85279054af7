package org.glossa.workspace.api.errors;

/**
 * Raised when a session token is missing or unknown, or when credentials do not match.
 */
public class UnauthorizedException extends WorkspaceException {

    public UnauthorizedException(final String message) {
        super(message);
    }
}
