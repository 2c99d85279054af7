package org.glossa.workspace.api.errors;

/**
 * Base class for caller-input errors raised by the workspace stores.
 * <p>
 * These errors are reported directly to the caller and are never retried. Storage I/O failures
 * are deliberately not part of this hierarchy; they surface as {@link java.io.IOException}.
 */
public abstract class WorkspaceException extends RuntimeException {

    protected WorkspaceException(final String message) {
        super(message);
    }
}
