package org.modulematch.repository;

/**
 * Failure of the data provider: a malformed or unreadable snapshot, or a lookup
 * that the provider tables cannot satisfy.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(Throwable cause) {
        super(cause);
    }
}
