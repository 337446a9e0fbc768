package com.bbthechange.watcher.exception;

/**
 * Exception thrown when checkpoint, delivery or subscription store operations fail.
 * Wraps lower-level DynamoDB exceptions with meaningful messages.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
