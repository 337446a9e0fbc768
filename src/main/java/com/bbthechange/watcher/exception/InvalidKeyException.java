package com.bbthechange.watcher.exception;

/**
 * Exception thrown when a WatcherTable key part is missing.
 * Used by WatcherKeyFactory so that blank ids never reach DynamoDB.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
