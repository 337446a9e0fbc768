package com.bbthechange.watcher.exception;

/**
 * Exception thrown when the cycle lock backend itself fails (not when the lock is simply held).
 */
public class LockException extends RuntimeException {

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
