package com.bbthechange.watcher.exception;

/**
 * Base exception for failures of external collaborators (feed API, mail transport).
 * The error type decides whether the retry executor may try the call again.
 */
public abstract class ExternalServiceException extends RuntimeException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * Remote side asked us to slow down (HTTP 429, SES throttling).
         */
        RATE_LIMITED(true),

        /**
         * Remote side is down or returned a 5xx.
         */
        UNAVAILABLE(true),

        /**
         * Connection or read timed out.
         */
        TIMEOUT(true),

        /**
         * Credentials missing, expired or refused.
         */
        UNAUTHORIZED(false),

        /**
         * The requested resource does not exist (unknown subreddit).
         */
        NOT_FOUND(false),

        /**
         * The remote side refused the request permanently (bad recipient, message rejected).
         */
        REJECTED(false),

        /**
         * The response could not be understood.
         */
        MALFORMED(false);

        private final boolean recoverable;

        ErrorType(boolean recoverable) {
            this.recoverable = recoverable;
        }

        public boolean isRecoverable() {
            return recoverable;
        }
    }

    protected ExternalServiceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected ExternalServiceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRecoverable() {
        return errorType.isRecoverable();
    }
}
