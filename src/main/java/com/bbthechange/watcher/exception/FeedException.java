package com.bbthechange.watcher.exception;

/**
 * Exception thrown when fetching items from the feed API fails.
 */
public class FeedException extends ExternalServiceException {

    private final String sourceUnit;

    public FeedException(ErrorType errorType, String sourceUnit, String message) {
        super(errorType, message);
        this.sourceUnit = sourceUnit;
    }

    public FeedException(ErrorType errorType, String sourceUnit, String message, Throwable cause) {
        super(errorType, message, cause);
        this.sourceUnit = sourceUnit;
    }

    public String getSourceUnit() {
        return sourceUnit;
    }

    /**
     * Factory method for HTTP 429.
     */
    public static FeedException rateLimited(String sourceUnit) {
        return new FeedException(ErrorType.RATE_LIMITED, sourceUnit,
                "Rate limited by feed API while fetching r/" + sourceUnit);
    }

    /**
     * Factory method for 5xx responses and connection failures.
     */
    public static FeedException unavailable(String sourceUnit, String detail, Throwable cause) {
        return new FeedException(ErrorType.UNAVAILABLE, sourceUnit,
                "Feed API unavailable for r/" + sourceUnit + ": " + detail, cause);
    }

    public static FeedException timeout(String sourceUnit, Throwable cause) {
        return new FeedException(ErrorType.TIMEOUT, sourceUnit,
                "Feed API timed out for r/" + sourceUnit, cause);
    }

    public static FeedException unauthorized(String sourceUnit, int statusCode) {
        return new FeedException(ErrorType.UNAUTHORIZED, sourceUnit,
                "Feed API refused credentials (HTTP " + statusCode + ") for r/" + sourceUnit);
    }

    public static FeedException notFound(String sourceUnit) {
        return new FeedException(ErrorType.NOT_FOUND, sourceUnit,
                "Source unit not found: r/" + sourceUnit);
    }

    public static FeedException malformed(String sourceUnit, Throwable cause) {
        return new FeedException(ErrorType.MALFORMED, sourceUnit,
                "Could not parse feed listing for r/" + sourceUnit, cause);
    }
}
