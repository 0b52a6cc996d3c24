package com.kidzout.crawler.exception;

import lombok.Getter;

/**
 * Terminal failure of a fetch after the retry policy has been applied.
 */
@Getter
public class FetchException extends Exception {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;
    private final Integer statusCode;
    private final boolean timeout;
    private final int retries;

    public FetchException(Kind kind, String message, Integer statusCode, boolean timeout, int retries, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.timeout = timeout;
        this.retries = retries;
    }

    public static FetchException permanent(String message, Integer statusCode) {
        return new FetchException(Kind.PERMANENT, message, statusCode, false, 0, null);
    }

    public static FetchException transientFailure(String message, Integer statusCode, boolean timeout, Throwable cause) {
        return new FetchException(Kind.TRANSIENT, message, statusCode, timeout, 0, cause);
    }

    /**
     * Copy of this exception carrying the number of retries spent before giving up
     */
    public FetchException withRetries(int retries) {
        return new FetchException(kind, getMessage(), statusCode, timeout, retries, getCause());
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
