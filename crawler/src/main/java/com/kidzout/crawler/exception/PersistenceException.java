package com.kidzout.crawler.exception;

/**
 * Writing run output failed. Aborts the run; a failed write is never reported as success.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
