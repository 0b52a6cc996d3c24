package com.kidzout.crawler.exception;

/**
 * Raised by an enrichment step, or by the enricher when a record lacks its mandatory fields.
 */
public class EnrichmentException extends Exception {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
