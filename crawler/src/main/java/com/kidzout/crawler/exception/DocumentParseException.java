package com.kidzout.crawler.exception;

/**
 * A fetched document could not be interpreted as its declared format at all.
 */
public class DocumentParseException extends Exception {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
