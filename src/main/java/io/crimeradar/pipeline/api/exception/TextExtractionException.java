package io.crimeradar.pipeline.api.exception;

/**
 * Article page could not be fetched or reduced to readable text.
 */
public class TextExtractionException extends Exception {
    private final ErrorCategory category;

    public TextExtractionException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public TextExtractionException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
