package io.crimeradar.pipeline.api.exception;

public class PageFetchException extends Exception {
    private final ErrorCategory category;

    public PageFetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public PageFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isTransient() {
        return switch (category) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, IO_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED -> true;
            default -> false;
        };
    }
}
