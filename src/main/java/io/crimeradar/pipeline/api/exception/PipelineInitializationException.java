package io.crimeradar.pipeline.api.exception;

/**
 * Raised at startup when the pipeline cannot run at all: the event store
 * schema is unavailable or a supported language has no place extractor.
 */
public class PipelineInitializationException extends RuntimeException {

    public PipelineInitializationException(String message) {
        super(message);
    }

    public PipelineInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
