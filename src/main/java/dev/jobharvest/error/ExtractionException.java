package dev.jobharvest.error;

/**
 * The oracle exhausted its retry budget, or a deterministic parser met a payload
 * it could not map.
 */
public class ExtractionException extends HarvestException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
