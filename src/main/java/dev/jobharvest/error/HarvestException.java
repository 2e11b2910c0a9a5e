package dev.jobharvest.error;

/**
 * Base type for every failure raised by the harvest pipeline.
 */
public class HarvestException extends RuntimeException {

    public HarvestException(String message) {
        super(message);
    }

    public HarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
