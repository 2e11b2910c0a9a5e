package dev.jobharvest.error;

/**
 * Missing or invalid caller input, detected before any Source is processed.
 */
public class ValidationException extends HarvestException {

    public ValidationException(String message) {
        super(message);
    }
}
