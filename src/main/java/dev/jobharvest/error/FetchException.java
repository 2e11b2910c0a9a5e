package dev.jobharvest.error;

/**
 * Network failure, non-2xx status or malformed body from a fetched service.
 */
public class FetchException extends HarvestException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
