package dev.jobharvest.model;

/**
 * A failure recorded at a Source or candidate boundary.
 */
public record ErrorEntry(ErrorScope scope, String url, String message) {
}
