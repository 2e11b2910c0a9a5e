package dev.jobharvest.error;

/**
 * Persistent output was requested without the settings it needs.
 */
public class ConfigurationException extends HarvestException {

    public ConfigurationException(String message) {
        super(message);
    }
}
