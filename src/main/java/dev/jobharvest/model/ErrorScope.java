package dev.jobharvest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorScope {
    CAREERS("careers"),
    JOB("job");

    private final String label;

    ErrorScope(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
