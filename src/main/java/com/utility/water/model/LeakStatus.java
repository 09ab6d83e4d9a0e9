package com.utility.water.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LeakStatus {
    NORMAL("Normal"),
    POTENTIAL_LEAK("Potential Leak"),
    LEAK_DETECTED("Leak Detected");

    private final String label;

    LeakStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
