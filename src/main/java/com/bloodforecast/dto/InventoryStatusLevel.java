package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InventoryStatusLevel {

    CRITICAL("Critical"),
    LOW("Low"),
    ADEQUATE("Adequate"),
    EXCESS("Excess");

    private final String label;

    InventoryStatusLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
