package com.bloodforecast.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Shortage risk, declared in ascending order of severity.
 */
public enum RiskLevel {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isAtLeast(RiskLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    public static List<RiskLevel> atLeast(RiskLevel threshold) {
        return Arrays.stream(values()).filter(r -> r.isAtLeast(threshold)).toList();
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value != null) {
            for (RiskLevel level : values()) {
                if (level.label.equalsIgnoreCase(value.trim()) || level.name().equalsIgnoreCase(value.trim())) {
                    return level;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unknown risk level '" + value + "'; expected one of Low, Medium, High, Critical");
    }
}
