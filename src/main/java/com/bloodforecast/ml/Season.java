package com.bloodforecast.ml;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;

/**
 * Climate seasons of the northern Indian calendar used as a demand feature.
 * Post-Monsoon follows the heavy-rain months and carries the highest demand
 * multiplier (dengue/malaria aftermath).
 */
public enum Season {

    WINTER("Winter", 1.0, false),
    SUMMER("Summer", 0.9, false),
    MONSOON("Monsoon", 1.3, true),
    POST_MONSOON("Post-Monsoon", 1.8, true);

    private final String label;
    private final double demandMultiplier;
    private final boolean rainAdjacent;

    Season(String label, double demandMultiplier, boolean rainAdjacent) {
        this.label = label;
        this.demandMultiplier = demandMultiplier;
        this.rainAdjacent = rainAdjacent;
    }

    public String label() {
        return label;
    }

    public double demandMultiplier() {
        return demandMultiplier;
    }

    public boolean isRainAdjacent() {
        return rainAdjacent;
    }

    public static Season of(LocalDate date) {
        return switch (date.getMonthValue()) {
            case 12, 1, 2 -> WINTER;
            case 3, 4, 5 -> SUMMER;
            case 6, 7, 8, 9 -> MONSOON;
            default -> POST_MONSOON;
        };
    }

    public static Optional<Season> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(s -> s.label.equalsIgnoreCase(label.trim()) || s.name().equalsIgnoreCase(label.trim()))
            .findFirst();
    }
}
