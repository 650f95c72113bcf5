package com.bloodforecast.ml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public final class BloodTypes {

    public static final String PATTERN = "^(A|B|AB|O)[+-]$";

    /** Share of total demand per ABO/Rh group, most common first. */
    public static final Map<String, Double> DEMAND_WEIGHTS;

    public static final List<String> ALL;

    private static final Pattern COMPILED = Pattern.compile(PATTERN);

    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("O+", 0.35);
        weights.put("A+", 0.30);
        weights.put("B+", 0.20);
        weights.put("AB+", 0.05);
        weights.put("O-", 0.05);
        weights.put("A-", 0.03);
        weights.put("B-", 0.015);
        weights.put("AB-", 0.005);
        DEMAND_WEIGHTS = Collections.unmodifiableMap(weights);
        ALL = List.copyOf(weights.keySet());
    }

    private BloodTypes() {
    }

    public static boolean isValid(String bloodType) {
        return bloodType != null && COMPILED.matcher(bloodType).matches();
    }
}
