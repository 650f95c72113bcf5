package com.bloodforecast.ml;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Maps the values of one categorical column to dense integer codes.
 * <p>
 * Codes are assigned in sorted value order, so fitting the same vocabulary twice
 * yields the same codes. Values never seen during {@link #fit} encode to
 * {@link #FALLBACK_CODE} and are reported to the supplied listener.
 */
public final class CategoryEncoder implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final int FALLBACK_CODE = 0;

    private final String column;
    private final Map<String, Integer> codes;

    private CategoryEncoder(String column, Map<String, Integer> codes) {
        this.column = column;
        this.codes = codes;
    }

    public static CategoryEncoder fit(String column, Collection<String> values) {
        Objects.requireNonNull(column, "column");
        TreeSet<String> distinct = new TreeSet<>();
        for (String value : values) {
            if (value != null) {
                distinct.add(value);
            }
        }
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (String value : distinct) {
            codes.put(value, codes.size());
        }
        return new CategoryEncoder(column, Collections.unmodifiableMap(codes));
    }

    public int encode(String value, UnknownCategoryListener listener) {
        Integer code = value != null ? codes.get(value) : null;
        if (code == null) {
            listener.onUnknownCategory(column, value);
            return FALLBACK_CODE;
        }
        return code;
    }

    public int encode(String value) {
        return encode(value, UnknownCategoryListener.NONE);
    }

    public boolean contains(String value) {
        return value != null && codes.containsKey(value);
    }

    public String column() {
        return column;
    }

    public int size() {
        return codes.size();
    }

    public Collection<String> vocabulary() {
        return codes.keySet();
    }
}
