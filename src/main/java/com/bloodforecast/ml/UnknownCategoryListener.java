package com.bloodforecast.ml;

@FunctionalInterface
public interface UnknownCategoryListener {

    UnknownCategoryListener NONE = (column, value) -> { };

    void onUnknownCategory(String column, String value);
}
