package com.taskboard.actions;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Field values of one action after alias resolution.
 */
public class ResolvedParams {

    private final Map<String, String> values;
    private final List<String> missing;

    public ResolvedParams(Map<String, String> values, List<String> missing) {
        this.values = values;
        this.missing = missing;
    }

    public String get(String field) {
        return values.get(field);
    }

    public String getOrDefault(String field, String fallback) {
        String value = values.get(field);
        return value != null ? value : fallback;
    }

    /**
     * Integer value of the field, or the fallback when absent. Non-numeric text is rejected.
     */
    public int getInt(String field, int fallback) {
        String value = values.get(field);
        if (value == null) {
            return fallback;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + field + "' is not a number: " + value);
        }
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }

    public List<String> getMissing() {
        return Collections.unmodifiableList(missing);
    }
}
