package com.ciflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameterization of a job template: ordered axes with ordered values, plus optional
 * exclude and include entries.
 *
 * <p>Matrix definitions are immutable once built. All values are strings; numbers and booleans
 * in a definition document are kept in their textual form.</p>
 */
public final class Matrix {
    private final Map<String, List<String>> axes;
    private final List<Map<String, String>> include;
    private final List<Map<String, String>> exclude;
    private final boolean failFast;

    private Matrix(Builder builder) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.axes.forEach((axis, values) -> copy.put(axis, List.copyOf(values)));
        this.axes = Collections.unmodifiableMap(copy);
        this.include = copyEntries(builder.include);
        this.exclude = copyEntries(builder.exclude);
        this.failFast = builder.failFast;
    }

    private static List<Map<String, String>> copyEntries(List<Map<String, String>> entries) {
        List<Map<String, String>> copy = new ArrayList<>();
        for (Map<String, String> entry : entries) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(entry)));
        }
        return Collections.unmodifiableList(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<String>> getAxes() {
        return axes;
    }

    public List<Map<String, String>> getInclude() {
        return include;
    }

    public List<Map<String, String>> getExclude() {
        return exclude;
    }

    /**
     * When true (the default), a failed instance cancels its not-yet-terminal siblings.
     */
    public boolean isFailFast() {
        return failFast;
    }

    public static final class Builder {
        private final Map<String, List<String>> axes = new LinkedHashMap<>();
        private final List<Map<String, String>> include = new ArrayList<>();
        private final List<Map<String, String>> exclude = new ArrayList<>();
        private boolean failFast = true;

        private Builder() {
        }

        public Builder axis(String name, List<String> values) {
            axes.put(name, values);
            return this;
        }

        public Builder include(Map<String, String> entry) {
            include.add(entry);
            return this;
        }

        public Builder exclude(Map<String, String> entry) {
            exclude.add(entry);
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Matrix build() {
            return new Matrix(this);
        }
    }
}
