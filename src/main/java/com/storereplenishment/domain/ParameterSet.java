package com.storereplenishment.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of calibration parameter values. Missing keys read as their default.
 */
public final class ParameterSet {

    private final Map<ParameterKey, Double> values;

    private ParameterSet(Map<ParameterKey, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ParameterSet defaults() {
        return new ParameterSet(new EnumMap<>(ParameterKey.class));
    }

    public static ParameterSet of(Map<ParameterKey, Double> values) {
        EnumMap<ParameterKey, Double> copy = new EnumMap<>(ParameterKey.class);
        copy.putAll(values);
        return new ParameterSet(copy);
    }

    public double get(ParameterKey key) {
        Double value = values.get(key);
        return value != null ? value : key.defaultValue();
    }

    public ParameterSet with(ParameterKey key, double value) {
        EnumMap<ParameterKey, Double> copy = new EnumMap<>(ParameterKey.class);
        copy.putAll(values);
        copy.put(key, value);
        return new ParameterSet(copy);
    }

    public Map<ParameterKey, Double> asMap() {
        EnumMap<ParameterKey, Double> all = new EnumMap<>(ParameterKey.class);
        for (ParameterKey key : ParameterKey.values()) {
            all.put(key, get(key));
        }
        return all;
    }

    @Override
    public String toString() {
        return "ParameterSet" + asMap();
    }
}
