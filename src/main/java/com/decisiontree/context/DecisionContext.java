package com.decisiontree.context;

import java.util.Map;
import java.util.Optional;

/**
 * Named facts a decision tree is evaluated against.
 * <p>
 * Supplied fresh by the caller for each evaluation. Conditions only read it;
 * outcome actions may write to it. Nodes never retain a reference.
 */
public interface DecisionContext {

    /**
     * Get a raw value.
     *
     * @param key Fact name
     * @return Value, or empty if not set
     */
    Optional<Object> get(String key);

    /**
     * Check whether a fact is present.
     */
    boolean contains(String key);

    /**
     * Set a fact. A null value removes the key.
     *
     * @param key   Fact name
     * @param value New value
     */
    void put(String key, Object value);

    /**
     * Remove a fact.
     *
     * @return Previous value, or empty if not set
     */
    Optional<Object> remove(String key);

    /**
     * Get all facts as a read-only view.
     */
    Map<String, Object> asMap();

    /**
     * Resolve a fact as a long value.
     * Handles conversion from any {@link Number} and from numeric strings.
     * Fractions are truncated; values outside the long range are not converted.
     *
     * @param key Fact name
     * @return Long value, or empty if not found, not numeric or out of range
     */
    Optional<Long> getAsLong(String key);

    /**
     * Resolve a fact as a double value (for comparisons).
     *
     * @param key Fact name
     * @return Double value, or empty if not found or not numeric
     */
    Optional<Double> getAsDouble(String key);

    /**
     * Resolve a fact as an int. A value outside the int range is treated
     * like a non-numeric one and yields the default.
     */
    default int getInt(String key, int defaultValue) {
        return getAsLong(key)
                .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                .map(Long::intValue)
                .orElse(defaultValue);
    }

    default long getLong(String key, long defaultValue) {
        return getAsLong(key).orElse(defaultValue);
    }

    default double getDouble(String key, double defaultValue) {
        return getAsDouble(key).orElse(defaultValue);
    }

    default String getString(String key, String defaultValue) {
        return get(key).map(Object::toString).orElse(defaultValue);
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        Optional<Object> value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        Object raw = value.get();
        if (raw instanceof Boolean b) {
            return b;
        }
        String text = raw.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        return defaultValue;
    }

    /**
     * Wrap a copy of the given facts.
     */
    static DecisionContext of(Map<String, ?> facts) {
        return builder().putAll(facts).build();
    }

    /**
     * Create an empty context.
     */
    static DecisionContext empty() {
        return builder().build();
    }

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultDecisionContext.Builder();
    }

    /**
     * Builder for DecisionContext.
     */
    interface Builder {
        Builder put(String key, Object value);
        Builder putAll(Map<String, ?> facts);
        DecisionContext build();
    }
}
