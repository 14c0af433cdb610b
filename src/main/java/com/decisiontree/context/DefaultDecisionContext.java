package com.decisiontree.context;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of DecisionContext backed by a HashMap.
 * Not thread-safe.
 */
public final class DefaultDecisionContext implements DecisionContext {

    private static final double MIN_LONG_AS_DOUBLE = -0x1p63;
    private static final double MAX_LONG_AS_DOUBLE = 0x1p63;

    private final Map<String, Object> facts;

    private DefaultDecisionContext(Builder builder) {
        this.facts = new HashMap<>(builder.facts);
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(facts.get(key));
    }

    @Override
    public boolean contains(String key) {
        return facts.containsKey(key);
    }

    @Override
    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Fact name must not be null");
        }
        if (value == null) {
            facts.remove(key);
            return;
        }
        facts.put(key, value);
    }

    @Override
    public Optional<Object> remove(String key) {
        return Optional.ofNullable(facts.remove(key));
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(facts);
    }

    @Override
    public Optional<Long> getAsLong(String key) {
        return get(key).flatMap(DefaultDecisionContext::convertToLong);
    }

    @Override
    public Optional<Double> getAsDouble(String key) {
        return get(key).flatMap(DefaultDecisionContext::convertToDouble);
    }

    private static Optional<Long> convertToLong(Object value) {
        if (value instanceof Long l) {
            return Optional.of(l);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger b) {
            return b.bitLength() < Long.SIZE ? Optional.of(b.longValue()) : Optional.empty();
        }
        if (value instanceof Number n) {
            return truncate(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                try {
                    return truncate(Double.parseDouble(s.trim()));
                } catch (NumberFormatException e2) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    // Empty for NaN, infinities and anything the long range cannot hold
    private static Optional<Long> truncate(double value) {
        if (Double.isNaN(value) || value < MIN_LONG_AS_DOUBLE || value >= MAX_LONG_AS_DOUBLE) {
            return Optional.empty();
        }
        return Optional.of((long) value);
    }

    private static Optional<Double> convertToDouble(Object value) {
        if (value instanceof Double d) {
            return Optional.of(d);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "DecisionContext" + facts;
    }

    /**
     * Builder for DefaultDecisionContext.
     */
    public static class Builder implements DecisionContext.Builder {
        private final Map<String, Object> facts = new HashMap<>();

        @Override
        public Builder put(String key, Object value) {
            if (key != null && value != null) {
                this.facts.put(key, value);
            }
            return this;
        }

        @Override
        public Builder putAll(Map<String, ?> facts) {
            if (facts != null) {
                facts.forEach(this::put);
            }
            return this;
        }

        @Override
        public DecisionContext build() {
            return new DefaultDecisionContext(this);
        }
    }
}
