package com.streamclient.common.configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Value types of configuration options and their conversion from raw property values
 */
public enum OptionType {
    STRING {
        @Override
        Object convert(Object raw) {
            return String.valueOf(raw).trim();
        }
    },
    INTEGER {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Number) {
                long value = exactLong((Number) raw);
                if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("out of integer range: " + raw);
                }
                return (int) value;
            }
            return Integer.parseInt(String.valueOf(raw).trim());
        }
    },
    LONG {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Number) {
                return exactLong((Number) raw);
            }
            return Long.parseLong(String.valueOf(raw).trim());
        }
    },
    DOUBLE {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Number) {
                return ((Number) raw).doubleValue();
            }
            return Double.parseDouble(String.valueOf(raw).trim());
        }
    },
    BOOLEAN {
        @Override
        Object convert(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            String value = String.valueOf(raw).trim();
            if ("true".equalsIgnoreCase(value)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(value)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("expected true or false");
        }
    },
    LIST {
        @Override
        Object convert(Object raw) {
            List<String> values = new ArrayList<>();
            if (raw instanceof Collection) {
                for (Object item : (Collection<?>) raw) {
                    addTrimmed(values, String.valueOf(item));
                }
            } else {
                for (String item : String.valueOf(raw).split(",")) {
                    addTrimmed(values, item);
                }
            }
            return Collections.unmodifiableList(values);
        }

        private void addTrimmed(List<String> values, String item) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
    };

    /**
     * Convert a raw value, throwing IllegalArgumentException when it does not fit the type
     */
    abstract Object convert(Object raw);

    /**
     * Whole numbers in long range only, whatever Number subtype the source produced
     */
    private static long exactLong(Number raw) {
        try {
            return new BigDecimal(raw.toString()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("expected a whole number, got " + raw);
        }
    }
}
