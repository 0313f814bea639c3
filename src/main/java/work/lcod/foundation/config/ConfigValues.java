package work.lcod.foundation.config;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the dynamic configuration value model.
 *
 * <p>A value is one of: a table ({@code Map<String, Object>}), an array ({@code List<Object>}),
 * {@link String}, {@link Long}, {@link Double}, {@link Boolean}, or a datetime
 * ({@link OffsetDateTime}, {@link LocalDateTime}, {@link LocalDate}, {@link LocalTime}).
 */
public final class ConfigValues {
    private ConfigValues() {}

    public static boolean isTable(Object value) {
        return value instanceof Map<?, ?>;
    }

    public static boolean isArray(Object value) {
        return value instanceof List<?>;
    }

    public static boolean isDatetime(Object value) {
        return value instanceof OffsetDateTime
            || value instanceof LocalDateTime
            || value instanceof LocalDate
            || value instanceof LocalTime;
    }

    public static boolean isScalar(Object value) {
        return value instanceof String
            || value instanceof Long
            || value instanceof Double
            || value instanceof Boolean
            || isDatetime(value);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asTable(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Object> asArray(Object value) {
        return (List<Object>) value;
    }

    /**
     * Deep-copies {@code value} into the mutable tree representation, widening numbers to
     * {@link Long}/{@link Double}.
     *
     * @throws IllegalArgumentException for {@code null}, non-string table keys or unsupported types
     */
    public static Object normalize(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Configuration values cannot be null");
        }
        if (value instanceof Map<?, ?> map) {
            var table = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Configuration table keys must be strings: " + entry.getKey());
                }
                table.put(key, normalize(entry.getValue()));
            }
            return table;
        }
        if (value instanceof List<?> list) {
            var array = new ArrayList<Object>(list.size());
            for (var item : list) {
                array.add(normalize(item));
            }
            return array;
        }
        if (value.getClass().isArray() && !(value instanceof char[])) {
            int length = Array.getLength(value);
            var array = new ArrayList<Object>(length);
            for (int i = 0; i < length; i++) {
                array.add(normalize(Array.get(value, i)));
            }
            return array;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("Integer out of 64-bit range: " + big, ex);
            }
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Character ch) {
            return String.valueOf(ch);
        }
        if (isScalar(value)) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported configuration value type: " + value.getClass().getName());
    }

    /**
     * Canonical text of a scalar, as spliced into strings by reference resolution.
     *
     * @throws IllegalArgumentException if {@code value} is a table or an array
     */
    public static String toDisplayString(Object value) {
        if (value instanceof String str) {
            return str;
        }
        if (value instanceof Long || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Double number) {
            return formatDouble(number);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime);
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof LocalTime time) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(time);
        }
        throw new IllegalArgumentException("Not a scalar configuration value: " + describe(value));
    }

    private static String formatDouble(double number) {
        if (Double.isNaN(number)) {
            return "nan";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "inf" : "-inf";
        }
        // BigDecimal.valueOf goes through Double.toString, the shortest text that reads back as the same double
        return BigDecimal.valueOf(number).toPlainString();
    }

    /**
     * Read-only deep view of a value, used once the tree has been handed off.
     */
    public static Object unmodifiable(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put((String) entry.getKey(), unmodifiable(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(unmodifiable(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (isTable(value)) {
            return "table";
        }
        if (isArray(value)) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }
}
