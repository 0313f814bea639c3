package work.lcod.foundation.config.source;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Turns the raw text of an environment variable or command line override into the most specific
 * configuration scalar.
 */
public final class ValueCoercion {
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ValueCoercion() {}

    /**
     * {@code true}/{@code false} (any case) become booleans, an optional {@code -} followed by
     * digits becomes a long when it fits, text containing {@code .} becomes a double when it
     * reads as one, anything else stays a string.
     */
    public static Object coerce(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(raw).matches()) {
            var value = new BigInteger(raw);
            if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
                return value.longValue();
            }
        }
        if (raw.indexOf('.') >= 0 && DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        return raw;
    }
}
