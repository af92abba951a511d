package work.cmdkernel.validation;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Inclusive numeric range. Works for any {@link Number}; comparison is done on {@link BigDecimal}.
 */
public final class RangeRule implements ValidationRule {
    private final BigDecimal min;
    private final BigDecimal max;

    public RangeRule(Number min, Number max) {
        if (min == null && max == null) {
            throw new IllegalArgumentException("Range needs at least one bound");
        }
        this.min = min == null ? null : toDecimal(min);
        this.max = max == null ? null : toDecimal(max);
        if (this.min != null && this.max != null && this.min.compareTo(this.max) > 0) {
            throw new IllegalArgumentException("Range minimum " + min + " is greater than maximum " + max);
        }
    }

    public static RangeRule atLeast(Number min) {
        return new RangeRule(min, null);
    }

    public static RangeRule atMost(Number max) {
        return new RangeRule(null, max);
    }

    @Override
    public String name() {
        return "range";
    }

    @Override
    public void validate(Object value, String parameterName) {
        if (!(value instanceof Number number)) {
            throw new ValidationException(name(), value,
                "Parameter '" + parameterName + "' value '" + value + "' is not numeric");
        }
        if (isNonFinite(number)) {
            throw new ValidationException(name(), value,
                "Parameter '" + parameterName + "' value " + value + " is not a finite number");
        }
        var decimal = toDecimal(number);
        boolean below = min != null && decimal.compareTo(min) < 0;
        boolean above = max != null && decimal.compareTo(max) > 0;
        if (below || above) {
            throw new ValidationException(name(), value,
                "Parameter '" + parameterName + "' value " + value + " is outside the range " + describe());
        }
    }

    private String describe() {
        return "[" + (min == null ? "-inf" : min.toPlainString()) + ", " + (max == null ? "+inf" : max.toPlainString()) + "]";
    }

    private static boolean isNonFinite(Number number) {
        return (number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Range bound must be finite: " + number);
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
