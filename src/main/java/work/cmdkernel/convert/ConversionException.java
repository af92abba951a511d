package work.cmdkernel.convert;

/**
 * Raised when a raw token cannot be converted to the requested type.
 */
public final class ConversionException extends RuntimeException {
    private final String rawValue;
    private final String expectedType;

    public ConversionException(String rawValue, String expectedType, String detail) {
        this(rawValue, expectedType, detail, null);
    }

    public ConversionException(String rawValue, String expectedType, String detail, Throwable cause) {
        super(buildMessage(rawValue, expectedType, detail), cause);
        this.rawValue = rawValue;
        this.expectedType = expectedType;
    }

    public String rawValue() {
        return rawValue;
    }

    public String expectedType() {
        return expectedType;
    }

    private static String buildMessage(String rawValue, String expectedType, String detail) {
        var message = "Invalid value '" + rawValue + "': expected " + expectedType;
        if (detail != null && !detail.isBlank()) {
            message += " (" + detail + ")";
        }
        return message;
    }
}
