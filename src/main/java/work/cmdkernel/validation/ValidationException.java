package work.cmdkernel.validation;

/**
 * Raised when a converted value violates a {@link ValidationRule}.
 */
public final class ValidationException extends RuntimeException {
    private final String ruleName;
    private final Object value;

    public ValidationException(String ruleName, Object value, String message) {
        super(message);
        this.ruleName = ruleName;
        this.value = value;
    }

    public String ruleName() {
        return ruleName;
    }

    public Object value() {
        return value;
    }
}
