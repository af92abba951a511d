package work.cmdkernel.validation;

/**
 * Declarative constraint applied to a converted parameter value.
 */
public interface ValidationRule {
    String name();

    void validate(Object value, String parameterName) throws ValidationException;
}
