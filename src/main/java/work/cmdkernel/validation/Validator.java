package work.cmdkernel.validation;

import java.util.Collection;
import java.util.List;

/**
 * Applies rules in declaration order; the first failing rule stops validation.
 */
public final class Validator {
    private Validator() {}

    public static void validate(List<ValidationRule> rules, Object value, String parameterName) {
        if (rules == null || rules.isEmpty() || value == null) {
            return;
        }
        for (ValidationRule rule : rules) {
            if (value instanceof Collection<?> items) {
                for (Object item : items) {
                    rule.validate(item, parameterName);
                }
            } else {
                rule.validate(value, parameterName);
            }
        }
    }
}
