package work.cmdkernel.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Requires the whole string form of the value to match a regular expression.
 */
public final class PatternRule implements ValidationRule {
    private final Pattern pattern;
    private final String message;

    public PatternRule(String regex) {
        this(regex, null);
    }

    public PatternRule(String regex, String message) {
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"));
        this.message = message;
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public void validate(Object value, String parameterName) {
        var text = String.valueOf(value);
        if (pattern.matcher(text).matches()) {
            return;
        }
        var detail = message != null
            ? message
            : "Parameter '" + parameterName + "' value '" + text + "' does not match pattern " + pattern.pattern();
        throw new ValidationException(name(), value, detail);
    }
}
