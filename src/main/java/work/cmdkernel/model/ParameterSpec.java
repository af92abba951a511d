package work.cmdkernel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.cmdkernel.convert.TypeDescriptor;
import work.cmdkernel.validation.ValidationRule;

/**
 * A named option or positional argument of an action (or a global option of the model).
 */
public final class ParameterSpec {
    private final ParameterKind kind;
    private final String name;
    private final Character shortName;
    private final int position;
    private final boolean required;
    private final Object defaultValue;
    private final String envVar;
    private final String prompt;
    private final boolean securePrompt;
    private final TypeDescriptor type;
    private final String mutuallyExclusiveSet;
    private final List<ValidationRule> validations;
    private final String description;
    private final boolean hidden;

    private ParameterSpec(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.shortName = builder.shortName;
        this.position = builder.kind == ParameterKind.ARGUMENT ? 0 : -1;
        this.required = builder.required;
        this.defaultValue = builder.defaultValue;
        this.envVar = builder.envVar;
        this.prompt = builder.prompt;
        this.securePrompt = builder.securePrompt;
        this.type = builder.type;
        this.mutuallyExclusiveSet = builder.mutuallyExclusiveSet;
        this.validations = List.copyOf(builder.validations);
        this.description = builder.description;
        this.hidden = builder.hidden;
    }

    private ParameterSpec(ParameterSpec source, int position) {
        this.kind = source.kind;
        this.name = source.name;
        this.shortName = source.shortName;
        this.position = position;
        this.required = source.required;
        this.defaultValue = source.defaultValue;
        this.envVar = source.envVar;
        this.prompt = source.prompt;
        this.securePrompt = source.securePrompt;
        this.type = source.type;
        this.mutuallyExclusiveSet = source.mutuallyExclusiveSet;
        this.validations = source.validations;
        this.description = source.description;
        this.hidden = source.hidden;
    }

    public static Builder option(String name) {
        return new Builder(ParameterKind.OPTION, name);
    }

    public static Builder argument(String name) {
        return new Builder(ParameterKind.ARGUMENT, name);
    }

    ParameterSpec withPosition(int newPosition) {
        return newPosition == position ? this : new ParameterSpec(this, newPosition);
    }

    public ParameterKind kind() {
        return kind;
    }

    public boolean isOption() {
        return kind == ParameterKind.OPTION;
    }

    public boolean isArgument() {
        return kind == ParameterKind.ARGUMENT;
    }

    public String name() {
        return name;
    }

    public Optional<Character> shortName() {
        return Optional.ofNullable(shortName);
    }

    /**
     * Zero-based index among the action's positional arguments, or -1 for options.
     */
    public int position() {
        return position;
    }

    public boolean required() {
        return required;
    }

    public Optional<Object> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public Optional<String> envVar() {
        return Optional.ofNullable(envVar);
    }

    public Optional<String> prompt() {
        return Optional.ofNullable(prompt);
    }

    public boolean securePrompt() {
        return securePrompt;
    }

    public TypeDescriptor type() {
        return type;
    }

    /**
     * Boolean options are flags: they take no value token.
     */
    public boolean isFlag() {
        return isOption() && type.isBoolean();
    }

    public Optional<String> mutuallyExclusiveSet() {
        return Optional.ofNullable(mutuallyExclusiveSet);
    }

    public List<ValidationRule> validations() {
        return validations;
    }

    public String description() {
        return description;
    }

    public boolean hidden() {
        return hidden;
    }

    /**
     * How the parameter is written on the command line, used in diagnostics.
     */
    public String displayName() {
        if (isOption()) {
            return "--" + name;
        }
        return "<" + name + "> (position " + position + ")";
    }

    @Override
    public String toString() {
        return displayName() + ": " + type.displayName();
    }

    public static final class Builder {
        private final ParameterKind kind;
        private final String name;
        private Character shortName;
        private boolean required;
        private Object defaultValue;
        private String envVar;
        private String prompt;
        private boolean securePrompt;
        private TypeDescriptor type = TypeDescriptor.string();
        private String mutuallyExclusiveSet;
        private final List<ValidationRule> validations = new ArrayList<>();
        private String description = "";
        private boolean hidden;

        private Builder(ParameterKind kind, String name) {
            this.kind = kind;
            this.name = Names.requireName(name, kind == ParameterKind.OPTION ? "Option" : "Argument");
        }

        public Builder shortName(char shortName) {
            if (Character.isWhitespace(shortName) || shortName == '-') {
                throw new IllegalArgumentException("Invalid short name '" + shortName + "' for " + name);
            }
            this.shortName = shortName;
            return this;
        }

        public Builder type(TypeDescriptor type) {
            this.type = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder type(Class<?> type) {
            return type(TypeDescriptor.of(type));
        }

        public Builder required() {
            return required(true);
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder envVar(String envVar) {
            this.envVar = envVar == null || envVar.isBlank() ? null : envVar.trim();
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt == null || prompt.isBlank() ? null : prompt;
            this.securePrompt = false;
            return this;
        }

        public Builder securePrompt(String prompt) {
            prompt(prompt);
            this.securePrompt = this.prompt != null;
            return this;
        }

        public Builder mutuallyExclusive(String group) {
            this.mutuallyExclusiveSet = group == null || group.isBlank() ? null : group.trim();
            return this;
        }

        public Builder validate(ValidationRule... rules) {
            validations.addAll(Arrays.asList(rules));
            return this;
        }

        public Builder validations(List<ValidationRule> rules) {
            validations.addAll(rules);
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder hidden() {
            return hidden(true);
        }

        public Builder hidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public ParameterSpec build() {
            if (kind == ParameterKind.ARGUMENT && shortName != null) {
                throw new IllegalStateException("Positional argument '" + name + "' cannot have a short name");
            }
            if (required && defaultValue != null) {
                throw new IllegalStateException("Required parameter '" + name + "' cannot declare a default value");
            }
            if (kind == ParameterKind.OPTION && type.isBoolean()) {
                if (required) {
                    throw new IllegalStateException("Boolean option '" + name + "' cannot be required");
                }
                if (defaultValue == null) {
                    defaultValue = Boolean.FALSE;
                }
            }
            return new ParameterSpec(this);
        }
    }
}
