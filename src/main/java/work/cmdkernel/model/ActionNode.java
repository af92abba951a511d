package work.cmdkernel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Invocable leaf of the command tree, bound to a handler by id.
 */
public final class ActionNode {
    private final String name;
    private final List<String> aliases;
    private final String description;
    private final boolean hidden;
    private final boolean primary;
    private final String handlerId;
    private final boolean returnsExitCode;
    private final List<ParameterSpec> parameters;
    private final List<HookSpec> hooks;
    private final List<ExitCodeMapping> exitCodeMappings;

    private ActionNode(Builder builder, List<ParameterSpec> parameters) {
        this.name = builder.name;
        this.aliases = List.copyOf(builder.aliases);
        this.description = builder.description;
        this.hidden = builder.hidden;
        this.primary = builder.primary;
        this.handlerId = builder.handlerId == null ? builder.name : builder.handlerId;
        this.returnsExitCode = builder.returnsExitCode;
        this.parameters = List.copyOf(parameters);
        this.hooks = List.copyOf(builder.hooks);
        this.exitCodeMappings = List.copyOf(builder.exitCodeMappings);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Canonical name followed by the aliases.
     */
    public List<String> names() {
        var names = new ArrayList<String>(aliases.size() + 1);
        names.add(name);
        names.addAll(aliases);
        return names;
    }

    public boolean matches(String token) {
        return token != null && names().stream().anyMatch(candidate -> candidate.equalsIgnoreCase(token));
    }

    public String description() {
        return description;
    }

    public boolean hidden() {
        return hidden;
    }

    public boolean primary() {
        return primary;
    }

    public String handlerId() {
        return handlerId;
    }

    public boolean returnsExitCode() {
        return returnsExitCode;
    }

    public List<ParameterSpec> parameters() {
        return parameters;
    }

    public List<ParameterSpec> options() {
        return parameters.stream().filter(ParameterSpec::isOption).toList();
    }

    /**
     * Positional arguments in position order.
     */
    public List<ParameterSpec> arguments() {
        return parameters.stream().filter(ParameterSpec::isArgument).toList();
    }

    public boolean hasArguments() {
        return parameters.stream().anyMatch(ParameterSpec::isArgument);
    }

    public Optional<ParameterSpec> findOption(String longName) {
        return parameters.stream().filter(p -> p.isOption() && p.name().equals(longName)).findFirst();
    }

    public Optional<ParameterSpec> findShortOption(char shortName) {
        return parameters.stream()
            .filter(p -> p.isOption() && p.shortName().map(c -> c == shortName).orElse(false))
            .findFirst();
    }

    public List<HookSpec> hooks() {
        return hooks;
    }

    public List<ExitCodeMapping> exitCodeMappings() {
        return exitCodeMappings;
    }

    @Override
    public String toString() {
        return "ActionNode[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<String> aliases = new ArrayList<>();
        private String description = "";
        private boolean hidden;
        private boolean primary;
        private String handlerId;
        private boolean returnsExitCode;
        private final List<ParameterSpec> parameters = new ArrayList<>();
        private final List<HookSpec> hooks = new ArrayList<>();
        private final List<ExitCodeMapping> exitCodeMappings = new ArrayList<>();

        private Builder(String name) {
            this.name = Names.requireName(name, "Action");
        }

        public Builder alias(String... names) {
            aliases.addAll(Names.cleanAliases(Arrays.asList(names), "Action"));
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

        public Builder primary() {
            return primary(true);
        }

        public Builder primary(boolean primary) {
            this.primary = primary;
            return this;
        }

        public Builder handler(String handlerId) {
            this.handlerId = handlerId == null || handlerId.isBlank() ? null : handlerId.trim();
            return this;
        }

        public Builder returnsExitCode() {
            return returnsExitCode(true);
        }

        public Builder returnsExitCode(boolean returnsExitCode) {
            this.returnsExitCode = returnsExitCode;
            return this;
        }

        public Builder parameter(ParameterSpec parameter) {
            parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public Builder parameter(ParameterSpec.Builder parameter) {
            return parameter(parameter.build());
        }

        public Builder hook(HookSpec hook) {
            hooks.add(Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public Builder exitCode(Class<? extends Throwable> exceptionType, int exitCode) {
            exitCodeMappings.add(ExitCodeMapping.of(exceptionType, exitCode));
            return this;
        }

        public ActionNode build() {
            Names.claim(new HashMap<>(), "action '" + name + "'", withAliases(), "its own aliases");

            var parameterNames = new HashMap<String, String>();
            var shortNames = new HashMap<Character, String>();
            var positioned = new ArrayList<ParameterSpec>();
            int position = 0;
            ParameterSpec lastArgument = null;
            for (ParameterSpec parameter : parameters) {
                var previous = parameterNames.putIfAbsent(parameter.name(), parameter.name());
                if (previous != null) {
                    throw new IllegalStateException("Duplicate parameter '" + parameter.name() + "' in action '" + name + "'");
                }
                if (parameter.shortName().isPresent()) {
                    char shortName = parameter.shortName().get();
                    if (shortNames.putIfAbsent(shortName, parameter.name()) != null) {
                        throw new IllegalStateException("Short name '-" + shortName + "' used twice in action '" + name + "'");
                    }
                }
                if (parameter.isArgument()) {
                    if (lastArgument != null && lastArgument.type().isCollection()) {
                        throw new IllegalStateException("Collection argument '" + lastArgument.name()
                            + "' must be the last positional argument of action '" + name + "'");
                    }
                    var placed = parameter.withPosition(position++);
                    positioned.add(placed);
                    lastArgument = placed;
                } else {
                    positioned.add(parameter);
                }
            }
            return new ActionNode(this, positioned);
        }

        private List<String> withAliases() {
            var all = new ArrayList<String>();
            all.add(name);
            all.addAll(aliases);
            return all;
        }
    }
}
