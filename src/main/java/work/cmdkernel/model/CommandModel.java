package work.cmdkernel.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the command tree plus the options shared by every command. Immutable once built.
 */
public final class CommandModel {
    private final String name;
    private final String description;
    private final List<CommandNode> commands;
    private final List<ParameterSpec> globalOptions;

    private CommandModel(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.commands = List.copyOf(builder.commands);
        this.globalOptions = List.copyOf(builder.globalOptions);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<CommandNode> commands() {
        return commands;
    }

    public List<ParameterSpec> globalOptions() {
        return globalOptions;
    }

    public Optional<CommandNode> findCommand(String token) {
        return commands.stream().filter(command -> command.matches(token)).findFirst();
    }

    public Optional<ParameterSpec> findGlobalOption(String longName) {
        return globalOptions.stream().filter(option -> option.name().equals(longName)).findFirst();
    }

    public Optional<ParameterSpec> findGlobalShortOption(char shortName) {
        return globalOptions.stream()
            .filter(option -> option.shortName().map(c -> c == shortName).orElse(false))
            .findFirst();
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private final List<CommandNode> commands = new ArrayList<>();
        private final List<ParameterSpec> globalOptions = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Application name must not be blank");
            }
            this.name = name.trim();
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder command(CommandNode command) {
            commands.add(Objects.requireNonNull(command, "command"));
            return this;
        }

        public Builder command(CommandNode.Builder command) {
            return command(command.build());
        }

        public Builder globalOption(ParameterSpec option) {
            Objects.requireNonNull(option, "option");
            if (!option.isOption()) {
                throw new IllegalArgumentException("Global parameter '" + option.name() + "' must be an option");
            }
            globalOptions.add(option);
            return this;
        }

        public Builder globalOption(ParameterSpec.Builder option) {
            return globalOption(option.build());
        }

        public CommandModel build() {
            var seen = new HashMap<String, String>();
            for (CommandNode command : commands) {
                Names.claim(seen, "command '" + command.name() + "'", command.names(), "application '" + name + "'");
            }
            checkAliasesAcrossTree();
            var optionNames = new HashMap<String, String>();
            var shortNames = new HashMap<Character, String>();
            for (ParameterSpec option : globalOptions) {
                if (optionNames.putIfAbsent(option.name(), option.name()) != null) {
                    throw new IllegalStateException("Duplicate global option '--" + option.name() + "'");
                }
                var shortName = option.shortName();
                if (shortName.isPresent() && shortNames.putIfAbsent(shortName.get(), option.name()) != null) {
                    throw new IllegalStateException("Global short name '-" + shortName.get() + "' used twice");
                }
            }
            return new CommandModel(this);
        }

        private void checkAliasesAcrossTree() {
            var aliases = new HashMap<String, String>();
            var pending = new ArrayDeque<CommandNode>(commands);
            while (!pending.isEmpty()) {
                var node = pending.pop();
                Names.claim(aliases, "command '" + node.name() + "'", node.aliases(), "the command tree aliases");
                pending.addAll(node.children());
            }
        }
    }
}
