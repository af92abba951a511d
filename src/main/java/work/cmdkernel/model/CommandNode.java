package work.cmdkernel.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named node of the command tree holding sub-commands and actions.
 */
public final class CommandNode {
    private final String name;
    private final List<String> aliases;
    private final String description;
    private final boolean hidden;
    private final List<CommandNode> children;
    private final List<ActionNode> actions;
    private final List<HookSpec> hooks;
    private final List<ExitCodeMapping> exitCodeMappings;

    private CommandNode(Builder builder) {
        this.name = builder.name;
        this.aliases = List.copyOf(builder.aliases);
        this.description = builder.description;
        this.hidden = builder.hidden;
        this.children = List.copyOf(builder.children);
        this.actions = List.copyOf(builder.actions);
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

    public List<CommandNode> children() {
        return children;
    }

    public List<ActionNode> actions() {
        return actions;
    }

    public List<HookSpec> hooks() {
        return hooks;
    }

    public List<ExitCodeMapping> exitCodeMappings() {
        return exitCodeMappings;
    }

    public Optional<CommandNode> findChild(String token) {
        return children.stream().filter(child -> child.matches(token)).findFirst();
    }

    public Optional<ActionNode> findAction(String token) {
        return actions.stream().filter(action -> action.matches(token)).findFirst();
    }

    public Optional<ActionNode> primaryAction() {
        return actions.stream().filter(ActionNode::primary).findFirst();
    }

    @Override
    public String toString() {
        return "CommandNode[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<String> aliases = new ArrayList<>();
        private String description = "";
        private boolean hidden;
        private final List<CommandNode> children = new ArrayList<>();
        private final List<ActionNode> actions = new ArrayList<>();
        private final List<HookSpec> hooks = new ArrayList<>();
        private final List<ExitCodeMapping> exitCodeMappings = new ArrayList<>();

        private Builder(String name) {
            this.name = Names.requireName(name, "Command");
        }

        public Builder alias(String... names) {
            aliases.addAll(Names.cleanAliases(Arrays.asList(names), "Command"));
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

        public Builder child(CommandNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder child(CommandNode.Builder child) {
            return child(child.build());
        }

        public Builder action(ActionNode action) {
            actions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder action(ActionNode.Builder action) {
            return action(action.build());
        }

        public Builder hook(HookSpec hook) {
            hooks.add(Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public Builder exitCode(Class<? extends Throwable> exceptionType, int exitCode) {
            exitCodeMappings.add(ExitCodeMapping.of(exceptionType, exitCode));
            return this;
        }

        public CommandNode build() {
            var scope = "command '" + name + "'";
            Names.claim(new HashMap<>(), scope, selfNames(), "its own aliases");
            var seen = new HashMap<String, String>();
            for (CommandNode child : children) {
                Names.claim(seen, "command '" + child.name() + "'", child.names(), scope);
            }
            for (ActionNode action : actions) {
                Names.claim(seen, "action '" + action.name() + "'", action.names(), scope);
            }
            long primaries = actions.stream().filter(ActionNode::primary).count();
            if (primaries > 1) {
                throw new IllegalStateException("Command '" + name + "' declares " + primaries + " primary actions");
            }
            return new CommandNode(this);
        }

        private List<String> selfNames() {
            var all = new ArrayList<String>();
            all.add(name);
            all.addAll(aliases);
            return all;
        }
    }
}
