package work.cmdkernel.runtime;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.cmdkernel.bind.ParameterValues;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandNode;

/**
 * Outcome of resolution and binding for one dispatch call.
 */
public record ResolvedInvocation(
    List<CommandNode> commandPath,
    ActionNode action,
    ParameterValues values,
    ParameterValues globalOptions,
    List<String> arguments
) {
    public ResolvedInvocation {
        commandPath = List.copyOf(commandPath);
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(values, "values");
        globalOptions = globalOptions == null ? ParameterValues.empty() : globalOptions;
        arguments = List.copyOf(arguments);
    }

    /**
     * Canonical command names joined by spaces, e.g. {@code "git remote"}.
     */
    public String commandPathText() {
        return commandPath.stream().map(CommandNode::name).collect(Collectors.joining(" "));
    }

    public String displayName() {
        var path = commandPathText();
        return path.isEmpty() ? action.name() : path + " " + action.name();
    }
}
