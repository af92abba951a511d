package work.cmdkernel.resolve;

import java.util.List;
import java.util.Objects;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandNode;

/**
 * Command path and action located by the resolver, with the tokens left for the binder.
 *
 * @param globalTokens option tokens (and their values) that came before the first command name
 * @param remaining tokens after the command path and action name
 */
public record ResolvedTarget(
    List<CommandNode> commandPath,
    ActionNode action,
    List<String> globalTokens,
    List<String> remaining
) {
    public ResolvedTarget {
        commandPath = List.copyOf(commandPath);
        Objects.requireNonNull(action, "action");
        globalTokens = List.copyOf(globalTokens);
        remaining = List.copyOf(remaining);
    }

    public CommandNode command() {
        return commandPath.get(commandPath.size() - 1);
    }
}
