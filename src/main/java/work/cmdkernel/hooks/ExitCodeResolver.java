package work.cmdkernel.hooks;

import java.util.List;
import java.util.OptionalInt;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandNode;
import work.cmdkernel.model.ExitCodeMapping;

/**
 * Nearest-ancestor lookup of exit-code mappings. Walks the exception's class chain; at each class
 * the action's mappings win over the command path's, innermost command first.
 */
public final class ExitCodeResolver {
    private ExitCodeResolver() {}

    public static int resolve(Throwable error, List<CommandNode> commandPath, ActionNode action, int fallback) {
        for (Class<?> type = error.getClass(); type != null && Throwable.class.isAssignableFrom(type); type = type.getSuperclass()) {
            var fromAction = find(action.exitCodeMappings(), type);
            if (fromAction.isPresent()) {
                return fromAction.getAsInt();
            }
            for (int i = commandPath.size() - 1; i >= 0; i--) {
                var fromCommand = find(commandPath.get(i).exitCodeMappings(), type);
                if (fromCommand.isPresent()) {
                    return fromCommand.getAsInt();
                }
            }
        }
        return fallback;
    }

    private static OptionalInt find(List<ExitCodeMapping> mappings, Class<?> type) {
        for (ExitCodeMapping mapping : mappings) {
            if (mapping.exceptionType() == type) {
                return OptionalInt.of(mapping.exitCode());
            }
        }
        return OptionalInt.empty();
    }
}
