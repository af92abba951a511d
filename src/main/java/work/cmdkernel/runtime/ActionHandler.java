package work.cmdkernel.runtime;

import work.cmdkernel.bind.ParameterValues;

/**
 * Body of an action. May return a plain value, an exit code, or a
 * {@link java.util.concurrent.CompletionStage} that the dispatcher awaits.
 */
@FunctionalInterface
public interface ActionHandler {
    Object invoke(InvocationContext ctx, ParameterValues values) throws Exception;
}
