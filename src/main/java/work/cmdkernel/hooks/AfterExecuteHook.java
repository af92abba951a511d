package work.cmdkernel.hooks;

/**
 * Observes a successful result. Cannot change the result or the exit code.
 */
@FunctionalInterface
public interface AfterExecuteHook {
    void afterExecute(HookContext ctx, Object result) throws Exception;
}
