package work.cmdkernel.hooks;

/**
 * Called when a before-hook, the action or an after-hook fails.
 * Returning {@code true} marks the failure as handled.
 */
@FunctionalInterface
public interface ErrorHook {
    boolean onError(HookContext ctx, Throwable error) throws Exception;
}
