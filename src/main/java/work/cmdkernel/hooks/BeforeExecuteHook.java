package work.cmdkernel.hooks;

@FunctionalInterface
public interface BeforeExecuteHook {
    HookDecision beforeExecute(HookContext ctx) throws Exception;
}
