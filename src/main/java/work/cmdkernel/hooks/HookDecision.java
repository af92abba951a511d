package work.cmdkernel.hooks;

/**
 * Result of a before-hook: proceed, or cancel the action with a message.
 */
public record HookDecision(boolean cancelled, String message) {
    private static final HookDecision PROCEED = new HookDecision(false, null);

    public static HookDecision proceed() {
        return PROCEED;
    }

    public static HookDecision cancel(String message) {
        return new HookDecision(true, message == null || message.isBlank() ? "Execution cancelled" : message);
    }
}
