package work.cmdkernel.hooks;

import java.util.List;

/**
 * What the orchestrator produced when no exception escaped.
 */
public record HookOutcome(Status status, int exitCode, Object result, String message, List<String> messages, Throwable error) {
    public HookOutcome {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static HookOutcome completed(Object result) {
        return new HookOutcome(Status.COMPLETED, 0, result, null, List.of(), null);
    }

    public static HookOutcome cancelled(String reason, List<String> messages) {
        return new HookOutcome(Status.CANCELLED, 0, null, reason, messages, null);
    }

    public static HookOutcome handled(int exitCode, Throwable error) {
        return new HookOutcome(Status.HANDLED_ERROR, exitCode, null, error.getMessage(), List.of(), error);
    }

    public enum Status {
        COMPLETED,
        CANCELLED,
        HANDLED_ERROR
    }
}
