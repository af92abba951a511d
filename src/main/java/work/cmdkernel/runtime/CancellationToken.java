package work.cmdkernel.runtime;

/**
 * Cooperative cancellation signal threaded through one dispatch call.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new DispatchCancelledException("Execution cancelled");
        }
    }
}
