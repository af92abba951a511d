package work.cmdkernel.runtime;

/**
 * Thrown by actions and hooks that stop early because the dispatch was cancelled.
 */
public final class DispatchCancelledException extends RuntimeException {
    public DispatchCancelledException(String message) {
        super(message);
    }
}
