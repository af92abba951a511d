package work.cmdkernel.error;

/**
 * Unhandled failure of an action or hook, propagated out of the dispatcher. The original exception is the cause.
 */
public final class ExecutionFailedException extends RuntimeException {
    private final String commandPath;

    public ExecutionFailedException(String commandPath, Throwable cause) {
        super(buildMessage(commandPath, cause), cause);
        this.commandPath = commandPath;
    }

    public String commandPath() {
        return commandPath;
    }

    public ErrorKind kind() {
        return ErrorKind.EXECUTION_FAILED;
    }

    private static String buildMessage(String commandPath, Throwable cause) {
        var detail = cause == null ? "unknown error" : cause.getMessage();
        if (detail == null || detail.isBlank()) {
            detail = cause == null ? "unknown error" : cause.getClass().getSimpleName();
        }
        return "Command '" + commandPath + "' failed: " + detail;
    }
}
