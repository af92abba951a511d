package work.cmdkernel.error;

/**
 * Classification of dispatch failures. Usage kinds never reach the caller as exceptions.
 */
public enum ErrorKind {
    NO_COMMAND_SPECIFIED(true),
    UNKNOWN_COMMAND(true),
    UNKNOWN_ACTION(true),
    NO_ACTION_SPECIFIED(true),
    UNKNOWN_OPTION(true),
    MISSING_OPTION_VALUE(true),
    UNEXPECTED_ARGUMENT(true),
    MISSING_REQUIRED_PARAMETER(true),
    CONVERSION_FAILURE(true),
    VALIDATION_FAILURE(true),
    MUTUAL_EXCLUSION_CONFLICT(true),
    EXECUTION_CANCELLED(false),
    EXECUTION_FAILED(false);

    private final boolean usage;

    ErrorKind(boolean usage) {
        this.usage = usage;
    }

    public boolean isUsage() {
        return usage;
    }
}
