package work.cmdkernel.api;

/**
 * Conventional process exit codes. Actions may return one of these to choose the exit code.
 */
public enum ExitCode {
    SUCCESS(0),
    ERROR(1),
    INVALID_ARGUMENTS(2),
    FILE_NOT_FOUND(3),
    PERMISSION_DENIED(4),
    NETWORK_ERROR(5),
    CANCELLED(6),
    CONFIGURATION_ERROR(7),
    RESOURCE_UNAVAILABLE(8),

    // sysexits.h
    USAGE(64),
    DATA_ERROR(65),
    NO_INPUT(66),
    NO_USER(67),
    NO_HOST(68),
    UNAVAILABLE(69),
    SOFTWARE(70),
    OS_ERROR(71),
    OS_FILE(72),
    CANT_CREATE(73),
    IO_ERROR(74),
    TEMP_FAIL(75),
    PROTOCOL(76),
    NO_PERMISSION(77),
    CONFIG(78);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
