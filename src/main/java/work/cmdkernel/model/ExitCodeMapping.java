package work.cmdkernel.model;

import java.util.Objects;

/**
 * Maps an exception type (and its subtypes, unless a closer mapping exists) to a process exit code.
 */
public record ExitCodeMapping(Class<? extends Throwable> exceptionType, int exitCode) {
    public ExitCodeMapping {
        Objects.requireNonNull(exceptionType, "exceptionType");
    }

    public static ExitCodeMapping of(Class<? extends Throwable> exceptionType, int exitCode) {
        return new ExitCodeMapping(exceptionType, exitCode);
    }
}
