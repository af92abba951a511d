package work.cmdkernel.api;

/**
 * Exit codes and suggestion limits used by a {@link Dispatcher}.
 */
public record DispatcherSettings(
    int usageExitCode,
    int cancelledExitCode,
    int failureExitCode,
    int commandSuggestionDistance,
    int suggestionDistance,
    int maxSuggestions,
    boolean promptsEnabled
) {
    public DispatcherSettings {
        if (usageExitCode == 0 || cancelledExitCode == 0 || failureExitCode == 0) {
            throw new IllegalArgumentException("Usage, cancellation and failure exit codes must be non-zero");
        }
        if (commandSuggestionDistance < 0 || suggestionDistance < 0 || maxSuggestions < 0) {
            throw new IllegalArgumentException("Suggestion limits must not be negative");
        }
    }

    public static DispatcherSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .usageExitCode(usageExitCode)
            .cancelledExitCode(cancelledExitCode)
            .failureExitCode(failureExitCode)
            .commandSuggestionDistance(commandSuggestionDistance)
            .suggestionDistance(suggestionDistance)
            .maxSuggestions(maxSuggestions)
            .promptsEnabled(promptsEnabled);
    }

    public static final class Builder {
        private int usageExitCode = ExitCode.INVALID_ARGUMENTS.code();
        private int cancelledExitCode = ExitCode.CANCELLED.code();
        private int failureExitCode = ExitCode.ERROR.code();
        private int commandSuggestionDistance = 3;
        private int suggestionDistance = 2;
        private int maxSuggestions = 3;
        private boolean promptsEnabled = true;

        public Builder usageExitCode(int usageExitCode) {
            this.usageExitCode = usageExitCode;
            return this;
        }

        public Builder cancelledExitCode(int cancelledExitCode) {
            this.cancelledExitCode = cancelledExitCode;
            return this;
        }

        public Builder failureExitCode(int failureExitCode) {
            this.failureExitCode = failureExitCode;
            return this;
        }

        public Builder commandSuggestionDistance(int commandSuggestionDistance) {
            this.commandSuggestionDistance = commandSuggestionDistance;
            return this;
        }

        public Builder suggestionDistance(int suggestionDistance) {
            this.suggestionDistance = suggestionDistance;
            return this;
        }

        public Builder maxSuggestions(int maxSuggestions) {
            this.maxSuggestions = maxSuggestions;
            return this;
        }

        public Builder promptsEnabled(boolean promptsEnabled) {
            this.promptsEnabled = promptsEnabled;
            return this;
        }

        public DispatcherSettings build() {
            return new DispatcherSettings(
                usageExitCode,
                cancelledExitCode,
                failureExitCode,
                commandSuggestionDistance,
                suggestionDistance,
                maxSuggestions,
                promptsEnabled
            );
        }
    }
}
