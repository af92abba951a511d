package work.cmdkernel.bind;

/**
 * Where a bound value came from, highest precedence first.
 */
public enum ValueSource {
    COMMAND_LINE,
    ENVIRONMENT,
    PROMPT,
    DEFAULT,
    ABSENT;

    /**
     * True for values the user supplied rather than ones the model filled in.
     */
    public boolean isExplicit() {
        return this == COMMAND_LINE || this == ENVIRONMENT || this == PROMPT;
    }
}
