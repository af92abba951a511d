package work.cmdkernel.bind;

/**
 * Interactive input used for parameters that declare a prompt.
 */
public interface Prompter {
    /**
     * Whether the process is attached to an interactive device. Prompts are skipped otherwise.
     */
    boolean isInteractive();

    /**
     * Shows the message and returns the answer, or {@code null} when nothing could be read.
     */
    String prompt(String message, boolean secure);

    static Prompter none() {
        return NoPrompter.INSTANCE;
    }

    enum NoPrompter implements Prompter {
        INSTANCE;

        @Override
        public boolean isInteractive() {
            return false;
        }

        @Override
        public String prompt(String message, boolean secure) {
            return null;
        }
    }
}
