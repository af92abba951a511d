package work.cmdkernel.bind;

import java.io.Console;
import java.util.Arrays;

/**
 * Prompts on {@link System#console()}; secure prompts read without echo.
 */
public final class ConsolePrompter implements Prompter {
    private final Console console;

    public ConsolePrompter() {
        this(System.console());
    }

    ConsolePrompter(Console console) {
        this.console = console;
    }

    @Override
    public boolean isInteractive() {
        return console != null;
    }

    @Override
    public String prompt(String message, boolean secure) {
        if (console == null) {
            return null;
        }
        var label = message.endsWith(" ") ? message : message + ": ";
        if (!secure) {
            return console.readLine("%s", label);
        }
        char[] secret = console.readPassword("%s", label);
        if (secret == null) {
            return null;
        }
        try {
            return new String(secret);
        } finally {
            Arrays.fill(secret, '\0');
        }
    }
}
