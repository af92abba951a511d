package work.cmdkernel.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cmdkernel.api.Dispatcher;
import work.cmdkernel.error.ExecutionFailedException;

/**
 * Read-dispatch loop over a {@link Dispatcher}. Built-ins: {@code exit}/{@code quit},
 * {@code history [n]} and {@code help}; any other line is split and dispatched.
 */
public final class ShellHost {
    private static final Logger LOG = LoggerFactory.getLogger(ShellHost.class);

    private final Dispatcher dispatcher;
    private final BufferedReader in;
    private final PrintStream out;
    private final String prompt;
    private final CommandHistory history;
    private boolean active = true;
    private int lastExitCode;
    private int commandCount;

    public ShellHost(Dispatcher dispatcher, BufferedReader in, PrintStream out) {
        this(dispatcher, in, out, "> ", new CommandHistory());
    }

    public ShellHost(Dispatcher dispatcher, BufferedReader in, PrintStream out, String prompt, CommandHistory history) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.prompt = prompt == null ? "> " : prompt;
        this.history = history == null ? new CommandHistory() : history;
    }

    /**
     * Runs until {@code exit}, {@code quit} or end of input and returns the last exit code.
     */
    public int run() throws IOException {
        while (active) {
            out.print(prompt);
            out.flush();
            var line = in.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            history.add(line);
            execute(line);
        }
        return lastExitCode;
    }

    /**
     * Executes one line and records its exit code.
     */
    public int execute(String line) {
        List<String> args;
        try {
            args = CommandLineSplitter.split(line);
        } catch (IllegalArgumentException ex) {
            out.println("Error: " + ex.getMessage());
            return record(1);
        }
        if (args.isEmpty()) {
            return lastExitCode;
        }
        switch (args.get(0).toLowerCase(Locale.ROOT)) {
            case "exit", "quit" -> {
                active = false;
                return record(0);
            }
            case "history" -> {
                printHistory(args);
                return record(0);
            }
            case "help" -> {
                printHelp();
                return record(0);
            }
            default -> {
                try {
                    return record(dispatcher.dispatch(args.toArray(String[]::new)));
                } catch (ExecutionFailedException ex) {
                    LOG.debug("Shell command failed: {}", line, ex);
                    out.println("Error: " + ex.getMessage());
                    return record(1);
                }
            }
        }
    }

    public boolean isActive() {
        return active;
    }

    public int lastExitCode() {
        return lastExitCode;
    }

    public int commandCount() {
        return commandCount;
    }

    public CommandHistory history() {
        return history;
    }

    private int record(int exitCode) {
        commandCount++;
        lastExitCode = exitCode;
        return exitCode;
    }

    private void printHistory(List<String> args) {
        var entries = history.entries();
        if (args.size() > 1) {
            try {
                entries = history.last(Integer.parseInt(args.get(1)));
            } catch (NumberFormatException ex) {
                out.println("history: '" + args.get(1) + "' is not a number, showing everything");
            }
        }
        int start = history.size() - entries.size();
        for (int i = 0; i < entries.size(); i++) {
            out.printf("%5d  %s%n", start + i + 1, entries.get(i));
        }
    }

    private void printHelp() {
        out.println("Built-in commands:");
        out.println("  exit, quit     Leave the shell");
        out.println("  history [n]    Show the last n entered lines");
        out.println("  help           Show this message");
        out.println("Anything else is dispatched to " + dispatcher.model().name() + ".");
    }
}
