package work.cmdkernel.cli;

import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        return new CommandLine(new CmdkernelCommand(stdin, out, err))
            .setStopAtPositional(true)
            .setUnmatchedOptionsArePositionalParams(true)
            .setExpandAtFiles(false)
            .setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true))
            .setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true))
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .execute(args);
    }
}
