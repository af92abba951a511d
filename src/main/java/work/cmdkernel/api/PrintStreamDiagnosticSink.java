package work.cmdkernel.api;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes the message, then {@code Did you mean: a, b?} when there are suggestions.
 */
public final class PrintStreamDiagnosticSink implements DiagnosticSink {
    private final PrintStream out;

    public PrintStreamDiagnosticSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void report(Diagnostic diagnostic) {
        out.println(diagnostic.message());
        if (!diagnostic.suggestions().isEmpty()) {
            out.println("Did you mean: " + String.join(", ", diagnostic.suggestions()) + "?");
        }
        out.flush();
    }
}
