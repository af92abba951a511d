package work.cmdkernel.api;

@FunctionalInterface
public interface DiagnosticSink {
    void report(Diagnostic diagnostic);

    static DiagnosticSink standardError() {
        return new PrintStreamDiagnosticSink(System.err);
    }
}
