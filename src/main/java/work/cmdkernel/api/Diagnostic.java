package work.cmdkernel.api;

import java.util.List;
import java.util.Objects;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;

/**
 * Structured report of a failed or cancelled dispatch.
 */
public record Diagnostic(ErrorKind kind, String message, List<String> suggestions) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static Diagnostic of(UsageException ex) {
        return new Diagnostic(ex.kind(), ex.getMessage(), ex.suggestions());
    }
}
