package work.cmdkernel.error;

import java.util.List;
import java.util.Objects;

/**
 * Resolution or binding failure: what went wrong plus ranked suggestions for name-matching errors.
 */
public final class UsageException extends RuntimeException {
    private final ErrorKind kind;
    private final List<String> suggestions;

    public UsageException(ErrorKind kind, String message) {
        this(kind, message, List.of(), null);
    }

    public UsageException(ErrorKind kind, String message, List<String> suggestions) {
        this(kind, message, suggestions, null);
    }

    public UsageException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ErrorKind kind() {
        return kind;
    }

    public List<String> suggestions() {
        return suggestions;
    }
}
