package work.cmdkernel.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.cmdkernel.error.ErrorKind;

/**
 * Outcome of a {@link Dispatcher} call that did not throw.
 */
public record DispatchResult(
    Status status,
    int exitCode,
    String message,
    ErrorKind errorKind,
    List<String> suggestions,
    Object result,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public DispatchResult {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static DispatchResult success(int exitCode, Object result, Instant startedAt) {
        return new DispatchResult(Status.SUCCESS, exitCode, null, null, List.of(), result, startedAt, Instant.now());
    }

    public static DispatchResult usageError(int exitCode, Diagnostic diagnostic, Instant startedAt) {
        return new DispatchResult(Status.USAGE_ERROR, exitCode, diagnostic.message(), diagnostic.kind(),
            diagnostic.suggestions(), null, startedAt, Instant.now());
    }

    public static DispatchResult cancelled(int exitCode, String reason, List<String> messages, Instant startedAt) {
        return new DispatchResult(Status.CANCELLED, exitCode, reason, ErrorKind.EXECUTION_CANCELLED,
            messages, null, startedAt, Instant.now());
    }

    public static DispatchResult handledError(int exitCode, String message, Instant startedAt) {
        return new DispatchResult(Status.HANDLED_ERROR, exitCode, message, ErrorKind.EXECUTION_FAILED,
            List.of(), null, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("exitCode", exitCode);
        if (message != null) {
            serializable.put("message", message);
        }
        if (errorKind != null) {
            serializable.put("errorKind", errorKind.name());
        }
        if (!suggestions.isEmpty()) {
            serializable.put("suggestions", suggestions);
        }
        if (result != null) {
            serializable.put("result", String.valueOf(result));
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS,
        USAGE_ERROR,
        CANCELLED,
        HANDLED_ERROR
    }
}
