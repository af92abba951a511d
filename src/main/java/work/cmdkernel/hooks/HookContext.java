package work.cmdkernel.hooks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.cmdkernel.bind.ParameterValues;
import work.cmdkernel.runtime.CancellationToken;
import work.cmdkernel.runtime.ResolvedInvocation;

/**
 * State shared by the hooks of one dispatch.
 */
public final class HookContext {
    private final ResolvedInvocation invocation;
    private final CancellationToken cancellationToken;
    private final Map<String, Object> data;
    private final List<String> cancellationMessages = new ArrayList<>();

    public HookContext(ResolvedInvocation invocation, CancellationToken token, Map<String, Object> data) {
        this.invocation = Objects.requireNonNull(invocation, "invocation");
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.data = Objects.requireNonNull(data, "data");
    }

    public ResolvedInvocation invocation() {
        return invocation;
    }

    public String commandPath() {
        return invocation.commandPathText();
    }

    public String actionName() {
        return invocation.action().name();
    }

    public List<String> arguments() {
        return invocation.arguments();
    }

    public ParameterValues values() {
        return invocation.values();
    }

    public ParameterValues globalOptions() {
        return invocation.globalOptions();
    }

    /**
     * Mutable map shared with the action's {@link work.cmdkernel.runtime.InvocationContext} attributes.
     */
    public Map<String, Object> data() {
        return data;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public boolean isCancelled() {
        return !cancellationMessages.isEmpty();
    }

    public List<String> cancellationMessages() {
        return Collections.unmodifiableList(cancellationMessages);
    }

    /**
     * First cancellation message, i.e. the reason reported for the dispatch.
     */
    public String terminationReason() {
        return cancellationMessages.isEmpty() ? null : cancellationMessages.get(0);
    }

    void recordCancellation(String message) {
        cancellationMessages.add(message);
    }
}
