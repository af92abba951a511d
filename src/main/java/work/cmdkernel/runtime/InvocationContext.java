package work.cmdkernel.runtime;

import java.util.Map;
import java.util.Objects;
import work.cmdkernel.bind.ParameterValues;
import work.cmdkernel.model.ActionNode;

/**
 * Context handed to an action: its bound values, the global options, the cancellation token and
 * attributes shared with the hooks of the same dispatch.
 */
public final class InvocationContext {
    private final ResolvedInvocation invocation;
    private final CancellationToken cancellationToken;
    private final Map<String, Object> attributes;

    public InvocationContext(ResolvedInvocation invocation, CancellationToken token, Map<String, Object> attributes) {
        this.invocation = Objects.requireNonNull(invocation, "invocation");
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    public ResolvedInvocation invocation() {
        return invocation;
    }

    public ActionNode action() {
        return invocation.action();
    }

    public ParameterValues values() {
        return invocation.values();
    }

    public ParameterValues globalOptions() {
        return invocation.globalOptions();
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public void ensureNotCancelled() {
        cancellationToken.throwIfCancelled();
    }
}
