package work.cmdkernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.cmdkernel.hooks.AfterExecuteHook;
import work.cmdkernel.hooks.BeforeExecuteHook;
import work.cmdkernel.hooks.ErrorHook;

/**
 * Stores action handlers and hook implementations under the ids the command model refers to.
 */
public final class HandlerRegistry {
    private final Map<String, ActionHandler> actions = new ConcurrentHashMap<>();
    private final Map<String, BeforeExecuteHook> beforeHooks = new ConcurrentHashMap<>();
    private final Map<String, AfterExecuteHook> afterHooks = new ConcurrentHashMap<>();
    private final Map<String, ErrorHook> errorHooks = new ConcurrentHashMap<>();

    public HandlerRegistry action(String id, ActionHandler handler) {
        actions.put(requireId(id), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public HandlerRegistry beforeHook(String id, BeforeExecuteHook hook) {
        beforeHooks.put(requireId(id), Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public HandlerRegistry afterHook(String id, AfterExecuteHook hook) {
        afterHooks.put(requireId(id), Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public HandlerRegistry errorHook(String id, ErrorHook hook) {
        errorHooks.put(requireId(id), Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public ActionHandler requireAction(String id) {
        return require(actions, id, "Action handler");
    }

    public BeforeExecuteHook requireBeforeHook(String id) {
        return require(beforeHooks, id, "Before hook");
    }

    public AfterExecuteHook requireAfterHook(String id) {
        return require(afterHooks, id, "After hook");
    }

    public ErrorHook requireErrorHook(String id) {
        return require(errorHooks, id, "Error hook");
    }

    public boolean hasAction(String id) {
        return id != null && actions.containsKey(id);
    }

    public Map<String, ActionHandler> actions() {
        return Collections.unmodifiableMap(actions);
    }

    private static <T> T require(Map<String, T> entries, String id, String what) {
        var entry = id == null ? null : entries.get(id);
        if (entry == null) {
            throw new IllegalStateException(what + " not registered: " + id);
        }
        return entry;
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Handler id must not be blank");
        }
        return id;
    }
}
