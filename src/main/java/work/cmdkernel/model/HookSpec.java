package work.cmdkernel.model;

import java.util.Objects;

/**
 * Declares a lifecycle hook by handler id. Lower {@code order} runs first.
 */
public record HookSpec(HookPhase phase, String handlerId, int order) {
    public HookSpec {
        Objects.requireNonNull(phase, "phase");
        if (handlerId == null || handlerId.isBlank()) {
            throw new IllegalArgumentException("Hook handler id must not be blank");
        }
    }

    public static HookSpec before(String handlerId, int order) {
        return new HookSpec(HookPhase.BEFORE, handlerId, order);
    }

    public static HookSpec after(String handlerId, int order) {
        return new HookSpec(HookPhase.AFTER, handlerId, order);
    }

    public static HookSpec onError(String handlerId, int order) {
        return new HookSpec(HookPhase.ON_ERROR, handlerId, order);
    }
}
