package work.cmdkernel.model;

public enum HookPhase {
    BEFORE,
    AFTER,
    ON_ERROR
}
