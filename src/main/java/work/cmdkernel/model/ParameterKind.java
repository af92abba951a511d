package work.cmdkernel.model;

public enum ParameterKind {
    OPTION,
    ARGUMENT
}
