package work.cmdkernel.bind;

import java.util.Objects;

public record BoundValue(Object value, ValueSource source) {
    public BoundValue {
        Objects.requireNonNull(source, "source");
    }

    public static BoundValue absent() {
        return new BoundValue(null, ValueSource.ABSENT);
    }
}
