package work.cmdkernel.convert;

/**
 * Converts a raw command-line token into a typed value.
 *
 * <p>Implementations signal invalid input by throwing; the message is surfaced to the user
 * as part of the conversion failure.</p>
 */
@FunctionalInterface
public interface TypeConverter<T> {
    T convert(String raw) throws Exception;

    default String format(T value) {
        return String.valueOf(value);
    }
}
