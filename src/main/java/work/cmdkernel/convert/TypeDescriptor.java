package work.cmdkernel.convert;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes the target type of a parameter: a scalar class, an enum (optionally bound as a
 * flags {@link java.util.EnumSet}), a scalar with its own converter, or a list/set of any of these.
 */
public final class TypeDescriptor {
    private static final Map<Class<?>, Class<?>> PRIMITIVES = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        short.class, Short.class,
        char.class, Character.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    public enum Shape {
        SCALAR,
        LIST,
        SET
    }

    private final Shape shape;
    private final Class<?> elementType;
    private final boolean flags;
    private final TypeConverter<?> converter;

    private TypeDescriptor(Shape shape, Class<?> elementType, boolean flags, TypeConverter<?> converter) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.flags = flags;
        this.converter = converter;
    }

    public static TypeDescriptor of(Class<?> type) {
        return new TypeDescriptor(Shape.SCALAR, type, false, null);
    }

    public static TypeDescriptor string() {
        return of(String.class);
    }

    public static TypeDescriptor bool() {
        return of(boolean.class);
    }

    public static <E extends Enum<E>> TypeDescriptor flagsOf(Class<E> type) {
        return new TypeDescriptor(Shape.SCALAR, type, true, null);
    }

    public static <T> TypeDescriptor custom(Class<T> type, TypeConverter<T> converter) {
        return new TypeDescriptor(Shape.SCALAR, type, false, Objects.requireNonNull(converter, "converter"));
    }

    public static TypeDescriptor listOf(Class<?> type) {
        return of(type).asList();
    }

    public static TypeDescriptor setOf(Class<?> type) {
        return of(type).asSet();
    }

    public TypeDescriptor asList() {
        return new TypeDescriptor(Shape.LIST, elementType, flags, converter);
    }

    public TypeDescriptor asSet() {
        return new TypeDescriptor(Shape.SET, elementType, flags, converter);
    }

    public TypeDescriptor elementDescriptor() {
        return shape == Shape.SCALAR ? this : new TypeDescriptor(Shape.SCALAR, elementType, flags, converter);
    }

    public Shape shape() {
        return shape;
    }

    public Class<?> elementType() {
        return elementType;
    }

    /**
     * Element type with primitives replaced by their wrapper class.
     */
    public Class<?> boxedElementType() {
        return PRIMITIVES.getOrDefault(elementType, elementType);
    }

    public Optional<TypeConverter<?>> converter() {
        return Optional.ofNullable(converter);
    }

    public boolean isCollection() {
        return shape != Shape.SCALAR;
    }

    public boolean isBoolean() {
        return shape == Shape.SCALAR && converter == null && boxedElementType() == Boolean.class;
    }

    public boolean isEnum() {
        return converter == null && elementType.isEnum();
    }

    public boolean isFlags() {
        return flags;
    }

    public String displayName() {
        String base;
        if (flags) {
            base = "flags<" + elementType.getSimpleName() + ">";
        } else if (elementType.isPrimitive()) {
            base = elementType.getName();
        } else if (elementType == String.class) {
            base = "string";
        } else {
            base = elementType.getSimpleName();
        }
        return switch (shape) {
            case SCALAR -> base;
            case LIST -> "list<" + base + ">";
            case SET -> "set<" + base + ">";
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TypeDescriptor that)) {
            return false;
        }
        return shape == that.shape
            && flags == that.flags
            && elementType == that.elementType
            && Objects.equals(converter, that.converter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, elementType, flags, converter);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
