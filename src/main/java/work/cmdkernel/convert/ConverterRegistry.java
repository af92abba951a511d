package work.cmdkernel.convert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Stores type converters and turns raw tokens into typed values for a {@link TypeDescriptor}.
 *
 * <p>Resolution order for a scalar: the descriptor's own converter, flags/enum handling, then the
 * converter registered for the (boxed) element class. Registrations made after
 * {@link #withDefaults()} replace built-ins for the same class.</p>
 */
public final class ConverterRegistry {
    private final Map<Class<?>, TypeConverter<?>> converters = new ConcurrentHashMap<>();
    private final Map<String, TypeDescriptor> named = new ConcurrentHashMap<>();

    public static ConverterRegistry withDefaults() {
        return BuiltinConverters.register(new ConverterRegistry());
    }

    public <T> ConverterRegistry register(Class<T> type, TypeConverter<T> converter) {
        Objects.requireNonNull(type, "type");
        converters.put(type, Objects.requireNonNull(converter, "converter"));
        return this;
    }

    public <T> ConverterRegistry register(String name, Class<T> type, TypeConverter<T> converter) {
        register(type, converter);
        return alias(name, TypeDescriptor.of(type));
    }

    public ConverterRegistry alias(String name, TypeDescriptor descriptor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
        named.put(name.trim().toLowerCase(Locale.ROOT), Objects.requireNonNull(descriptor, "descriptor"));
        return this;
    }

    public Optional<TypeConverter<?>> lookup(Class<?> type) {
        if (type == null) {
            return Optional.empty();
        }
        var exact = converters.get(type);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(nearestAncestor(type));
    }

    /**
     * Walks superclasses nearest first; each class's interfaces are searched breadth-first in
     * declaration order before moving up. {@code Object} never matches.
     */
    private TypeConverter<?> nearestAncestor(Class<?> type) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            var converter = converters.get(current);
            if (converter != null) {
                return converter;
            }
            var pending = new ArrayDeque<Class<?>>(Arrays.asList(current.getInterfaces()));
            var seen = new HashSet<Class<?>>();
            while (!pending.isEmpty()) {
                var candidate = pending.poll();
                if (!seen.add(candidate)) {
                    continue;
                }
                converter = converters.get(candidate);
                if (converter != null) {
                    return converter;
                }
                pending.addAll(Arrays.asList(candidate.getInterfaces()));
            }
        }
        return null;
    }

    /**
     * Converts the raw occurrences of one parameter. Scalars use the last occurrence; collections
     * split every occurrence on commas and convert element-wise, preserving order.
     */
    public Object convert(TypeDescriptor type, List<String> rawValues) {
        Objects.requireNonNull(type, "type");
        if (rawValues == null || rawValues.isEmpty()) {
            throw new IllegalArgumentException("No raw values to convert");
        }
        if (!type.isCollection()) {
            return convertScalar(type, rawValues.get(rawValues.size() - 1));
        }
        var element = type.elementDescriptor();
        var items = new ArrayList<Object>();
        for (String raw : rawValues) {
            for (String segment : splitSegments(raw)) {
                items.add(convertScalar(element, segment));
            }
        }
        if (type.shape() == TypeDescriptor.Shape.SET) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(items));
        }
        return Collections.unmodifiableList(items);
    }

    public Object convertScalar(TypeDescriptor type, String raw) {
        var display = type.elementDescriptor().displayName();
        if (raw == null) {
            throw new ConversionException("null", display, "no value");
        }
        if (type.isFlags()) {
            return parseFlags(type.elementType(), raw);
        }
        if (type.isEnum()) {
            return parseEnum(type.elementType(), raw);
        }
        @SuppressWarnings("unchecked")
        var converter = (TypeConverter<Object>) type.converter()
            .or(() -> lookup(type.boxedElementType()))
            .orElseThrow(() -> new IllegalStateException("No converter registered for type " + type.elementType().getName()));
        Object value;
        try {
            value = converter.convert(raw);
        } catch (ConversionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ConversionException(raw, display, ex.getMessage(), ex);
        }
        if (value == null) {
            throw new ConversionException(raw, display, "converter returned no value");
        }
        return value;
    }

    /**
     * Canonical string form of a converted value, so that converting it back yields an equal value.
     */
    public String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(this::format).collect(Collectors.joining(","));
        }
        @SuppressWarnings("unchecked")
        var converter = (Optional<TypeConverter<Object>>) (Optional<?>) lookup(value.getClass());
        return converter.map(c -> c.format(value)).orElseGet(() -> String.valueOf(value));
    }

    public String format(TypeDescriptor type, Object value) {
        if (value != null && type.converter().isPresent() && !(value instanceof Collection<?>)) {
            @SuppressWarnings("unchecked")
            var converter = (TypeConverter<Object>) type.converter().get();
            return converter.format(value);
        }
        return format(value);
    }

    /**
     * Parses a type expression such as {@code int}, {@code list<path>}, {@code enum:com.acme.Level}
     * or {@code flags:com.acme.Perm}.
     */
    public TypeDescriptor parseType(String expression) {
        if (expression == null || expression.isBlank()) {
            return TypeDescriptor.string();
        }
        var trimmed = expression.trim();
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("list<") && lower.endsWith(">")) {
            return parseType(trimmed.substring(5, trimmed.length() - 1)).elementDescriptor().asList();
        }
        if (lower.startsWith("set<") && lower.endsWith(">")) {
            return parseType(trimmed.substring(4, trimmed.length() - 1)).elementDescriptor().asSet();
        }
        if (lower.startsWith("enum:")) {
            return TypeDescriptor.of(loadEnum(trimmed.substring(5).trim()));
        }
        if (lower.startsWith("flags:")) {
            return flagsDescriptor(loadEnum(trimmed.substring(6).trim()));
        }
        var descriptor = named.get(lower);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown type expression: " + expression);
        }
        return descriptor;
    }

    static List<String> splitSegments(String raw) {
        var segments = new ArrayList<String>();
        for (String part : raw.split(",")) {
            var trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    private static Object parseEnum(Class<?> type, String raw) {
        var trimmed = raw.trim();
        var constants = type.getEnumConstants();
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(trimmed)) {
                return constant;
            }
        }
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            try {
                int ordinal = Integer.parseInt(trimmed);
                if (ordinal < constants.length) {
                    return constants[ordinal];
                }
            } catch (NumberFormatException ignored) {
                // too large to be an ordinal, reported below
            }
        }
        throw new ConversionException(raw, type.getSimpleName(), "valid values are: " + enumNames(type));
    }

    @SuppressWarnings("unchecked")
    private static <E extends Enum<E>> Set<E> parseFlags(Class<?> rawType, String raw) {
        var type = (Class<E>) rawType;
        var segments = splitSegments(raw);
        if (segments.isEmpty()) {
            throw new ConversionException(raw, "flags<" + type.getSimpleName() + ">", "valid values are: " + enumNames(type));
        }
        EnumSet<E> result = EnumSet.noneOf(type);
        for (String segment : segments) {
            result.add(type.cast(parseEnum(type, segment)));
        }
        return Collections.unmodifiableSet(result);
    }

    private static String enumNames(Class<?> type) {
        var names = new ArrayList<String>();
        for (Object constant : type.getEnumConstants()) {
            names.add(((Enum<?>) constant).name());
        }
        return String.join(", ", names);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Enum<E>> TypeDescriptor flagsDescriptor(Class<?> type) {
        return TypeDescriptor.flagsOf((Class<E>) type);
    }

    private static Class<?> loadEnum(String className) {
        Class<?> type;
        try {
            type = Class.forName(className, false, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException ex) {
            throw new IllegalArgumentException("Unknown enum type: " + className, ex);
        }
        if (!type.isEnum()) {
            throw new IllegalArgumentException("Not an enum type: " + className);
        }
        return type;
    }
}
