package work.cmdkernel.bind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converted and validated parameter values keyed by parameter name, in declaration order.
 */
public final class ParameterValues {
    private static final ParameterValues EMPTY = new ParameterValues(Map.of());

    private final Map<String, BoundValue> entries;

    private ParameterValues(Map<String, BoundValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static ParameterValues empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Object get(String name) {
        return require(name).value();
    }

    public <T> T get(String name, Class<T> type) {
        var value = get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException("Parameter '" + name + "' holds " + value.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(value);
    }

    public String getString(String name) {
        var value = get(name);
        return value == null ? null : String.valueOf(value);
    }

    public boolean getBoolean(String name) {
        return Boolean.TRUE.equals(get(name));
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String name) {
        var value = get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return (List<T>) list;
        }
        if (value instanceof Collection<?> collection) {
            return (List<T>) List.copyOf(collection);
        }
        return (List<T>) List.of(value);
    }

    @SuppressWarnings("unchecked")
    public <T> Set<T> getSet(String name) {
        var value = get(name);
        if (value == null) {
            return Set.of();
        }
        if (value instanceof Set<?> set) {
            return (Set<T>) set;
        }
        if (value instanceof Collection<?> collection) {
            return (Set<T>) Collections.unmodifiableSet(new LinkedHashSet<>(collection));
        }
        return (Set<T>) Set.of(value);
    }

    /**
     * True when the value was supplied or defaulted, false when the parameter is absent.
     */
    public boolean isSet(String name) {
        return require(name).source() != ValueSource.ABSENT;
    }

    public ValueSource source(String name) {
        return require(name).source();
    }

    public BoundValue bound(String name) {
        return require(name);
    }

    public Set<String> names() {
        return entries.keySet();
    }

    /**
     * Name to value view; absent parameters map to {@code null} (or an empty collection).
     */
    public Map<String, Object> asMap() {
        var map = new LinkedHashMap<String, Object>();
        entries.forEach((name, bound) -> map.put(name, bound.value()));
        return Collections.unmodifiableMap(map);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private BoundValue require(String name) {
        var bound = entries.get(name);
        if (bound == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        return bound;
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof ParameterValues that && entries.equals(that.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {
        private final Map<String, BoundValue> entries = new LinkedHashMap<>();

        public Builder put(String name, Object value, ValueSource source) {
            entries.put(name, new BoundValue(value, source));
            return this;
        }

        public Builder put(String name, BoundValue bound) {
            entries.put(name, bound);
            return this;
        }

        public ParameterValues build() {
            return entries.isEmpty() ? EMPTY : new ParameterValues(entries);
        }
    }
}
