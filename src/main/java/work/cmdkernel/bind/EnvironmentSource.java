package work.cmdkernel.bind;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of environment variables; swapped for a map in tests.
 */
@FunctionalInterface
public interface EnvironmentSource {
    Optional<String> lookup(String name);

    static EnvironmentSource system() {
        return name -> Optional.ofNullable(System.getenv(name));
    }

    static EnvironmentSource of(Map<String, String> variables) {
        var copy = Map.copyOf(variables);
        return name -> Optional.ofNullable(copy.get(name));
    }
}
