package work.cmdkernel.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class Names {
    private Names() {}

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " name must not be blank");
        }
        var trimmed = name.trim();
        if (trimmed.startsWith("-") || trimmed.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(what + " name '" + name + "' must not start with '-' or contain spaces");
        }
        return trimmed;
    }

    static List<String> cleanAliases(Collection<String> aliases, String what) {
        var cleaned = new ArrayList<String>();
        for (String alias : aliases) {
            cleaned.add(requireName(alias, what + " alias"));
        }
        return List.copyOf(cleaned);
    }

    /**
     * Registers every name in {@code seen} (keyed case-insensitively), failing on the first clash.
     */
    static void claim(Map<String, String> seen, String owner, List<String> names, String scope) {
        for (String candidate : names) {
            var previous = seen.putIfAbsent(normalize(candidate), owner);
            if (previous != null) {
                throw new IllegalStateException(
                    "Name '" + candidate + "' of " + owner + " clashes with " + previous + " in " + scope);
            }
        }
    }
}
