package work.cmdkernel.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.cmdkernel.api.DispatcherSettings;

/**
 * Reads {@link DispatcherSettings} from a TOML file:
 *
 * <pre>
 * [exit-codes]
 * usage = 2
 * cancelled = 6
 * failure = 1
 *
 * [suggestions]
 * command-distance = 3
 * distance = 2
 * max-results = 3
 *
 * [prompts]
 * enabled = true
 * </pre>
 *
 * Keys left out keep the value of the base settings.
 */
public final class SettingsLoader {
    private SettingsLoader() {}

    public static DispatcherSettings load(Path path) {
        return load(path, DispatcherSettings.defaults());
    }

    /**
     * Returns {@code base} unchanged when the file does not exist.
     */
    public static DispatcherSettings load(Path path, DispatcherSettings base) {
        if (path == null || !Files.isRegularFile(path)) {
            return base;
        }
        try {
            return parse(Files.readString(path), base);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static DispatcherSettings parse(String toml, DispatcherSettings base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings: " + errors);
        }
        return fromToml(result, base);
    }

    public static DispatcherSettings fromToml(TomlTable table, DispatcherSettings base) {
        var builder = base.toBuilder();
        readInt(table, List.of("exit-codes", "usage"), builder::usageExitCode);
        readInt(table, List.of("exit-codes", "cancelled"), builder::cancelledExitCode);
        readInt(table, List.of("exit-codes", "failure"), builder::failureExitCode);
        readInt(table, List.of("suggestions", "command-distance"), builder::commandSuggestionDistance);
        readInt(table, List.of("suggestions", "distance"), builder::suggestionDistance);
        readInt(table, List.of("suggestions", "max-results"), builder::maxSuggestions);
        var prompts = List.of("prompts", "enabled");
        if (table.contains(prompts)) {
            if (!table.isBoolean(prompts)) {
                throw new IllegalArgumentException("Setting prompts.enabled must be true or false");
            }
            builder.promptsEnabled(Boolean.TRUE.equals(table.getBoolean(prompts)));
        }
        return builder.build();
    }

    private static void readInt(TomlTable table, List<String> key, IntConsumer setter) {
        if (!table.contains(key)) {
            return;
        }
        if (!table.isLong(key)) {
            throw new IllegalArgumentException("Setting " + String.join(".", key) + " must be an integer");
        }
        setter.accept(Math.toIntExact(table.getLong(key)));
    }
}
