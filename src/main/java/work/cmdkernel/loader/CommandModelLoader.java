package work.cmdkernel.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import work.cmdkernel.convert.ConverterRegistry;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.model.CommandNode;
import work.cmdkernel.model.HookPhase;
import work.cmdkernel.model.HookSpec;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.validation.PathExistsRule;
import work.cmdkernel.validation.PatternRule;
import work.cmdkernel.validation.RangeRule;
import work.cmdkernel.validation.ValidationRule;

/**
 * Builds a {@link CommandModel} from a YAML or JSON document.
 *
 * <pre>
 * name: tool
 * globalOptions:
 *   - { name: verbose, short: v, type: bool }
 * commands:
 *   - name: git
 *     actions:
 *       - name: commit
 *         parameters:
 *           - { name: message, short: m, required: true }
 * </pre>
 */
public final class CommandModelLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final ConverterRegistry converters;

    public CommandModelLoader() {
        this(ConverterRegistry.withDefaults());
    }

    public CommandModelLoader(ConverterRegistry converters) {
        this.converters = Objects.requireNonNull(converters, "converters");
    }

    public CommandModel load(Path path) {
        var mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read command model: " + path, ex);
        }
    }

    public CommandModel loadResource(String resource) {
        var loader = Thread.currentThread().getContextClassLoader();
        try (var in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Command model resource not found: " + resource);
            }
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read command model resource: " + resource, ex);
        }
    }

    /**
     * Parses YAML (and therefore JSON) from the stream. The stream is not closed.
     */
    public CommandModel parse(InputStream in) throws IOException {
        return fromTree(YAML_MAPPER.readTree(in));
    }

    public CommandModel parse(String document) throws IOException {
        return fromTree(YAML_MAPPER.readTree(document));
    }

    public CommandModel fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Command model must be a mapping");
        }
        var model = CommandModel.builder(requireText(root, "name", "model"))
            .description(root.path("description").asText(""));
        for (var option : elements(root, "globalOptions")) {
            model.globalOption(parameter(option, "globalOptions"));
        }
        int index = 0;
        for (var command : elements(root, "commands")) {
            model.command(command(command, "commands[" + index++ + "]"));
        }
        return model.build();
    }

    private CommandNode command(JsonNode node, String where) {
        var command = CommandNode.builder(requireText(node, "name", where))
            .description(node.path("description").asText(""))
            .hidden(node.path("hidden").asBoolean(false));
        texts(node, "aliases").forEach(command::alias);
        int index = 0;
        for (var child : elements(node, "commands")) {
            command.child(command(child, where + ".commands[" + index++ + "]"));
        }
        index = 0;
        for (var action : elements(node, "actions")) {
            command.action(action(action, where + ".actions[" + index++ + "]"));
        }
        hooks(node, where).forEach(command::hook);
        for (var mapping : elements(node, "exitCodes")) {
            command.exitCode(exceptionType(mapping, where), requireInt(mapping, "code", where));
        }
        return command.build();
    }

    private ActionNode action(JsonNode node, String where) {
        var action = ActionNode.builder(requireText(node, "name", where))
            .description(node.path("description").asText(""))
            .hidden(node.path("hidden").asBoolean(false))
            .primary(node.path("primary").asBoolean(false))
            .returnsExitCode(node.path("returnsExitCode").asBoolean(false));
        if (node.hasNonNull("handler")) {
            action.handler(node.get("handler").asText());
        }
        texts(node, "aliases").forEach(action::alias);
        int index = 0;
        for (var parameter : elements(node, "parameters")) {
            action.parameter(parameter(parameter, where + ".parameters[" + index++ + "]"));
        }
        hooks(node, where).forEach(action::hook);
        for (var mapping : elements(node, "exitCodes")) {
            action.exitCode(exceptionType(mapping, where), requireInt(mapping, "code", where));
        }
        return action.build();
    }

    private ParameterSpec parameter(JsonNode node, String where) {
        var name = requireText(node, "name", where);
        var kind = node.path("kind").asText("option").toLowerCase(Locale.ROOT);
        ParameterSpec.Builder parameter = switch (kind) {
            case "option" -> ParameterSpec.option(name);
            case "argument", "positional" -> ParameterSpec.argument(name);
            default -> throw new IllegalArgumentException(where + ": unknown parameter kind '" + kind + "'");
        };
        try {
            parameter.type(converters.parseType(node.path("type").asText("string")));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
        if (node.hasNonNull("short")) {
            var shortName = node.get("short").asText();
            if (shortName.length() != 1) {
                throw new IllegalArgumentException(where + ": short name must be a single character");
            }
            parameter.shortName(shortName.charAt(0));
        }
        parameter.required(node.path("required").asBoolean(false))
            .envVar(node.path("env").asText(null))
            .mutuallyExclusive(node.path("exclusive").asText(null))
            .description(node.path("description").asText(""))
            .hidden(node.path("hidden").asBoolean(false));
        if (node.hasNonNull("securePrompt")) {
            parameter.securePrompt(node.get("securePrompt").asText());
        } else if (node.hasNonNull("prompt")) {
            parameter.prompt(node.get("prompt").asText());
        }
        if (node.hasNonNull("default")) {
            var value = node.get("default");
            parameter.defaultValue(value.isArray() ? texts(node, "default") : value.asText());
        }
        int index = 0;
        for (var rule : elements(node, "validate")) {
            parameter.validate(rule(rule, where + ".validate[" + index++ + "]"));
        }
        try {
            return parameter.build();
        } catch (IllegalStateException ex) {
            throw new IllegalArgumentException(where + ": " + ex.getMessage(), ex);
        }
    }

    private static ValidationRule rule(JsonNode node, String where) {
        if (node.has("range")) {
            var range = node.get("range");
            var min = range.hasNonNull("min") ? range.get("min").numberValue() : null;
            var max = range.hasNonNull("max") ? range.get("max").numberValue() : null;
            return new RangeRule(min, max);
        }
        if (node.has("pattern")) {
            var pattern = node.get("pattern");
            if (pattern.isObject()) {
                return new PatternRule(requireText(pattern, "regex", where), pattern.path("message").asText(null));
            }
            return new PatternRule(pattern.asText());
        }
        if (node.path("file-exists").asBoolean(false)) {
            return PathExistsRule.file();
        }
        if (node.path("directory-exists").asBoolean(false)) {
            return PathExistsRule.directory();
        }
        if (node.path("path-exists").asBoolean(false)) {
            return PathExistsRule.any();
        }
        throw new IllegalArgumentException(where + ": unknown validation rule " + node);
    }

    private static List<HookSpec> hooks(JsonNode node, String where) {
        var hooks = new ArrayList<HookSpec>();
        for (var hook : elements(node, "hooks")) {
            var phase = switch (requireText(hook, "phase", where).toLowerCase(Locale.ROOT)) {
                case "before" -> HookPhase.BEFORE;
                case "after" -> HookPhase.AFTER;
                case "error", "on-error", "onerror" -> HookPhase.ON_ERROR;
                default -> throw new IllegalArgumentException(where + ": unknown hook phase '" + hook.get("phase").asText() + "'");
            };
            hooks.add(new HookSpec(phase, requireText(hook, "handler", where), hook.path("order").asInt(0)));
        }
        return hooks;
    }

    private static Class<? extends Throwable> exceptionType(JsonNode mapping, String where) {
        var className = requireText(mapping, "exception", where);
        try {
            var type = Class.forName(className, false, Thread.currentThread().getContextClassLoader());
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(where + ": " + className + " is not an exception type");
            }
            return type.asSubclass(Throwable.class);
        } catch (ClassNotFoundException ex) {
            throw new IllegalArgumentException(where + ": unknown exception type " + className, ex);
        }
    }

    private static Iterable<JsonNode> elements(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be a list");
        }
        return value;
    }

    private static List<String> texts(JsonNode node, String field) {
        var values = new ArrayList<String>();
        elements(node, field).forEach(value -> values.add(value.asText()));
        return values;
    }

    private static String requireText(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException(where + ": missing '" + field + "'");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException(where + ": '" + field + "' must be an integer");
        }
        return value.asInt();
    }
}
