package work.cmdkernel.bind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cmdkernel.convert.ConversionException;
import work.cmdkernel.convert.ConverterRegistry;
import work.cmdkernel.convert.TypeDescriptor;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.shared.StringSimilarity;
import work.cmdkernel.validation.ValidationException;
import work.cmdkernel.validation.Validator;

/**
 * Binds option and positional tokens to parameters.
 *
 * <p>Precedence per parameter: command line, environment variable, interactive prompt, declared
 * default. Values from the command line, environment or prompt are validated; defaults are not.
 * Mutual-exclusion groups are checked once every parameter is bound.</p>
 */
public final class ParameterBinder {
    private static final Logger LOG = LoggerFactory.getLogger(ParameterBinder.class);

    private final ConverterRegistry converters;
    private final EnvironmentSource environment;
    private final Prompter prompter;
    private final int suggestionDistance;
    private final int maxSuggestions;

    public ParameterBinder(ConverterRegistry converters, EnvironmentSource environment, Prompter prompter) {
        this(converters, environment, prompter, StringSimilarity.DEFAULT_MAX_DISTANCE, StringSimilarity.DEFAULT_MAX_RESULTS);
    }

    public ParameterBinder(
        ConverterRegistry converters,
        EnvironmentSource environment,
        Prompter prompter,
        int suggestionDistance,
        int maxSuggestions
    ) {
        this.converters = Objects.requireNonNull(converters, "converters");
        this.environment = environment == null ? EnvironmentSource.system() : environment;
        this.prompter = prompter == null ? Prompter.none() : prompter;
        this.suggestionDistance = suggestionDistance;
        this.maxSuggestions = maxSuggestions;
    }

    public record BindingResult(ParameterValues values, ParameterValues globalOptions) {}

    public BindingResult bind(List<String> tokens, List<ParameterSpec> parameters) {
        return bind(List.of(), tokens, parameters, List.of());
    }

    /**
     * @param globalTokens option tokens that preceded the command path; only global options may appear there
     * @param tokens tokens after the command path and action name
     * @param parameters the action's parameters
     * @param globalOptions options shared across the model; action parameters shadow them by name
     */
    public BindingResult bind(
        List<String> globalTokens,
        List<String> tokens,
        List<ParameterSpec> parameters,
        List<ParameterSpec> globalOptions
    ) {
        var occurrences = new IdentityHashMap<ParameterSpec, List<String>>();
        var globalScope = new OptionScope(List.of(), globalOptions);
        var actionScope = new OptionScope(parameters, globalOptions);

        var stray = scan(globalTokens, globalScope, occurrences);
        if (!stray.isEmpty()) {
            throw new UsageException(ErrorKind.UNEXPECTED_ARGUMENT, "Unexpected argument '" + stray.get(0) + "'");
        }
        var positionals = scan(tokens, actionScope, occurrences);
        assignPositionals(positionals, parameters, occurrences);

        var values = resolveAll(parameters, occurrences);
        var globals = resolveAll(globalOptions, occurrences);
        checkMutualExclusion(parameters, values);
        checkMutualExclusion(globalOptions, globals);
        return new BindingResult(values, globals);
    }

    private List<String> scan(List<String> tokens, OptionScope scope, Map<ParameterSpec, List<String>> occurrences) {
        var positionals = new ArrayList<String>();
        boolean ended = false;
        for (int i = 0; i < tokens.size(); i++) {
            var raw = tokens.get(i);
            var token = ArgumentTokenizer.classify(raw, ended, c -> scope.findShort(c).isPresent());
            switch (token.kind()) {
                case END -> ended = true;
                case VALUE -> positionals.add(raw);
                case LONG, SHORT -> {
                    var spec = lookup(token, scope);
                    String value;
                    if (spec.isFlag()) {
                        value = token.inlineValue() != null ? token.inlineValue() : "true";
                    } else if (token.inlineValue() != null) {
                        value = token.inlineValue();
                    } else if (i + 1 < tokens.size()) {
                        value = tokens.get(++i);
                    } else {
                        throw new UsageException(ErrorKind.MISSING_OPTION_VALUE,
                            "Option '" + token.display() + "' requires a value of type " + spec.type().displayName());
                    }
                    occurrences.computeIfAbsent(spec, key -> new ArrayList<>()).add(value);
                }
            }
        }
        return positionals;
    }

    private ParameterSpec lookup(ArgumentTokenizer.Token token, OptionScope scope) {
        Optional<ParameterSpec> found;
        if (token.kind() == ArgumentTokenizer.Kind.LONG) {
            found = scope.findLong(token.name());
        } else {
            found = token.name().length() == 1 ? scope.findShort(token.name().charAt(0)) : Optional.empty();
        }
        return found.orElseThrow(() -> unknownOption(token, scope));
    }

    private UsageException unknownOption(ArgumentTokenizer.Token token, OptionScope scope) {
        List<String> suggestions = List.of();
        if (token.kind() == ArgumentTokenizer.Kind.LONG && !token.name().isEmpty()) {
            var candidates = scope.longNames().stream().map(name -> "--" + name).toList();
            suggestions = StringSimilarity.findSimilar("--" + token.name(), candidates, suggestionDistance, maxSuggestions);
        }
        return new UsageException(ErrorKind.UNKNOWN_OPTION, "Unknown option '" + token.display() + "'", suggestions);
    }

    private static void assignPositionals(
        List<String> positionals,
        List<ParameterSpec> parameters,
        Map<ParameterSpec, List<String>> occurrences
    ) {
        var arguments = parameters.stream().filter(ParameterSpec::isArgument).toList();
        int index = 0;
        for (ParameterSpec argument : arguments) {
            if (index >= positionals.size()) {
                break;
            }
            if (argument.type().isCollection()) {
                occurrences.put(argument, new ArrayList<>(positionals.subList(index, positionals.size())));
                index = positionals.size();
            } else {
                occurrences.put(argument, new ArrayList<>(List.of(positionals.get(index++))));
            }
        }
        if (index < positionals.size()) {
            throw new UsageException(ErrorKind.UNEXPECTED_ARGUMENT, "Unexpected argument '" + positionals.get(index) + "'");
        }
    }

    private ParameterValues resolveAll(List<ParameterSpec> parameters, Map<ParameterSpec, List<String>> occurrences) {
        var builder = ParameterValues.builder();
        for (ParameterSpec parameter : parameters) {
            var bound = resolve(parameter, occurrences.get(parameter));
            if (bound.source().isExplicit()) {
                validate(parameter, bound.value());
            }
            LOG.debug("Bound {} from {}", parameter.displayName(), bound.source());
            builder.put(parameter.name(), bound);
        }
        return builder.build();
    }

    private BoundValue resolve(ParameterSpec parameter, List<String> raws) {
        if (raws != null && !raws.isEmpty()) {
            return new BoundValue(convert(parameter, raws), ValueSource.COMMAND_LINE);
        }
        var fromEnv = parameter.envVar().flatMap(environment::lookup).filter(value -> !value.isEmpty());
        if (fromEnv.isPresent()) {
            return new BoundValue(convert(parameter, List.of(fromEnv.get())), ValueSource.ENVIRONMENT);
        }
        if (parameter.prompt().isPresent() && prompter.isInteractive()) {
            var answer = prompter.prompt(parameter.prompt().get(), parameter.securePrompt());
            if (answer != null && !answer.isBlank()) {
                return new BoundValue(convert(parameter, List.of(answer)), ValueSource.PROMPT);
            }
        }
        if (parameter.defaultValue().isPresent()) {
            return new BoundValue(convertDefault(parameter, parameter.defaultValue().get()), ValueSource.DEFAULT);
        }
        if (parameter.required()) {
            throw new UsageException(ErrorKind.MISSING_REQUIRED_PARAMETER,
                "Missing required " + (parameter.isOption() ? "option" : "argument") + " '" + parameter.displayName()
                    + "' of type " + parameter.type().displayName());
        }
        return new BoundValue(emptyValue(parameter.type()), ValueSource.ABSENT);
    }

    private Object convert(ParameterSpec parameter, List<String> raws) {
        try {
            return converters.convert(parameter.type(), raws);
        } catch (ConversionException ex) {
            throw new UsageException(ErrorKind.CONVERSION_FAILURE,
                "Cannot convert value for '" + parameter.displayName() + "': " + ex.getMessage(), List.of(), ex);
        }
    }

    private Object convertDefault(ParameterSpec parameter, Object defaultValue) {
        if (defaultValue instanceof String raw) {
            return convert(parameter, List.of(raw));
        }
        if (defaultValue instanceof Collection<?> items && parameter.type().isCollection()) {
            if (items.stream().allMatch(String.class::isInstance)) {
                var raws = items.stream().map(String.class::cast).toList();
                return raws.isEmpty() ? emptyValue(parameter.type()) : convert(parameter, raws);
            }
            return parameter.type().shape() == TypeDescriptor.Shape.SET
                ? Collections.unmodifiableSet(new LinkedHashSet<>(items))
                : List.copyOf(items);
        }
        return defaultValue;
    }

    private static Object emptyValue(TypeDescriptor type) {
        return switch (type.shape()) {
            case LIST -> List.of();
            case SET -> Set.of();
            case SCALAR -> null;
        };
    }

    private static void validate(ParameterSpec parameter, Object value) {
        try {
            Validator.validate(parameter.validations(), value, parameter.name());
        } catch (ValidationException ex) {
            throw new UsageException(ErrorKind.VALIDATION_FAILURE,
                "Validation '" + ex.ruleName() + "' failed for '" + parameter.displayName() + "' (value '" + ex.value()
                    + "'): " + ex.getMessage(), List.of(), ex);
        }
    }

    private static void checkMutualExclusion(List<ParameterSpec> parameters, ParameterValues values) {
        var groups = new LinkedHashMap<String, List<ParameterSpec>>();
        for (ParameterSpec parameter : parameters) {
            parameter.mutuallyExclusiveSet().ifPresent(group -> {
                var bound = values.bound(parameter.name());
                if (bound.source().isExplicit() && !Boolean.FALSE.equals(bound.value())) {
                    groups.computeIfAbsent(group, key -> new ArrayList<>()).add(parameter);
                }
            });
        }
        for (var entry : groups.entrySet()) {
            if (entry.getValue().size() > 1) {
                var names = entry.getValue().stream().map(ParameterSpec::displayName).collect(Collectors.joining(", "));
                throw new UsageException(ErrorKind.MUTUAL_EXCLUSION_CONFLICT,
                    "Parameters " + names + " cannot be used together (group '" + entry.getKey() + "')");
            }
        }
    }

    /**
     * Options visible at one point of the command line. Action options shadow global ones.
     */
    private static final class OptionScope {
        private final List<ParameterSpec> primary;
        private final List<ParameterSpec> fallback;

        OptionScope(List<ParameterSpec> primary, List<ParameterSpec> fallback) {
            this.primary = primary.stream().filter(ParameterSpec::isOption).toList();
            this.fallback = fallback;
        }

        Optional<ParameterSpec> findLong(String name) {
            return first(primary, p -> p.name().equals(name)).or(() -> first(fallback, p -> p.name().equals(name)));
        }

        Optional<ParameterSpec> findShort(char shortName) {
            return first(primary, p -> matchesShort(p, shortName)).or(() -> first(fallback, p -> matchesShort(p, shortName)));
        }

        List<String> longNames() {
            var names = new LinkedHashSet<String>();
            primary.stream().filter(p -> !p.hidden()).forEach(p -> names.add(p.name()));
            fallback.stream().filter(p -> !p.hidden()).forEach(p -> names.add(p.name()));
            return List.copyOf(names);
        }

        private static boolean matchesShort(ParameterSpec parameter, char shortName) {
            return parameter.shortName().map(c -> c == shortName).orElse(false);
        }

        private static Optional<ParameterSpec> first(List<ParameterSpec> specs, Predicate<ParameterSpec> test) {
            return specs.stream().filter(test).findFirst();
        }
    }
}
