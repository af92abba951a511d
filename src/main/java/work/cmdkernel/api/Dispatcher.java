package work.cmdkernel.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cmdkernel.bind.EnvironmentSource;
import work.cmdkernel.bind.ParameterBinder;
import work.cmdkernel.bind.Prompter;
import work.cmdkernel.convert.ConverterRegistry;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;
import work.cmdkernel.hooks.HookOrchestrator;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.resolve.CommandResolver;
import work.cmdkernel.runtime.CancellationToken;
import work.cmdkernel.runtime.HandlerRegistry;
import work.cmdkernel.runtime.ResolvedInvocation;

/**
 * Public entry point: resolves an argument vector against a command model, binds parameters,
 * runs hooks and the action, and produces the exit code.
 *
 * <p>Usage errors are reported to the {@link DiagnosticSink} and never thrown. Only an unhandled
 * action or hook failure escapes, as {@link work.cmdkernel.error.ExecutionFailedException}. The
 * model is read-only, so one dispatcher may serve concurrent calls.</p>
 */
public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final CommandModel model;
    private final DispatcherSettings settings;
    private final DiagnosticSink diagnostics;
    private final CommandResolver resolver;
    private final ParameterBinder binder;
    private final HookOrchestrator orchestrator;

    private Dispatcher(Builder builder) {
        this.model = builder.model;
        this.settings = builder.settings;
        this.diagnostics = builder.diagnostics;
        this.resolver = new CommandResolver(
            settings.commandSuggestionDistance(),
            settings.suggestionDistance(),
            settings.maxSuggestions()
        );
        this.binder = new ParameterBinder(
            builder.converters,
            builder.environment,
            settings.promptsEnabled() ? builder.prompter : Prompter.none(),
            settings.suggestionDistance(),
            settings.maxSuggestions()
        );
        this.orchestrator = new HookOrchestrator(builder.handlers, settings.failureExitCode());
    }

    public static Builder builder(CommandModel model, HandlerRegistry handlers) {
        return new Builder(model, handlers);
    }

    public CommandModel model() {
        return model;
    }

    public DispatcherSettings settings() {
        return settings;
    }

    public int dispatch(String... argv) {
        return execute(Arrays.asList(argv), new CancellationToken()).exitCode();
    }

    public int dispatch(List<String> argv, CancellationToken token) {
        return execute(argv, token).exitCode();
    }

    public DispatchResult execute(List<String> argv) {
        return execute(argv, new CancellationToken());
    }

    public DispatchResult execute(List<String> argv, CancellationToken token) {
        Objects.requireNonNull(argv, "argv");
        var started = Instant.now();
        ResolvedInvocation invocation;
        try {
            invocation = resolve(argv);
        } catch (UsageException ex) {
            var diagnostic = Diagnostic.of(ex);
            LOG.debug("Usage error {}: {}", ex.kind(), ex.getMessage());
            diagnostics.report(diagnostic);
            return DispatchResult.usageError(settings.usageExitCode(), diagnostic, started);
        }

        var outcome = orchestrator.run(invocation, token);
        return switch (outcome.status()) {
            case COMPLETED -> DispatchResult.success(exitCodeFor(invocation.action(), outcome.result()), outcome.result(), started);
            case CANCELLED -> {
                diagnostics.report(new Diagnostic(ErrorKind.EXECUTION_CANCELLED, outcome.message(), List.of()));
                yield DispatchResult.cancelled(settings.cancelledExitCode(), outcome.message(), outcome.messages(), started);
            }
            case HANDLED_ERROR -> DispatchResult.handledError(outcome.exitCode(), outcome.message(), started);
        };
    }

    /**
     * Resolution and binding only; nothing is invoked.
     *
     * @throws UsageException when the arguments do not fit the model
     */
    public ResolvedInvocation resolve(List<String> argv) {
        var target = resolver.resolve(model, argv);
        var binding = binder.bind(target.globalTokens(), target.remaining(), target.action().parameters(), model.globalOptions());
        return new ResolvedInvocation(target.commandPath(), target.action(), binding.values(), binding.globalOptions(), argv);
    }

    private static int exitCodeFor(ActionNode action, Object result) {
        if (result instanceof ExitCode code) {
            return code.code();
        }
        if (action.returnsExitCode() && result instanceof Number number) {
            return number.intValue();
        }
        return ExitCode.SUCCESS.code();
    }

    public static final class Builder {
        private final CommandModel model;
        private final HandlerRegistry handlers;
        private ConverterRegistry converters;
        private DispatcherSettings settings = DispatcherSettings.defaults();
        private EnvironmentSource environment = EnvironmentSource.system();
        private Prompter prompter = Prompter.none();
        private DiagnosticSink diagnostics = DiagnosticSink.standardError();

        private Builder(CommandModel model, HandlerRegistry handlers) {
            this.model = Objects.requireNonNull(model, "model");
            this.handlers = Objects.requireNonNull(handlers, "handlers");
        }

        public Builder converters(ConverterRegistry converters) {
            this.converters = converters;
            return this;
        }

        public Builder settings(DispatcherSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder environment(EnvironmentSource environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder prompter(Prompter prompter) {
            this.prompter = Objects.requireNonNull(prompter, "prompter");
            return this;
        }

        public Builder diagnostics(DiagnosticSink diagnostics) {
            this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
            return this;
        }

        public Dispatcher build() {
            if (converters == null) {
                converters = ConverterRegistry.withDefaults();
            }
            return new Dispatcher(this);
        }
    }
}
