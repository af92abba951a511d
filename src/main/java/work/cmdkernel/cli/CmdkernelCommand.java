package work.cmdkernel.cli;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.cmdkernel.api.Dispatcher;
import work.cmdkernel.api.DispatcherSettings;
import work.cmdkernel.api.PrintStreamDiagnosticSink;
import work.cmdkernel.bind.ConsolePrompter;
import work.cmdkernel.convert.ConverterRegistry;
import work.cmdkernel.demo.DemoHandlers;
import work.cmdkernel.loader.CommandModelLoader;
import work.cmdkernel.loader.SettingsLoader;
import work.cmdkernel.runtime.HandlerRegistry;
import work.cmdkernel.shell.ShellHost;

/**
 * Launcher options. Everything from the first token the launcher does not know is handed to the
 * dispatcher untouched.
 */
@CommandLine.Command(
    name = "cmdkernel",
    description = "Dispatch the bundled demo commands, or run them from an interactive shell.",
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CmdkernelCommand implements Callable<Integer> {
    @CommandLine.Option(names = {"-V", "--version"}, versionHelp = true, description = "Print version information and exit.")
    private boolean versionRequested;

    @CommandLine.Option(names = "--interactive", description = "Read commands line by line until 'exit'.")
    private boolean interactive;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "FILE",
        description = "Dispatcher settings (TOML). Ignored when the file does not exist."
    )
    private Path settingsFile = Path.of(System.getProperty("cmdkernel.settings", "cmdkernel.toml"));

    @CommandLine.Option(
        names = "--model",
        paramLabel = "FILE",
        description = "Command model (YAML or JSON) replacing the bundled one. Handlers stay the demo handlers."
    )
    private Path modelFile;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "ARGS", description = "Command line for the dispatcher.")
    private List<String> arguments = new ArrayList<>();

    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;
    private DispatcherSettings settings = DispatcherSettings.defaults();

    CmdkernelCommand(InputStream stdin, PrintStream out, PrintStream err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() throws Exception {
        var dispatcher = buildDispatcher();
        if (interactive) {
            var reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            return new ShellHost(dispatcher, reader, out).run();
        }
        return dispatcher.dispatch(arguments.toArray(String[]::new));
    }

    /**
     * Settings in effect once {@link #call()} has loaded them.
     */
    DispatcherSettings settings() {
        return settings;
    }

    private Dispatcher buildDispatcher() {
        var converters = ConverterRegistry.withDefaults();
        var loader = new CommandModelLoader(converters);
        var model = modelFile != null ? loader.load(modelFile) : loader.loadResource(DemoHandlers.MODEL_RESOURCE);
        settings = SettingsLoader.load(settingsFile);
        return Dispatcher.builder(model, DemoHandlers.register(new HandlerRegistry(), out))
            .converters(converters)
            .settings(settings)
            .prompter(new ConsolePrompter())
            .diagnostics(new PrintStreamDiagnosticSink(err))
            .build();
    }
}
