package work.cmdkernel.bind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.cmdkernel.support.DispatchTestSupport.args;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cmdkernel.convert.ConverterRegistry;
import work.cmdkernel.convert.TypeDescriptor;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.support.DispatchTestSupport;
import work.cmdkernel.support.DispatchTestSupport.ScriptedPrompter;
import work.cmdkernel.validation.RangeRule;

class ParameterBinderTest {
    private final ConverterRegistry converters = ConverterRegistry.withDefaults();
    private final CommandModel git = DispatchTestSupport.gitModel();
    private final ParameterBinder binder = new ParameterBinder(converters, EnvironmentSource.of(Map.of()), Prompter.none());

    @Test
    void bindsOptionsAndFlagsFromCommandLine() {
        var values = binder.bind(args("-m fix --amend"), action("git", "commit").parameters()).values();
        assertEquals("fix", values.get("message"));
        assertTrue(values.getBoolean("amend"));
        assertEquals(ValueSource.COMMAND_LINE, values.source("message"));
    }

    @Test
    void inlineValuesAndLastOccurrenceWins() {
        var values = binder.bind(args("--message=first -m second"), action("git", "commit").parameters()).values();
        assertEquals("second", values.get("message"));
        var explicitFalse = binder.bind(args("-m x --amend=false"), action("git", "commit").parameters()).values();
        assertFalse(explicitFalse.getBoolean("amend"));
    }

    @Test
    void optionWithoutValueIsAUsageError() {
        var ex = assertThrows(UsageException.class, () -> binder.bind(args("-m"), action("git", "commit").parameters()));
        assertEquals(ErrorKind.MISSING_OPTION_VALUE, ex.kind());
    }

    @Test
    void unknownOptionSuggestsDeclaredOnes() {
        var ex = assertThrows(UsageException.class,
            () -> binder.bind(args("--mesage x"), action("git", "commit").parameters()));
        assertEquals(ErrorKind.UNKNOWN_OPTION, ex.kind());
        assertEquals(List.of("--message"), ex.suggestions());
    }

    @Test
    void missingRequiredParameterNamesItsType() {
        var ex = assertThrows(UsageException.class, () -> binder.bind(List.of(), action("git", "commit").parameters()));
        assertEquals(ErrorKind.MISSING_REQUIRED_PARAMETER, ex.kind());
        assertEquals("Missing required option '--message' of type string", ex.getMessage());
    }

    @Test
    void positionalsFillArgumentsInOrderAndCollectionsTakeTheRest() {
        var copy = ActionNode.builder("copy")
            .parameter(ParameterSpec.argument("target").required())
            .parameter(ParameterSpec.argument("sources").type(TypeDescriptor.listOf(String.class)))
            .parameter(ParameterSpec.option("offset").type(Integer.class))
            .build();
        var values = binder.bind(args("out a --offset -3 b"), copy.parameters()).values();
        assertEquals("out", values.get("target"));
        assertEquals(List.of("a", "b"), values.getList("sources"));
        assertEquals(-3, values.get("offset"));
    }

    @Test
    void separatorTurnsOptionLookingTokensIntoValues() {
        var rm = ActionNode.builder("rm").parameter(ParameterSpec.argument("file")).build();
        var values = binder.bind(args("-- --weird-name"), rm.parameters()).values();
        assertEquals("--weird-name", values.get("file"));
    }

    @Test
    void surplusPositionalIsRejected() {
        var ex = assertThrows(UsageException.class,
            () -> binder.bind(args("extra -m x"), action("git", "commit").parameters()));
        assertEquals(ErrorKind.UNEXPECTED_ARGUMENT, ex.kind());
        assertTrue(ex.getMessage().contains("'extra'"));
    }

    @Test
    void absentParametersAreEmptyOrNull() {
        var values = binder.bind(List.of(), action("build", "run").parameters()).values();
        assertEquals(List.of(), values.getList("targets"));
        assertFalse(values.isSet("targets"));
        assertEquals(1, values.get("jobs"));
        assertEquals(ValueSource.DEFAULT, values.source("jobs"));

        var optional = ActionNode.builder("a").parameter(ParameterSpec.option("label")).build();
        var bound = binder.bind(List.of(), optional.parameters()).values();
        assertNull(bound.get("label"));
        assertEquals(ValueSource.ABSENT, bound.source("label"));
    }

    @Test
    void commandLineBeatsEnvironmentWhichBeatsPromptAndDefault() {
        var login = ActionNode.builder("login")
            .parameter(ParameterSpec.option("token").envVar("APP_TOKEN").prompt("Token: ").defaultValue("anonymous"))
            .build();
        var prompter = new ScriptedPrompter("typed");
        var withEnv = new ParameterBinder(converters, EnvironmentSource.of(Map.of("APP_TOKEN", "from-env")), prompter);

        assertEquals("cli", withEnv.bind(args("--token cli"), login.parameters()).values().get("token"));
        var fromEnv = withEnv.bind(List.of(), login.parameters()).values();
        assertEquals("from-env", fromEnv.get("token"));
        assertEquals(ValueSource.ENVIRONMENT, fromEnv.source("token"));
        assertTrue(prompter.asked().isEmpty());

        var noEnv = new ParameterBinder(converters, EnvironmentSource.of(Map.of("APP_TOKEN", "")), prompter);
        var prompted = noEnv.bind(List.of(), login.parameters()).values();
        assertEquals("typed", prompted.get("token"));
        assertEquals(ValueSource.PROMPT, prompted.source("token"));

        var defaulted = noEnv.bind(List.of(), login.parameters()).values();
        assertEquals("anonymous", defaulted.get("token"));
        assertEquals(ValueSource.DEFAULT, defaulted.source("token"));
    }

    @Test
    void securePromptSatisfiesRequiredParameter() {
        var login = ActionNode.builder("login")
            .parameter(ParameterSpec.option("password").required().securePrompt("Password: "))
            .build();
        var prompter = new ScriptedPrompter("s3cret");
        var interactive = new ParameterBinder(converters, EnvironmentSource.of(Map.of()), prompter);
        assertEquals("s3cret", interactive.bind(List.of(), login.parameters()).values().get("password"));
        assertEquals(List.of("Password: "), prompter.asked());
        assertEquals(List.of(true), prompter.secure());

        var ex = assertThrows(UsageException.class, () -> binder.bind(List.of(), login.parameters()));
        assertEquals(ErrorKind.MISSING_REQUIRED_PARAMETER, ex.kind());
    }

    @Test
    void conversionFailureNamesTheParameter() {
        var ex = assertThrows(UsageException.class, () -> binder.bind(args("--jobs many"), action("build", "run").parameters()));
        assertEquals(ErrorKind.CONVERSION_FAILURE, ex.kind());
        assertTrue(ex.getMessage().startsWith("Cannot convert value for '--jobs'"), ex.getMessage());
    }

    @Test
    void explicitValuesAreValidatedButDefaultsAreNot() {
        var ex = assertThrows(UsageException.class, () -> binder.bind(args("-j 100"), action("build", "run").parameters()));
        assertEquals(ErrorKind.VALIDATION_FAILURE, ex.kind());

        var lenient = ActionNode.builder("a")
            .parameter(ParameterSpec.option("retries").type(Integer.class).defaultValue("0").validate(new RangeRule(1, 5)))
            .build();
        assertEquals(0, binder.bind(List.of(), lenient.parameters()).values().get("retries"));
    }

    @Test
    void mutuallyExclusiveParametersCannotBeCombined() {
        var push = action("git", "push").parameters();
        var ex = assertThrows(UsageException.class, () -> binder.bind(args("-f --force-with-lease"), push));
        assertEquals(ErrorKind.MUTUAL_EXCLUSION_CONFLICT, ex.kind());
        assertEquals("Parameters --force, --force-with-lease cannot be used together (group 'mode')", ex.getMessage());

        var values = binder.bind(args("--force=false --force-with-lease"), push).values();
        assertTrue(values.getBoolean("force-with-lease"));
    }

    @Test
    void globalOptionsBindBeforeAndAfterTheCommandPath() {
        var commit = action("git", "commit").parameters();
        var result = binder.bind(args("-v"), args("-m x --profile ci"), commit, git.globalOptions());
        assertTrue(result.globalOptions().getBoolean("verbose"));
        assertEquals("ci", result.globalOptions().get("profile"));
        assertEquals("x", result.values().get("message"));

        var defaults = binder.bind(List.of(), args("-m x"), commit, git.globalOptions()).globalOptions();
        assertFalse(defaults.getBoolean("verbose"));
        assertEquals("default", defaults.get("profile"));
    }

    @Test
    void actionOptionsAreNotAcceptedBeforeTheCommand() {
        var ex = assertThrows(UsageException.class,
            () -> binder.bind(args("--amend"), args("-m x"), action("git", "commit").parameters(), git.globalOptions()));
        assertEquals(ErrorKind.UNKNOWN_OPTION, ex.kind());
    }

    @Test
    void actionOptionShadowsGlobalOfSameName() {
        var report = ActionNode.builder("report").parameter(ParameterSpec.option("profile").type(Integer.class)).build();
        var result = binder.bind(List.of(), args("--profile 3"), report.parameters(), git.globalOptions());
        assertEquals(3, result.values().get("profile"));
        assertEquals("default", result.globalOptions().get("profile"));
    }

    @Test
    void bindingTwiceGivesEqualValues() {
        var push = action("git", "push").parameters();
        var first = binder.bind(args("upstream -f"), push).values();
        var second = binder.bind(args("upstream -f"), push).values();
        assertEquals(first, second);
        assertEquals(Map.of("remote", "upstream", "force", true, "force-with-lease", false), first.asMap());
    }

    private ActionNode action(String command, String action) {
        return git.findCommand(command).orElseThrow().findAction(action).orElseThrow();
    }
}
