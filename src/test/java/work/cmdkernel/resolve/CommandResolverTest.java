package work.cmdkernel.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.cmdkernel.support.DispatchTestSupport.args;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.model.CommandNode;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.support.DispatchTestSupport;

class CommandResolverTest {
    private final CommandResolver resolver = new CommandResolver();
    private final CommandModel git = DispatchTestSupport.gitModel();

    @Test
    void resolvesCommandAndActionAndLeavesOptionTokens() {
        var target = resolver.resolve(git, args("git commit -m fix --amend"));
        assertEquals("git", target.command().name());
        assertEquals("commit", target.action().name());
        assertEquals(List.of("-m", "fix", "--amend"), target.remaining());
        assertTrue(target.globalTokens().isEmpty());
    }

    @Test
    void matchesAliasesIgnoringCase() {
        var target = resolver.resolve(git, args("G CI -m x"));
        assertEquals("git", target.command().name());
        assertEquals("commit", target.action().name());
    }

    @Test
    void collectsLeadingGlobalOptionsWithTheirValues() {
        var target = resolver.resolve(git, args("-v --profile ci git push upstream"));
        assertEquals(List.of("-v", "--profile", "ci"), target.globalTokens());
        assertEquals("push", target.action().name());
        assertEquals(List.of("upstream"), target.remaining());
    }

    @Test
    void fallsBackToPrimaryActionWhenNoActionNamed() {
        assertEquals("status", resolver.resolve(git, args("git")).action().name());
        var withOption = resolver.resolve(git, args("git -s"));
        assertEquals("status", withOption.action().name());
        assertEquals(List.of("-s"), withOption.remaining());
    }

    @Test
    void plainTokenGoesToPrimaryActionWithArguments() {
        var target = resolver.resolve(git, args("build app lib"));
        assertEquals("run", target.action().name());
        assertEquals(List.of("app", "lib"), target.remaining());
    }

    @Test
    void emptyInputNeedsACommand() {
        var ex = assertThrows(UsageException.class, () -> resolver.resolve(git, List.of()));
        assertEquals(ErrorKind.NO_COMMAND_SPECIFIED, ex.kind());
        var onlyGlobals = assertThrows(UsageException.class, () -> resolver.resolve(git, args("--verbose")));
        assertEquals(ErrorKind.NO_COMMAND_SPECIFIED, onlyGlobals.kind());
    }

    @Test
    void unknownCommandSuggestsCloseNames() {
        var ex = assertThrows(UsageException.class, () -> resolver.resolve(git, args("buidl")));
        assertEquals(ErrorKind.UNKNOWN_COMMAND, ex.kind());
        assertEquals(List.of("build"), ex.suggestions());
        assertEquals("Unknown command 'buidl'", ex.getMessage());
    }

    @Test
    void unknownActionSuggestsCloseActions() {
        var ex = assertThrows(UsageException.class, () -> resolver.resolve(git, args("git comit -m x")));
        assertEquals(ErrorKind.UNKNOWN_ACTION, ex.kind());
        assertEquals(List.of("commit"), ex.suggestions());
    }

    @Test
    void unknownOrIncompleteGlobalOptionsAreUsageErrors() {
        var unknown = assertThrows(UsageException.class, () -> resolver.resolve(git, args("--verbos git")));
        assertEquals(ErrorKind.UNKNOWN_OPTION, unknown.kind());
        assertEquals(List.of("--verbose"), unknown.suggestions());
        var missing = assertThrows(UsageException.class, () -> resolver.resolve(git, args("--profile")));
        assertEquals(ErrorKind.MISSING_OPTION_VALUE, missing.kind());
    }

    @Test
    void descendsIntoNestedCommands() {
        var model = cloudModel();
        var target = resolver.resolve(model, args("cloud vm start web-1"));
        assertEquals(List.of("cloud", "vm"), target.commandPath().stream().map(CommandNode::name).toList());
        assertEquals("start", target.action().name());
        assertEquals(List.of("web-1"), target.remaining());
    }

    @Test
    void groupWithoutActionsReportsUnknownSubcommand() {
        var model = cloudModel();
        var ex = assertThrows(UsageException.class, () -> resolver.resolve(model, args("cloud vn start")));
        assertEquals(ErrorKind.UNKNOWN_COMMAND, ex.kind());
        assertEquals(List.of("vm"), ex.suggestions());
        assertEquals(ErrorKind.NO_ACTION_SPECIFIED,
            assertThrows(UsageException.class, () -> resolver.resolve(model, args("cloud vm"))).kind());
    }

    @Test
    void hiddenCommandsResolveButAreNeverSuggested() {
        var model = cloudModel();
        assertEquals("dump", resolver.resolve(model, args("debug dump")).action().name());
        var ex = assertThrows(UsageException.class, () -> resolver.resolve(model, args("debgu")));
        assertTrue(ex.suggestions().isEmpty());
    }

    private static CommandModel cloudModel() {
        return CommandModel.builder("cloudctl")
            .command(CommandNode.builder("cloud")
                .child(CommandNode.builder("vm")
                    .action(ActionNode.builder("start").parameter(ParameterSpec.argument("name").required()))
                    .action(ActionNode.builder("stop").parameter(ParameterSpec.argument("name").required()))))
            .command(CommandNode.builder("debug").hidden().action(ActionNode.builder("dump")))
            .build();
    }
}
