package work.cmdkernel.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import work.cmdkernel.api.Diagnostic;
import work.cmdkernel.api.DiagnosticSink;
import work.cmdkernel.bind.Prompter;
import work.cmdkernel.convert.TypeDescriptor;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.model.CommandNode;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.validation.RangeRule;

/**
 * Shared models and fakes for dispatcher test suites, so each suite can exercise resolution,
 * binding and hooks without a YAML fixture.
 */
public final class DispatchTestSupport {
    private DispatchTestSupport() {}

    /**
     * {@code tool [--verbose|-v] [--profile NAME] git commit|push|status} plus {@code build}.
     */
    public static CommandModel gitModel() {
        return CommandModel.builder("tool")
            .globalOption(ParameterSpec.option("verbose").shortName('v').type(Boolean.class))
            .globalOption(ParameterSpec.option("profile").defaultValue("default"))
            .command(CommandNode.builder("git")
                .alias("g")
                .action(ActionNode.builder("commit")
                    .alias("ci")
                    .handler("git.commit")
                    .parameter(ParameterSpec.option("message").shortName('m').required())
                    .parameter(ParameterSpec.option("amend").type(Boolean.class)))
                .action(ActionNode.builder("push")
                    .handler("git.push")
                    .parameter(ParameterSpec.argument("remote").defaultValue("origin"))
                    .parameter(ParameterSpec.option("force").shortName('f').type(Boolean.class).mutuallyExclusive("mode"))
                    .parameter(ParameterSpec.option("force-with-lease").type(Boolean.class).mutuallyExclusive("mode")))
                .action(ActionNode.builder("status")
                    .primary()
                    .handler("git.status")
                    .parameter(ParameterSpec.option("short").shortName('s').type(Boolean.class))))
            .command(CommandNode.builder("build")
                .action(ActionNode.builder("run")
                    .primary()
                    .handler("build.run")
                    .parameter(ParameterSpec.argument("targets").type(TypeDescriptor.listOf(String.class)))
                    .parameter(ParameterSpec.option("jobs").shortName('j').type(Integer.class).defaultValue("1")
                        .validate(new RangeRule(1, 64)))))
            .build();
    }

    /**
     * {@code deploy --environment ENV [--region R] [--version V]}.
     */
    public static CommandModel deployModel() {
        return CommandModel.builder("ops")
            .command(CommandNode.builder("deploy")
                .action(ActionNode.builder("run")
                    .primary()
                    .handler("deploy.run")
                    .parameter(ParameterSpec.option("environment").shortName('e').required())
                    .parameter(ParameterSpec.option("region").defaultValue("eu-west"))
                    .parameter(ParameterSpec.option("version").defaultValue("latest"))))
            .build();
    }

    public static List<String> args(String line) {
        return line.isBlank() ? List.of() : Arrays.asList(line.trim().split("\\s+"));
    }

    /**
     * Collects every reported diagnostic.
     */
    public static final class RecordingSink implements DiagnosticSink {
        private final List<Diagnostic> reported = new ArrayList<>();

        @Override
        public void report(Diagnostic diagnostic) {
            reported.add(diagnostic);
        }

        public List<Diagnostic> reported() {
            return reported;
        }

        public Diagnostic last() {
            if (reported.isEmpty()) {
                throw new AssertionError("No diagnostic reported");
            }
            return reported.get(reported.size() - 1);
        }
    }

    /**
     * Interactive prompter answering from a fixed queue; remembers what it was asked.
     */
    public static final class ScriptedPrompter implements Prompter {
        private final Deque<String> answers;
        private final List<String> asked = new ArrayList<>();
        private final List<Boolean> secure = new ArrayList<>();

        public ScriptedPrompter(String... answers) {
            this.answers = new ArrayDeque<>(Arrays.asList(answers));
        }

        @Override
        public boolean isInteractive() {
            return true;
        }

        @Override
        public String prompt(String message, boolean secureInput) {
            asked.add(message);
            secure.add(secureInput);
            return answers.isEmpty() ? null : answers.poll();
        }

        public List<String> asked() {
            return asked;
        }

        public List<Boolean> secure() {
            return secure;
        }
    }
}
