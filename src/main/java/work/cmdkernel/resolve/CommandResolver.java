package work.cmdkernel.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cmdkernel.bind.ArgumentTokenizer;
import work.cmdkernel.error.ErrorKind;
import work.cmdkernel.error.UsageException;
import work.cmdkernel.model.ActionNode;
import work.cmdkernel.model.CommandModel;
import work.cmdkernel.model.CommandNode;
import work.cmdkernel.model.ParameterSpec;
import work.cmdkernel.shared.StringSimilarity;

/**
 * Walks the command tree by name or alias (case-insensitive) and picks the target action.
 * Pure function of the model and the tokens.
 */
public final class CommandResolver {
    private static final Logger LOG = LoggerFactory.getLogger(CommandResolver.class);

    private final int commandDistance;
    private final int actionDistance;
    private final int maxSuggestions;

    public CommandResolver() {
        this(3, StringSimilarity.DEFAULT_MAX_DISTANCE, StringSimilarity.DEFAULT_MAX_RESULTS);
    }

    public CommandResolver(int commandDistance, int actionDistance, int maxSuggestions) {
        this.commandDistance = commandDistance;
        this.actionDistance = actionDistance;
        this.maxSuggestions = maxSuggestions;
    }

    public ResolvedTarget resolve(CommandModel model, List<String> tokens) {
        int index = 0;
        var globalTokens = new ArrayList<String>();
        while (index < tokens.size() && ArgumentTokenizer.looksLikeOption(tokens.get(index))) {
            var raw = tokens.get(index++);
            if (raw.equals("--")) {
                break;
            }
            var token = ArgumentTokenizer.classify(raw, false, c -> model.findGlobalShortOption(c).isPresent());
            var option = findGlobal(model, token);
            globalTokens.add(raw);
            if (!option.isFlag() && token.inlineValue() == null) {
                if (index >= tokens.size()) {
                    throw new UsageException(ErrorKind.MISSING_OPTION_VALUE,
                        "Option '" + token.display() + "' requires a value of type " + option.type().displayName());
                }
                globalTokens.add(tokens.get(index++));
            }
        }
        if (index >= tokens.size()) {
            throw new UsageException(ErrorKind.NO_COMMAND_SPECIFIED, "No command specified");
        }

        var first = tokens.get(index);
        var node = model.findCommand(first).orElseThrow(() -> new UsageException(ErrorKind.UNKNOWN_COMMAND,
            "Unknown command '" + first + "'",
            StringSimilarity.findSimilar(first, visibleNames(model.commands()), commandDistance, maxSuggestions)));
        index++;
        var path = new ArrayList<CommandNode>();
        path.add(node);
        while (index < tokens.size()) {
            var child = node.findChild(tokens.get(index));
            if (child.isEmpty()) {
                break;
            }
            node = child.get();
            path.add(node);
            index++;
        }

        var selection = selectAction(node, path, tokens, index);
        if (selection.consumesToken()) {
            index++;
        }
        var action = selection.action();
        LOG.debug("Resolved '{}' to action '{}'", pathText(path), action.name());
        return new ResolvedTarget(path, action, globalTokens, tokens.subList(index, tokens.size()));
    }

    private Selection selectAction(CommandNode node, List<CommandNode> path, List<String> tokens, int index) {
        var context = pathText(path);
        if (index >= tokens.size() || tokens.get(index).startsWith("-")) {
            return new Selection(node.primaryAction().orElseThrow(() -> noAction(node, context)), false);
        }
        var token = tokens.get(index);
        var matched = node.findAction(token);
        if (matched.isPresent()) {
            return new Selection(matched.get(), true);
        }
        var primary = node.primaryAction();
        if (primary.isPresent() && primary.get().hasArguments()) {
            return new Selection(primary.get(), false);
        }
        if (node.actions().isEmpty()) {
            if (node.children().isEmpty()) {
                throw noAction(node, context);
            }
            throw new UsageException(ErrorKind.UNKNOWN_COMMAND,
                "Unknown command '" + token + "' under '" + context + "'",
                StringSimilarity.findSimilar(token, visibleNames(node.children()), commandDistance, maxSuggestions));
        }
        var candidates = new ArrayList<String>();
        node.actions().stream().filter(action -> !action.hidden()).forEach(action -> candidates.addAll(action.names()));
        candidates.addAll(visibleNames(node.children()));
        throw new UsageException(ErrorKind.UNKNOWN_ACTION,
            "Unknown action '" + token + "' for command '" + context + "'",
            StringSimilarity.findSimilar(token, candidates, actionDistance, maxSuggestions));
    }

    private ParameterSpec findGlobal(CommandModel model, ArgumentTokenizer.Token token) {
        if (token.kind() == ArgumentTokenizer.Kind.LONG) {
            var found = model.findGlobalOption(token.name());
            if (found.isPresent()) {
                return found.get();
            }
            var candidates = model.globalOptions().stream()
                .filter(option -> !option.hidden())
                .map(option -> "--" + option.name())
                .toList();
            throw new UsageException(ErrorKind.UNKNOWN_OPTION, "Unknown option '" + token.display() + "'",
                StringSimilarity.findSimilar(token.raw().split("=", 2)[0], candidates, actionDistance, maxSuggestions));
        }
        if (token.kind() == ArgumentTokenizer.Kind.SHORT && token.name().length() == 1) {
            var found = model.findGlobalShortOption(token.name().charAt(0));
            if (found.isPresent()) {
                return found.get();
            }
        }
        throw new UsageException(ErrorKind.UNKNOWN_OPTION, "Unknown option '" + token.raw() + "'");
    }

    private static UsageException noAction(CommandNode node, String context) {
        return new UsageException(ErrorKind.NO_ACTION_SPECIFIED, "No action specified for command '" + context + "'");
    }

    private record Selection(ActionNode action, boolean consumesToken) {}

    private static List<String> visibleNames(List<CommandNode> nodes) {
        var names = new ArrayList<String>();
        nodes.stream().filter(node -> !node.hidden()).forEach(node -> names.addAll(node.names()));
        return names;
    }

    private static String pathText(List<CommandNode> path) {
        return path.stream().map(CommandNode::name).collect(Collectors.joining(" "));
    }
}
