package work.cmdkernel.bind;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Classifies raw argument tokens as long options, short options, values or the {@code --} separator.
 */
public final class ArgumentTokenizer {
    private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private ArgumentTokenizer() {}

    public enum Kind {
        LONG,
        SHORT,
        VALUE,
        END
    }

    /**
     * One classified token. {@code name} is the option name without dashes, {@code inlineValue}
     * the part after {@code =} when present.
     */
    public record Token(Kind kind, String raw, String name, String inlineValue) {
        public boolean isOption() {
            return kind == Kind.LONG || kind == Kind.SHORT;
        }

        public String display() {
            return kind == Kind.LONG ? "--" + name : "-" + name;
        }
    }

    /**
     * @param optionsEnded whether {@code --} was already seen
     * @param isShortName tells whether a character is a declared short name, so that {@code -5} can be a value
     */
    public static Token classify(String raw, boolean optionsEnded, Predicate<Character> isShortName) {
        if (optionsEnded || raw.length() < 2 || raw.charAt(0) != '-') {
            return value(raw);
        }
        if (raw.equals("--")) {
            return new Token(Kind.END, raw, null, null);
        }
        if (raw.startsWith("--")) {
            var body = raw.substring(2);
            int eq = body.indexOf('=');
            if (eq >= 0) {
                return new Token(Kind.LONG, raw, body.substring(0, eq), body.substring(eq + 1));
            }
            return new Token(Kind.LONG, raw, body, null);
        }
        char first = raw.charAt(1);
        if (NEGATIVE_NUMBER.matcher(raw).matches() && !isShortName.test(first)) {
            return value(raw);
        }
        if (raw.length() > 2 && raw.charAt(2) == '=') {
            return new Token(Kind.SHORT, raw, String.valueOf(first), raw.substring(3));
        }
        return new Token(Kind.SHORT, raw, raw.substring(1), null);
    }

    /**
     * True when the token would be read as an option or separator rather than a plain word.
     */
    public static boolean looksLikeOption(String raw) {
        return raw.length() >= 2 && raw.charAt(0) == '-' && !NEGATIVE_NUMBER.matcher(raw).matches();
    }

    private static Token value(String raw) {
        return new Token(Kind.VALUE, raw, null, null);
    }
}
