package work.cmdkernel.shell;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an interactive line into arguments. Respects "double" and 'single' quotes and backslash escapes.
 */
public final class CommandLineSplitter {
    private CommandLineSplitter() {}

    public static List<String> split(String line) {
        var tokens = new ArrayList<String>();
        if (line == null) {
            return tokens;
        }
        var current = new StringBuilder();
        boolean started = false;
        boolean escaped = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
                continue;
            }
            if (c == '\\' && quote != '\'') {
                escaped = true;
                started = true;
                continue;
            }
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                started = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (started) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    started = false;
                }
                continue;
            }
            current.append(c);
            started = true;
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated " + (quote == '"' ? "double" : "single") + " quote");
        }
        if (escaped) {
            current.append('\\');
        }
        if (started) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
