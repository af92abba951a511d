package work.cmdkernel.shell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded list of entered lines. Blank lines and immediate repeats are not recorded.
 */
public final class CommandHistory {
    private final List<String> entries = new ArrayList<>();
    private final int maxSize;

    public CommandHistory() {
        this(100);
    }

    public CommandHistory(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("History size must be positive");
        }
        this.maxSize = maxSize;
    }

    public void add(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        if (!entries.isEmpty() && entries.get(entries.size() - 1).equals(line)) {
            return;
        }
        entries.add(line);
        while (entries.size() > maxSize) {
            entries.remove(0);
        }
    }

    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * The last {@code limit} entries, oldest first.
     */
    public List<String> last(int limit) {
        int from = Math.max(0, entries.size() - Math.max(0, limit));
        return Collections.unmodifiableList(entries.subList(from, entries.size()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
