package ai.rtl.patcher.line;

import java.util.List;
import java.util.Objects;

/**
 * Consecutive source lines folded into one statement: the joined code and the comments met on the way.
 */
public record LogicalStatement(int startIndex, int lineCount, String text, List<String> comments) {

    public LogicalStatement {
        if (startIndex < 0 || lineCount < 1) {
            throw new IllegalArgumentException("A statement spans at least one line");
        }
        Objects.requireNonNull(text, "text");
        comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
    }

    public int endIndex() {
        return startIndex + lineCount - 1;
    }

    public boolean spansMultipleLines() {
        return lineCount > 1;
    }

    /**
     * Comments joined into a single trailing line comment, or an empty string.
     */
    public String trailingComment() {
        return String.join(" ", comments);
    }
}
