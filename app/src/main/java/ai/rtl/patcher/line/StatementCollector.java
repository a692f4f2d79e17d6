package ai.rtl.patcher.line;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a statement that spills over several physical lines into one {@link LogicalStatement}.
 * <p>
 * A following line continues the statement when it starts with a binary or ternary operator, or when it does
 * not begin a new statement. Blank and comment lines are absorbed only when a continuation follows them.
 */
public class StatementCollector {

    public LogicalStatement collect(List<SourceLine> lines, int start) {
        SourceLine first = lines.get(start);
        List<String> parts = new ArrayList<>();
        List<String> comments = new ArrayList<>();
        parts.add(first.code());
        if (first.hasComment()) {
            comments.add(first.comment());
        }
        int consumed = 1;
        if (LineClassifier.isTerminated(first.code())) {
            return new LogicalStatement(start, consumed, first.code(), comments);
        }

        List<String> pendingComments = new ArrayList<>();
        int pendingLines = 0;
        for (int i = start + 1; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (!line.isSignificant()) {
                pendingLines++;
                if (line.isComment()) {
                    pendingComments.add(line.content());
                }
                continue;
            }
            if (line.kind().startsStatement() && !LineClassifier.startsWithContinuationOperator(line.code())) {
                break;
            }
            consumed += pendingLines + 1;
            comments.addAll(pendingComments);
            pendingComments.clear();
            pendingLines = 0;

            parts.add(line.code());
            if (line.hasComment()) {
                comments.add(line.comment());
            }
            if (LineClassifier.isTerminated(line.code())) {
                break;
            }
        }
        return new LogicalStatement(start, consumed, String.join(" ", parts), comments);
    }
}
