package ai.rtl.patcher.line;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One physical line of HDL source: its indentation, trimmed content, code and trailing comment.
 * <p>
 * Instances are immutable; passes replace lines rather than mutate them.
 */
public record SourceLine(String raw, String indent, String content, String code, String comment, LineKind kind) {

    public SourceLine {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(comment, "comment");
        Objects.requireNonNull(kind, "kind");
    }

    public static SourceLine of(String text) {
        String raw = stripTerminator(text == null ? "" : text);
        int contentStart = 0;
        while (contentStart < raw.length() && (raw.charAt(contentStart) == ' ' || raw.charAt(contentStart) == '\t')) {
            contentStart++;
        }
        String indent = raw.substring(0, contentStart);
        String content = raw.substring(contentStart).strip();
        int commentStart = commentStart(content);
        String code = commentStart < 0 ? content : content.substring(0, commentStart).strip();
        String comment = commentStart < 0 ? "" : content.substring(commentStart);
        return new SourceLine(raw, indent, content, code, comment, LineClassifier.classify(code, content));
    }

    public static SourceLine of(String indent, String content) {
        return of(indent + content);
    }

    public static List<SourceLine> ofAll(List<String> lines) {
        return lines.stream().map(SourceLine::of).collect(Collectors.toList());
    }

    public static List<String> rawLines(List<SourceLine> lines) {
        return lines.stream().map(SourceLine::raw).collect(Collectors.toList());
    }

    /**
     * Returns a line with the same indentation and the given content.
     */
    public SourceLine withContent(String newContent) {
        return of(indent, newContent);
    }

    /**
     * Returns this line shifted right by the given prefix; blank lines stay untouched.
     */
    public SourceLine shiftedBy(String prefix) {
        return isBlank() ? this : of(prefix + raw);
    }

    public int indentWidth() {
        return indent.length();
    }

    public boolean isBlank() {
        return kind == LineKind.BLANK;
    }

    public boolean isComment() {
        return kind == LineKind.COMMENT;
    }

    public boolean isSignificant() {
        return !isBlank() && !isComment();
    }

    public boolean hasComment() {
        return !comment.isEmpty();
    }

    private static String stripTerminator(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    private static int commentStart(String content) {
        boolean inString = false;
        for (int i = 0; i < content.length() - 1; i++) {
            char ch = content.charAt(i);
            if (ch == '"' && (i == 0 || content.charAt(i - 1) != '\\')) {
                inString = !inString;
            } else if (!inString && ch == '/' && content.charAt(i + 1) == '/') {
                return i;
            }
        }
        return -1;
    }
}
