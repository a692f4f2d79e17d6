package ai.rtl.patcher.line;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Depth-counted navigation over {@code begin/end} and {@code case/endcase} structure.
 * <p>
 * Indentation is never consulted here; callers combine these answers with indentation where they need a
 * tie-breaker.
 */
public final class BlockScanner {

    private static final Pattern BLOCK_TOKEN = Pattern.compile("\\b(begin|end)\\b");
    private static final Pattern CASE_TOKEN = Pattern.compile("\\b(?:(endcase)\\b|case[zx]?\\s*\\()");
    private static final Pattern OPENS_BLOCK = Pattern.compile("\\bbegin(?:\\s*:\\s*\\w+)?$");
    private static final Pattern LEADING_ELSE = Pattern.compile("^(?:end\\s+)?else\\b\\s*");
    private static final Pattern IF_CONDITION = Pattern.compile("\\bif\\s*\\(");
    private static final int TERMINATOR_LOOKAHEAD = 10;

    private BlockScanner() {
    }

    /**
     * Net change in {@code begin/end} nesting contributed by one line.
     */
    public static int depthDelta(SourceLine line) {
        int delta = 0;
        Matcher matcher = BLOCK_TOKEN.matcher(line.code());
        while (matcher.find()) {
            delta += "begin".equals(matcher.group(1)) ? 1 : -1;
        }
        return delta;
    }

    /**
     * True when the code ends by opening a {@code begin} block, optionally labeled.
     */
    public static boolean opensBlock(String code) {
        return OPENS_BLOCK.matcher(code).find();
    }

    public static int nextSignificant(List<SourceLine> lines, int from) {
        for (int i = Math.max(0, from); i < lines.size(); i++) {
            if (lines.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    public static int previousSignificant(List<SourceLine> lines, int before) {
        for (int i = Math.min(before, lines.size()) - 1; i >= 0; i--) {
            if (lines.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the {@code end} closing the block opened by the last {@code begin} on {@code openIndex}, or the
     * last line when the block never closes.
     */
    public static int matchingEnd(List<SourceLine> lines, int openIndex) {
        int depth = 1;
        for (int i = openIndex + 1; i < lines.size(); i++) {
            Matcher matcher = BLOCK_TOKEN.matcher(lines.get(i).code());
            while (matcher.find()) {
                depth += "begin".equals(matcher.group(1)) ? 1 : -1;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return lines.size() - 1;
    }

    /**
     * Index of the {@code endcase} closing the case opened on {@code caseIndex}, or the last line when none does.
     */
    public static int matchingEndcase(List<SourceLine> lines, int caseIndex) {
        int depth = 1;
        for (int i = caseIndex + 1; i < lines.size(); i++) {
            Matcher matcher = CASE_TOKEN.matcher(lines.get(i).code());
            while (matcher.find()) {
                depth += matcher.group(1) != null ? -1 : 1;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return lines.size() - 1;
    }

    /**
     * Last line of the procedural statement starting at the first significant line at or after {@code from}:
     * a begin block, a case block, a whole if/else chain or a terminated simple statement.
     *
     * @return the index of the statement's last line, or -1 when no statement follows
     */
    public static int statementEnd(List<SourceLine> lines, int from) {
        int start = nextSignificant(lines, from);
        if (start < 0) {
            return -1;
        }
        SourceLine line = lines.get(start);
        return switch (line.kind()) {
            case BEGIN, LABELED_BEGIN -> matchingEnd(lines, start);
            case CASE -> matchingEndcase(lines, start);
            case IF -> ifChainEnd(lines, start);
            default -> opensBlock(line.code()) ? matchingEnd(lines, start) : terminatedEnd(lines, start);
        };
    }

    /**
     * Last line of the branch body controlled by the {@code if}, {@code else if} or {@code else} header on
     * {@code headerIndex}, excluding any following {@code else}.
     */
    public static int branchEnd(List<SourceLine> lines, int headerIndex) {
        String rest = branchRemainder(lines.get(headerIndex).code());
        if (opensBlock(rest)) {
            return matchingEnd(lines, headerIndex);
        }
        if (!rest.isEmpty()) {
            return rest.contains(";") ? headerIndex : terminatedEnd(lines, headerIndex);
        }
        int end = statementEnd(lines, headerIndex + 1);
        return end < 0 ? headerIndex : end;
    }

    /**
     * Code following an {@code else} keyword and/or an {@code if (...)} condition on the same line.
     */
    public static String branchRemainder(String code) {
        String rest = code.strip();
        Matcher elseMatcher = LEADING_ELSE.matcher(rest);
        if (elseMatcher.find()) {
            rest = rest.substring(elseMatcher.end());
        }
        Matcher ifMatcher = IF_CONDITION.matcher(rest);
        if (ifMatcher.find()) {
            int close = closingParenthesis(rest, ifMatcher.end() - 1);
            rest = close < 0 ? "" : rest.substring(close + 1);
        }
        return rest.strip();
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1 when it stays open on this line.
     */
    public static int closingParenthesis(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int ifChainEnd(List<SourceLine> lines, int ifIndex) {
        int end = branchEnd(lines, ifIndex);
        int lastHeader = ifIndex;
        while (true) {
            int elseIndex;
            if (end > lastHeader && lines.get(end).kind().isElse()) {
                // "end else" closes one branch and opens the next on the same line
                elseIndex = end;
            } else {
                int next = nextSignificant(lines, end + 1);
                if (next < 0 || !lines.get(next).kind().isElse() || lines.get(next).code().startsWith("end")) {
                    return end;
                }
                elseIndex = next;
            }
            lastHeader = elseIndex;
            end = branchEnd(lines, elseIndex);
        }
    }

    private static int terminatedEnd(List<SourceLine> lines, int start) {
        int limit = Math.min(lines.size(), start + TERMINATOR_LOOKAHEAD + 1);
        for (int i = start; i < limit; i++) {
            SourceLine line = lines.get(i);
            if (i > start && line.isSignificant() && line.kind().startsStatement()) {
                return Math.max(previousSignificant(lines, i), start);
            }
            if (line.code().contains(";")) {
                return i;
            }
        }
        return start;
    }
}
