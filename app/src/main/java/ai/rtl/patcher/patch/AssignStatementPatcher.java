package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.LineClassifier;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.LogicalStatement;
import ai.rtl.patcher.line.SourceLine;
import ai.rtl.patcher.line.StatementCollector;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes continuous assignments: folds multi-line {@code assign} statements, splits several statements
 * fused onto one line, closes unbalanced ternaries and missing terminators, and completes dangling right-hand
 * sides with a default literal.
 */
public class AssignStatementPatcher implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssignStatementPatcher.class);

    static final String DEFAULT_LITERAL = "1'b0";
    static final String TRUE_LITERAL = "1'b1";

    private static final Pattern FUSED_ASSIGNS = Pattern.compile("^(assign\\s+[^=]+=\\s*[^;]+?;?)\\s+(assign\\s+.*)$");
    private static final Pattern BROKEN_TERNARY_BRANCH =
            Pattern.compile("\\?\\s*else\\s+if\\s*\\([^)]+\\)\\s*[^;:]+;\\s*:");
    private static final Pattern SPLIT_LESS_EQUAL = Pattern.compile("<\\s+=");
    private static final Pattern SPLIT_DOUBLE_EQUAL = Pattern.compile("=\\s+=");
    private static final Pattern ASSIGNMENT_OPERATOR = Pattern.compile("\\s*(?<![<>!=])=(?!=)\\s*");
    private static final Pattern HAS_ASSIGNMENT = Pattern.compile("(?<![<>!=])<?=(?!=)");
    private static final Pattern QUESTION_MARK = Pattern.compile("\\s*\\?\\s*");
    private static final Pattern SPACE_BEFORE_TERMINATOR = Pattern.compile("\\s+;$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ORPHAN_CONTINUATION = Pattern.compile("^[?:|&^]");
    private static final Set<LineKind> NON_ASSIGNMENT_HEADERS =
            EnumSet.of(LineKind.ASSIGN, LineKind.IF, LineKind.ELSE_IF, LineKind.CASE, LineKind.FOR, LineKind.PARAMETER);

    private final StatementCollector collector;

    public AssignStatementPatcher() {
        this(new StatementCollector());
    }

    public AssignStatementPatcher(StatementCollector collector) {
        this.collector = Objects.requireNonNull(collector, "collector");
    }

    @Override
    public String name() {
        return "assign";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        List<SourceLine> output = new ArrayList<>(lines.size());

        int index = 0;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            if (isAssignStart(line)) {
                LogicalStatement statement = collector.collect(lines, index);
                repairAssign(line, statement, output, counter);
                index += statement.lineCount();
            } else if (isOrphanContinuation(line) && !output.isEmpty() && canAbsorb(output.get(output.size() - 1))) {
                SourceLine previous = output.remove(output.size() - 1);
                List<String> comments = new ArrayList<>();
                if (previous.hasComment()) {
                    comments.add(previous.comment());
                }
                if (line.hasComment()) {
                    comments.add(line.comment());
                }
                output.add(previous.withContent(withComments(previous.code() + " " + line.code(), comments)));
                counter.fixed();
                LOGGER.debug("Merged orphan continuation at line {} into the previous line", index + 1);
                index++;
            } else if (isDanglingAssignment(line)) {
                LogicalStatement statement = collector.collect(lines, index);
                String closed = closeExpression(statement.text());
                if (statement.spansMultipleLines()) {
                    counter.merged();
                }
                if (!closed.equals(statement.text())) {
                    counter.fixed();
                    LOGGER.debug("Completed dangling assignment at line {}", index + 1);
                }
                output.add(line.withContent(withComments(closed, statement.comments())));
                index += statement.lineCount();
            } else {
                output.add(line);
                index++;
            }
        }
        return new PassResult(output, counter.toStatistics());
    }

    private void repairAssign(SourceLine first, LogicalStatement statement, List<SourceLine> output,
                              RepairCounter counter) {
        if (statement.spansMultipleLines()) {
            counter.merged();
            LOGGER.debug("Merged multi-line assign at line {} ({} lines -> 1 line)",
                    statement.startIndex() + 1, statement.lineCount());
        }

        List<String> pieces = splitFusedAssigns(statement.text());
        if (pieces.size() > 1) {
            counter.fixed();
            LOGGER.debug("Split {} assign statements fused on line {}", pieces.size(), statement.startIndex() + 1);
            for (int i = 0; i < pieces.size(); i++) {
                String repaired = repairStatement(pieces.get(i));
                List<String> comments = i == pieces.size() - 1 ? statement.comments() : List.of();
                output.add(first.withContent(withComments(repaired, comments)));
            }
            return;
        }

        String repaired = repairStatement(statement.text());
        if (repaired.equals(statement.text())) {
            if (statement.spansMultipleLines()) {
                output.add(first.withContent(withComments(repaired, statement.comments())));
            } else {
                output.add(first);
            }
            return;
        }
        counter.fixed();
        LOGGER.debug("Repaired assign statement at line {}: {}", statement.startIndex() + 1, repaired);
        output.add(first.withContent(withComments(repaired, statement.comments())));
    }

    /**
     * Repairs one complete {@code assign} statement and returns it in canonical spacing with a terminator.
     */
    String repairStatement(String statement) {
        String repaired = BROKEN_TERNARY_BRANCH.matcher(statement).replaceAll(" ? " + DEFAULT_LITERAL + " :");
        repaired = closeExpression(repaired);
        return canonicalize(repaired);
    }

    /**
     * Splits {@code assign a = b assign c = d;} into independently terminated statements.
     */
    List<String> splitFusedAssigns(String statement) {
        List<String> pieces = new ArrayList<>();
        String rest = statement.strip();
        Matcher matcher = FUSED_ASSIGNS.matcher(rest);
        while (matcher.matches()) {
            String head = matcher.group(1).strip();
            pieces.add(head.endsWith(";") ? head : head + ";");
            rest = matcher.group(2).strip();
            matcher = FUSED_ASSIGNS.matcher(rest);
        }
        pieces.add(rest);
        return pieces;
    }

    /**
     * Completes a dangling operand, balances {@code ?} with {@code :} and appends the terminator.
     */
    static String closeExpression(String statement) {
        String body = statement.strip();
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }
        body = SPLIT_LESS_EQUAL.matcher(body).replaceAll("<=");
        body = completeDanglingOperand(body);

        int missingBranches = ternaryQuestionCount(body) - ternaryColonCount(body);
        StringBuilder builder = new StringBuilder(body);
        for (int i = 0; i < missingBranches; i++) {
            builder.append(" : ").append(DEFAULT_LITERAL);
        }
        return builder.append(';').toString();
    }

    static String canonicalize(String statement) {
        String canonical = WHITESPACE.matcher(statement.strip()).replaceAll(" ");
        canonical = SPLIT_DOUBLE_EQUAL.matcher(canonical).replaceAll("==");
        canonical = ASSIGNMENT_OPERATOR.matcher(canonical).replaceAll(" = ");
        canonical = QUESTION_MARK.matcher(canonical).replaceAll(" ? ");
        canonical = spaceTernaryColons(canonical);
        canonical = WHITESPACE.matcher(canonical).replaceAll(" ").strip();
        return SPACE_BEFORE_TERMINATOR.matcher(canonical).replaceAll(";");
    }

    /**
     * Number of {@code :} acting as ternary separators, i.e. outside bit-select brackets and not part of
     * {@code ::}.
     */
    static int ternaryColonCount(String text) {
        int count = 0;
        int bracketDepth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '[') {
                bracketDepth++;
            } else if (ch == ']') {
                bracketDepth = Math.max(0, bracketDepth - 1);
            } else if (ch == ':' && bracketDepth == 0 && isSingleColon(text, i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of {@code ?} outside bit-select brackets. A ternary inside {@code [...]} carries its own
     * {@code :} there, which {@link #ternaryColonCount(String)} does not see either.
     */
    static int ternaryQuestionCount(String text) {
        int count = 0;
        int bracketDepth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '[') {
                bracketDepth++;
            } else if (ch == ']') {
                bracketDepth = Math.max(0, bracketDepth - 1);
            } else if (ch == '?' && bracketDepth == 0) {
                count++;
            }
        }
        return count;
    }

    private static String completeDanglingOperand(String body) {
        if (body.endsWith("?")) {
            return body + " " + TRUE_LITERAL + " : " + DEFAULT_LITERAL;
        }
        if (LineClassifier.endsWithDanglingOperator(body)) {
            return body + " " + DEFAULT_LITERAL;
        }
        return body;
    }

    private static String spaceTernaryColons(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 8);
        int bracketDepth = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '[') {
                bracketDepth++;
            } else if (ch == ']') {
                bracketDepth = Math.max(0, bracketDepth - 1);
            }
            if (ch == ':' && bracketDepth == 0 && isSingleColon(text, i)) {
                while (builder.length() > 0 && builder.charAt(builder.length() - 1) == ' ') {
                    builder.setLength(builder.length() - 1);
                }
                builder.append(" : ");
                i++;
                while (i < text.length() && text.charAt(i) == ' ') {
                    i++;
                }
                continue;
            }
            builder.append(ch);
            i++;
        }
        return builder.toString();
    }

    private static boolean isSingleColon(String text, int index) {
        boolean colonBefore = index > 0 && text.charAt(index - 1) == ':';
        boolean colonAfter = index + 1 < text.length() && text.charAt(index + 1) == ':';
        return !colonBefore && !colonAfter;
    }

    private static boolean isAssignStart(SourceLine line) {
        return line.kind() == LineKind.ASSIGN && line.code().contains("=");
    }

    private static boolean isOrphanContinuation(SourceLine line) {
        return line.isSignificant() && ORPHAN_CONTINUATION.matcher(line.code()).find();
    }

    private static boolean canAbsorb(SourceLine previous) {
        if (!previous.isSignificant() || LineClassifier.isBareLabel(previous.code())) {
            return false;
        }
        if (previous.kind() == LineKind.ASSIGN && !LineClassifier.isTerminated(previous.code())) {
            return true;
        }
        return LineClassifier.endsWithDanglingOperator(previous.code());
    }

    private static boolean isDanglingAssignment(SourceLine line) {
        String code = line.code();
        if (!line.isSignificant() || NON_ASSIGNMENT_HEADERS.contains(line.kind())) {
            return false;
        }
        if (!HAS_ASSIGNMENT.matcher(code).find() || !LineClassifier.endsWithDanglingOperator(code)) {
            return false;
        }
        return !code.endsWith(":") || code.contains("?");
    }

    private static String withComments(String code, List<String> comments) {
        if (comments.isEmpty()) {
            return code;
        }
        return code + " " + String.join(" ", comments);
    }
}
