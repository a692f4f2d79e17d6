package ai.rtl.patcher.line;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small keyword tokenizer shared by every repair pass.
 * <p>
 * Classifies a line by its leading keyword and answers the operator and terminator questions the
 * passes ask about a line's code, so the heuristics stay in one auditable place.
 */
public final class LineClassifier {

    private static final Map<LineKind, Pattern> LEADING_PATTERNS = new LinkedHashMap<>();

    static {
        LEADING_PATTERNS.put(LineKind.ELSE_IF, Pattern.compile("^(?:end\\s+)?else\\s+if\\s*\\("));
        LEADING_PATTERNS.put(LineKind.ELSE, Pattern.compile("^(?:end\\s+)?else\\b"));
        LEADING_PATTERNS.put(LineKind.LABELED_BEGIN, Pattern.compile("^begin\\s*:\\s*\\w+\\s*$"));
        LEADING_PATTERNS.put(LineKind.BEGIN, Pattern.compile("^begin\\b"));
        LEADING_PATTERNS.put(LineKind.ENDCASE, Pattern.compile("^endcase\\b"));
        LEADING_PATTERNS.put(LineKind.ENDMODULE, Pattern.compile("^endmodule\\b"));
        LEADING_PATTERNS.put(LineKind.ENDGENERATE, Pattern.compile("^endgenerate\\b"));
        LEADING_PATTERNS.put(LineKind.END, Pattern.compile("^end\\b"));
        LEADING_PATTERNS.put(LineKind.END_KEYWORD, Pattern.compile("^end[a-z_]+\\b"));
        LEADING_PATTERNS.put(LineKind.CASE, Pattern.compile("^(?:(?:unique0?|priority)\\s+)?case[zx]?\\s*\\("));
        LEADING_PATTERNS.put(LineKind.MODULE, Pattern.compile("^(?:macro)?module\\b"));
        LEADING_PATTERNS.put(LineKind.DECLARATION,
                Pattern.compile("^(?:input|output|inout|wire|reg|logic|integer|tri|supply0|supply1)\\b"));
        LEADING_PATTERNS.put(LineKind.PARAMETER, Pattern.compile("^(?:parameter|localparam)\\b"));
        LEADING_PATTERNS.put(LineKind.ASSIGN, Pattern.compile("^assign\\b"));
        LEADING_PATTERNS.put(LineKind.ALWAYS, Pattern.compile("^always(?:_ff|_comb|_latch)?\\b"));
        LEADING_PATTERNS.put(LineKind.IF, Pattern.compile("^if\\b"));
        LEADING_PATTERNS.put(LineKind.GENERATE, Pattern.compile("^generate\\b"));
        LEADING_PATTERNS.put(LineKind.GENVAR, Pattern.compile("^genvar\\b"));
        LEADING_PATTERNS.put(LineKind.FOR, Pattern.compile("^for\\s*\\("));
        LEADING_PATTERNS.put(LineKind.OPERATOR_ONLY, Pattern.compile("^[&|^~+\\-*/<>=!{}:?]$"));
        LEADING_PATTERNS.put(LineKind.ASSIGNMENT, Pattern.compile(
                "^(?:[A-Za-z_][\\w$.]*(?:\\s*\\[[^\\]]*\\])*|\\{[^}]*\\})\\s*<?=(?!=)"));
    }

    private static final Pattern CONTINUATION_OPERATOR = Pattern.compile("^(?:==|!=|[|&^+\\-?:])");
    private static final Pattern DANGLING_OPERATOR = Pattern.compile("(?:[|&^+\\-?:]|<?=)$");
    private static final Pattern IF_CONDITION = Pattern.compile("\\bif\\s*\\(");
    private static final Pattern CASE_OPENING = Pattern.compile("\\bcase[zx]?\\s*\\(");
    private static final Pattern BARE_LABEL = Pattern.compile("^(?:default|[^=;:?]+?)\\s*:$");

    private LineClassifier() {
    }

    /**
     * Classifies a line from its full content and its code part (content without a trailing comment).
     */
    public static LineKind classify(String code, String content) {
        if (content == null || content.isBlank()) {
            return LineKind.BLANK;
        }
        if (code == null || code.isEmpty() || content.startsWith("/*")) {
            return LineKind.COMMENT;
        }
        for (Map.Entry<LineKind, Pattern> entry : LEADING_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(code).find()) {
                return entry.getKey();
            }
        }
        return LineKind.OTHER;
    }

    /**
     * True when the code begins with a binary or ternary operator and therefore continues the previous line.
     */
    public static boolean startsWithContinuationOperator(String code) {
        return CONTINUATION_OPERATOR.matcher(code).find();
    }

    /**
     * True when the code ends with an operator that still expects a right-hand operand.
     */
    public static boolean endsWithDanglingOperator(String code) {
        return DANGLING_OPERATOR.matcher(code).find();
    }

    public static boolean isTerminated(String code) {
        return code.endsWith(";");
    }

    public static boolean containsIfCondition(String code) {
        return IF_CONDITION.matcher(code).find();
    }

    /**
     * Offset of the first {@code if (} keyword within {@code code}, or -1 when there is none.
     */
    public static int ifConditionOffset(String code) {
        Matcher matcher = IF_CONDITION.matcher(code);
        return matcher.find() ? matcher.start() : -1;
    }

    public static boolean opensCase(String code) {
        return CASE_OPENING.matcher(code).find();
    }

    /**
     * True for a case label standing alone on its line, such as {@code default:} or {@code 2'b01:}.
     */
    public static boolean isBareLabel(String code) {
        return BARE_LABEL.matcher(code).matches();
    }
}
