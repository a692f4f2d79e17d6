package ai.rtl.patcher.line;

/**
 * Classification of a source line by its leading keyword.
 */
public enum LineKind {
    BLANK(false),
    COMMENT(false),
    MODULE(true),
    ENDMODULE(true),
    DECLARATION(true),
    PARAMETER(true),
    ASSIGN(true),
    ALWAYS(true),
    CASE(true),
    ENDCASE(true),
    IF(true),
    ELSE_IF(true),
    ELSE(true),
    BEGIN(true),
    LABELED_BEGIN(true),
    END(true),
    END_KEYWORD(true),
    GENERATE(true),
    ENDGENERATE(true),
    GENVAR(true),
    FOR(true),
    OPERATOR_ONLY(false),
    ASSIGNMENT(true),
    OTHER(false);

    private final boolean startsStatement;

    LineKind(boolean startsStatement) {
        this.startsStatement = startsStatement;
    }

    /**
     * Whether a line of this kind begins a new statement rather than continuing the previous one.
     */
    public boolean startsStatement() {
        return startsStatement;
    }

    public boolean isElse() {
        return this == ELSE || this == ELSE_IF;
    }
}
