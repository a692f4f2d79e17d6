package ai.rtl.patcher.line;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatementCollectorTest {

    private final StatementCollector collector = new StatementCollector();

    @Test
    void foldsContinuationLinesUntilNextStatement() {
        List<SourceLine> lines = SourceLine.ofAll(List.of(
                "assign a =",
                "  (sel) ?",
                "  1'b1 :",
                "  1'b0",
                "assign b = c;"));

        LogicalStatement statement = collector.collect(lines, 0);

        assertThat(statement.lineCount()).isEqualTo(4);
        assertThat(statement.endIndex()).isEqualTo(3);
        assertThat(statement.text()).isEqualTo("assign a = (sel) ? 1'b1 : 1'b0");
    }

    @Test
    void stopsAfterTerminator() {
        List<SourceLine> lines = SourceLine.ofAll(List.of("x = a |", "  b;", "y = 1;"));

        LogicalStatement statement = collector.collect(lines, 0);

        assertThat(statement.lineCount()).isEqualTo(2);
        assertThat(statement.text()).isEqualTo("x = a | b;");
    }

    @Test
    void returnsTerminatedLineAlone() {
        List<SourceLine> lines = SourceLine.ofAll(List.of("assign a = b; // keep", "  | c;"));

        LogicalStatement statement = collector.collect(lines, 0);

        assertThat(statement.spansMultipleLines()).isFalse();
        assertThat(statement.comments()).containsExactly("// keep");
    }

    @Test
    void absorbsCommentsOnlyWhenContinuationFollows() {
        List<SourceLine> continued = SourceLine.ofAll(List.of("assign a = b", "// note", "  | c;"));
        List<SourceLine> interrupted = SourceLine.ofAll(List.of("assign a = b", "// note", "assign c = d;"));

        LogicalStatement joined = collector.collect(continued, 0);
        LogicalStatement alone = collector.collect(interrupted, 0);

        assertThat(joined.lineCount()).isEqualTo(3);
        assertThat(joined.text()).isEqualTo("assign a = b | c;");
        assertThat(joined.trailingComment()).isEqualTo("// note");
        assertThat(alone.lineCount()).isEqualTo(1);
        assertThat(alone.comments()).isEmpty();
    }
}
