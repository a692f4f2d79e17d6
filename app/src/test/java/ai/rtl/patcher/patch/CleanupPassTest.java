package ai.rtl.patcher.patch;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtl.patcher.line.SourceLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class CleanupPassTest {

    private final CleanupPass pass = new CleanupPass();

    @Test
    void dropsLinesHoldingOnlyAStrayOperator() {
        PassResult result = repair("assign a = b;", "  |", "assign c = d;");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly("assign a = b;", "assign c = d;");
        assertThat(result.statistics().removed()).isEqualTo(1);
    }

    @Test
    void declaresMissingGenvarBeforeGenerateLoop() {
        PassResult result = repair(
                "generate",
                "  for (k = 0; k < 4; k = k + 1) begin: g",
                "  end",
                "endgenerate");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "generate",
                "  genvar k;",
                "  for (k = 0; k < 4; k = k + 1) begin: g",
                "  end",
                "endgenerate");
        assertThat(result.statistics().inserted()).isEqualTo(1);
    }

    @Test
    void skipsLoopsWithDeclaredOrInlineVariables() {
        List<String> source = List.of(
                "genvar k;",
                "generate",
                "  for (k = 0; k < 4; k = k + 1) begin: g",
                "  end",
                "  for (genvar m = 0; m < 2; m = m + 1) begin: h",
                "  end",
                "endgenerate",
                "always @(*) begin",
                "  for (n = 0; n < 4; n = n + 1)",
                "    y[n] = x[n];",
                "end");

        PassResult result = repair(source.toArray(new String[0]));

        assertThat(SourceLine.rawLines(result.lines())).containsExactlyElementsOf(source);
        assertThat(result.statistics()).isEqualTo(PassStatistics.unchanged("cleanup"));
    }

    private PassResult repair(String... lines) {
        return pass.repair(SourceLine.ofAll(List.of(lines)));
    }
}
