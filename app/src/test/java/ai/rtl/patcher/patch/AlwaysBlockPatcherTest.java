package ai.rtl.patcher.patch;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.hint.AlwaysBlockHint;
import ai.rtl.patcher.hint.SourceHints;
import ai.rtl.patcher.line.SourceLine;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlwaysBlockPatcherTest {

    private final AlwaysBlockPatcher patcher = new AlwaysBlockPatcher();

    @Test
    void infersClockFromInputDeclarationForSequentialBody() {
        PassResult result = repair("input clk;", "always", "  if (rst) y <= 0; else y <= x;");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "input clk;",
                "always @(posedge clk) begin",
                "  if (rst) y <= 0; else y <= x;",
                "end");
        assertThat(result.statistics().fixed()).isEqualTo(1);
        assertThat(result.statistics().inserted()).isEqualTo(1);
    }

    @Test
    void fallsBackToExistingClockEdge() {
        PassResult result = repair("always @(posedge aclk) q <= d;", "always @", "  r <= q;");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "always @(posedge aclk) q <= d;",
                "always @(posedge aclk) begin",
                "  r <= q;",
                "end");
    }

    @Test
    void usesCombinationalControlWithoutNonBlockingAssignments() {
        PassResult result = repair("  always", "    y = a & b;");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "  always @(*) begin",
                "    y = a & b;",
                "  end");
    }

    @Test
    void completesEmptyEventControlInPlace() {
        PassResult result = repair("always @() begin", "  y = a;", "end", "always()", "  z = b;");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "always @(*) begin",
                "  y = a;",
                "end",
                "always @(*)",
                "  z = b;");
        assertThat(result.statistics().fixed()).isEqualTo(2);
        assertThat(result.statistics().inserted()).isZero();
    }

    @Test
    void reusesExistingClosingEnd() {
        PassResult result = repair("always", "  y = a;", "end");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly("always @(*) begin", "  y = a;", "end");
        assertThat(result.statistics().inserted()).isZero();
    }

    @Test
    void keepsExplicitBeginBlockWithoutAddingAnother() {
        PassResult result = repair("always", "begin", "  y <= a;", "end");

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "always @(posedge clk)", "begin", "  y <= a;", "end");
    }

    @Test
    void prefersReferenceEventControlWhenBodyMatches() {
        SourceHints hints = new SourceHints(
                Map.of("core", List.of(new AlwaysBlockHint("always @(negedge rst_n) begin", "q <= 0;", 3))),
                List.of());
        AlwaysBlockPatcher hinted = new AlwaysBlockPatcher(RepairSettings.defaults(), hints);

        PassResult result = hinted.repair(SourceLine.ofAll(List.of("always", "  q <= 0;")));

        assertThat(SourceLine.rawLines(result.lines())).containsExactly(
                "always @(negedge rst_n) begin", "  q <= 0;", "end");
    }

    @Test
    void consultsReferenceClockBeforeDefault() {
        SourceHints hints = new SourceHints(Map.of(), List.of("sys_clk"));
        AlwaysBlockPatcher hinted = new AlwaysBlockPatcher(RepairSettings.defaults(), hints);

        PassResult result = hinted.repair(SourceLine.ofAll(List.of("always", "  q <= d;")));

        assertThat(result.lines().get(0).raw()).isEqualTo("always @(posedge sys_clk) begin");
    }

    @Test
    void leavesCompleteHeadersUntouched() {
        List<String> source = List.of(
                "always @(posedge clk) begin",
                "  q <= d;",
                "end",
                "always_comb y = a;");

        PassResult result = repair(source.toArray(new String[0]));

        assertThat(SourceLine.rawLines(result.lines())).containsExactlyElementsOf(source);
        assertThat(result.statistics().changed()).isFalse();
    }

    private PassResult repair(String... lines) {
        return patcher.repair(SourceLine.ofAll(List.of(lines)));
    }
}
