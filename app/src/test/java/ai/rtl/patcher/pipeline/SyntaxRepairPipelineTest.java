package ai.rtl.patcher.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtl.patcher.line.SourceLine;
import ai.rtl.patcher.patch.PassResult;
import ai.rtl.patcher.patch.PassStatistics;
import ai.rtl.patcher.patch.RepairPass;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class SyntaxRepairPipelineTest {

    private static final List<String> WELL_FORMED = List.of(
            "module counter #(parameter WIDTH = 4) (",
            "  input clk,",
            "  input rst,",
            "  output reg [WIDTH-1:0] q",
            ");",
            "  wire [WIDTH-1:0] next;",
            "  assign next = q + 1'b1;",
            "",
            "  always @(posedge clk) begin",
            "    if (rst) begin",
            "      q <= 0;",
            "    end else begin",
            "      q <= next;",
            "    end",
            "  end",
            "",
            "  always @(*) begin",
            "    case (q)",
            "      2'b00: y = 1'b1;",
            "      default: y = 1'b0;",
            "    endcase",
            "  end",
            "endmodule");

    private final SyntaxRepairPipeline pipeline = new SyntaxRepairPipeline();

    @Test
    void runsPassesInFixedOrder() {
        assertThat(pipeline.passNames()).containsExactly("assign", "case", "if-else", "always", "generate", "cleanup");
    }

    @Test
    void mergesMultiLineAssign() {
        RepairResult result = pipeline.repair(List.of("assign a =\n", "  (sel) ?\n", "  1'b1 :\n", "  1'b0\n"));

        assertThat(result.lines()).containsExactly("assign a = (sel) ? 1'b1 : 1'b0;");
        assertThat(result.report().forPass("assign")).map(PassStatistics::merged).contains(1);
        assertThat(result.report().finalLineCount()).isEqualTo(1);
    }

    @Test
    void promotesOrphanElseIf() {
        RepairResult result = pipeline.repair(List.of("else if (x)\n", "  y <= 1;\n"));

        assertThat(result.lines()).containsExactly("if (x)", "  y <= 1;");
        assertThat(result.report().forPass("if-else")).map(PassStatistics::fixed).contains(1);
    }

    @Test
    void insertsMissingEndcase() {
        RepairResult result = pipeline.repair(List.of(
                "always @(*) begin",
                "  case (sel)",
                "    default: y = 0;",
                "  case (other)",
                "    2'b00: z = 1;",
                "  endcase",
                "end"));

        assertThat(result.lines()).containsExactly(
                "always @(*) begin",
                "  case (sel)",
                "    default: y = 0;",
                "  endcase",
                "  case (other)",
                "    2'b00: z = 1;",
                "  endcase",
                "end");
    }

    @Test
    void completesAlwaysHeaderWithDeclaredClock() {
        RepairResult result = pipeline.repair(List.of("input clk;\n", "always\n", "  if (rst) y <= 0; else y <= x;\n"));

        assertThat(result.lines()).containsExactly(
                "input clk;",
                "always @(posedge clk) begin",
                "  if (rst) y <= 0; else y <= x;",
                "end");
        assertThat(result.report().totalFixes()).isEqualTo(2);
    }

    @Test
    void wrapsOrphanBlocksInGenerateLoop() {
        List<String> source = List.of(
                "module top;",
                "  parameter WIDTH = 4;",
                "  begin: blk0",
                "    assign y[i] = x[i];",
                "  end",
                "  begin: blk1",
                "    assign z[i] = x[i];",
                "  end",
                "endmodule");

        RepairResult result = pipeline.repair(source);

        assertThat(result.lines()).containsSubsequence(
                "  genvar i;",
                "  generate",
                "    for (i = 0; i < WIDTH; i = i + 1) begin",
                "      begin: blk0",
                "      begin: blk1",
                "    end",
                "  endgenerate");
        assertThat(result.lines().stream().filter(line -> line.contains("genvar"))).hasSize(1);

        RepairResult again = pipeline.repair(result.lines());
        assertThat(again.report().totalFixes()).isZero();
        assertThat(again.lines()).isEqualTo(result.lines());
    }

    @Test
    void reportsNoFixesForWellFormedModule() {
        RepairResult result = pipeline.repair(WELL_FORMED);

        assertThat(result.lines()).isEqualTo(WELL_FORMED);
        assertThat(result.report().totalFixes()).isZero();
        assertThat(result.report().summaries()).allMatch(summary -> summary.endsWith("no changes needed"));
    }

    @Test
    void keepsElseOfIfInsideCaseItem() {
        List<String> source = List.of(
                "always @(posedge clk) begin",
                "  case (sel)",
                "    2'b00: if (a) y <= 1'b1;",
                "           else y <= 1'b0;",
                "    default: y <= 1'b0;",
                "  endcase",
                "end");

        RepairResult result = pipeline.repair(source);

        assertThat(result.lines()).isEqualTo(source);
        assertThat(result.report().totalFixes()).isZero();
    }

    @Test
    void leavesFunctionWithLabeledBodyAndIndexedSelectsAlone() {
        List<String> source = List.of(
                "module pick (input [3:0] v, input s, output y);",
                "  assign y = v[s ? 1 : 0];",
                "  function [7:0] invert;",
                "    input [7:0] value;",
                "    begin : body",
                "      invert = ~value;",
                "    end",
                "  endfunction",
                "endmodule");

        RepairResult result = pipeline.repair(source);

        assertThat(result.lines()).isEqualTo(source);
        assertThat(result.report().totalFixes()).isZero();
    }

    @Test
    void feedsEachPassThePreviousOutputAndClearsPassContext() {
        List<String> seen = new ArrayList<>();
        RepairPass first = recordingPass("first", seen, "x");
        RepairPass second = recordingPass("second", seen, "y");
        SyntaxRepairPipeline custom = new SyntaxRepairPipeline(List.of(first, second));

        RepairResult result = custom.repair(List.of("start"));

        assertThat(seen).containsExactly("first:start", "second:x");
        assertThat(result.lines()).containsExactly("y");
        assertThat(result.report().passes()).extracting(PassStatistics::pass).containsExactly("first", "second");
        assertThat(MDC.get("pass")).isNull();
    }

    private static RepairPass recordingPass(String name, List<String> seen, String replacement) {
        return new RepairPass() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public PassResult repair(List<SourceLine> lines) {
                seen.add(MDC.get("pass") + ":" + lines.get(0).raw());
                return new PassResult(List.of(SourceLine.of(replacement)), new PassStatistics(name, 1, 0, 0, 0));
            }
        };
    }
}
