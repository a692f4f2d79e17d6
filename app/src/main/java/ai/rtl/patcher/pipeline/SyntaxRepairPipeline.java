package ai.rtl.patcher.pipeline;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.hint.SourceHints;
import ai.rtl.patcher.line.SourceLine;
import ai.rtl.patcher.patch.AlwaysBlockPatcher;
import ai.rtl.patcher.patch.AssignStatementPatcher;
import ai.rtl.patcher.patch.CaseStatementPatcher;
import ai.rtl.patcher.patch.CleanupPass;
import ai.rtl.patcher.patch.GenerateBlockPatcher;
import ai.rtl.patcher.patch.IfElsePatcher;
import ai.rtl.patcher.patch.PassResult;
import ai.rtl.patcher.patch.PassStatistics;
import ai.rtl.patcher.patch.RepairPass;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the repair passes in their fixed order: assign, case, if-else, always, generate, then cleanup.
 * <p>
 * Passes hold no per-run state, so one pipeline instance may repair any number of inputs.
 */
public class SyntaxRepairPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxRepairPipeline.class);
    static final String MDC_PASS = "pass";

    private final List<RepairPass> passes;

    public SyntaxRepairPipeline() {
        this(RepairSettings.defaults(), SourceHints.empty());
    }

    public SyntaxRepairPipeline(RepairSettings settings, SourceHints hints) {
        this(List.of(
                new AssignStatementPatcher(),
                new CaseStatementPatcher(),
                new IfElsePatcher(settings),
                new AlwaysBlockPatcher(settings, hints),
                new GenerateBlockPatcher(settings),
                new CleanupPass()));
    }

    SyntaxRepairPipeline(List<RepairPass> passes) {
        this.passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
    }

    public List<String> passNames() {
        List<String> names = new ArrayList<>(passes.size());
        passes.forEach(pass -> names.add(pass.name()));
        return names;
    }

    public RepairResult repair(List<String> rawLines) {
        Objects.requireNonNull(rawLines, "rawLines");
        List<SourceLine> lines = SourceLine.ofAll(rawLines);
        List<PassStatistics> statistics = new ArrayList<>(passes.size());
        for (RepairPass pass : passes) {
            MDC.put(MDC_PASS, pass.name());
            try {
                PassResult result = pass.repair(lines);
                lines = result.lines();
                statistics.add(result.statistics());
                if (result.statistics().changed()) {
                    LOGGER.info(result.statistics().summary());
                } else {
                    LOGGER.debug(result.statistics().summary());
                }
            } finally {
                MDC.remove(MDC_PASS);
            }
        }
        RepairReport report = new RepairReport(statistics, lines.size());
        LOGGER.info("Repair finished: {} fix(es) across {} pass(es), {} line(s) out",
                report.totalFixes(), statistics.size(), report.finalLineCount());
        return new RepairResult(SourceLine.rawLines(lines), report);
    }
}
