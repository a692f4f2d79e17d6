package ai.rtl.patcher.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Repaired lines, without line terminators, together with the run's report.
 */
public record RepairResult(List<String> lines, RepairReport report) {

    public RepairResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(report, "report");
    }
}
