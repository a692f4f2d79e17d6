package ai.rtl.patcher.pipeline;

import ai.rtl.patcher.patch.PassStatistics;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Aggregated statistics of one pipeline run, in pass order.
 */
public record RepairReport(List<PassStatistics> passes, int finalLineCount) {

    public RepairReport {
        Objects.requireNonNull(passes, "passes");
        passes = List.copyOf(passes);
        if (finalLineCount < 0) {
            throw new IllegalArgumentException("finalLineCount must not be negative");
        }
    }

    public int totalFixes() {
        return passes.stream().mapToInt(PassStatistics::total).sum();
    }

    public Optional<PassStatistics> forPass(String name) {
        return passes.stream().filter(statistics -> statistics.pass().equals(name)).findFirst();
    }

    public List<String> summaries() {
        return passes.stream().map(PassStatistics::summary).collect(Collectors.toList());
    }
}
