package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.SourceLine;
import java.util.List;
import java.util.Objects;

/**
 * Output of one pass: the repaired lines and what the pass changed to produce them.
 */
public record PassResult(List<SourceLine> lines, PassStatistics statistics) {

    public PassResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(statistics, "statistics");
    }
}
