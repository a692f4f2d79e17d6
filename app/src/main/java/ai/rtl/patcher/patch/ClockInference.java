package ai.rtl.patcher.patch;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.hint.SourceHints;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses the clock signal of a source unit from its declarations, its existing clock edges and reference hints.
 */
final class ClockInference {

    static final String DEFAULT_CLOCK = "clk";

    private static final Pattern CLOCK_INPUT = Pattern.compile("^input\\b.*?\\b(\\w*(?:clk|clock)\\w*)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_EDGE = Pattern.compile("\\b(?:posedge|negedge)\\s+(clk|clock|aclk|pclk)\\b");

    private final RepairSettings settings;
    private final SourceHints hints;

    ClockInference(RepairSettings settings, SourceHints hints) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hints = Objects.requireNonNull(hints, "hints");
    }

    String infer(List<SourceLine> lines) {
        int declarationLimit = Math.min(lines.size(), settings.clockDeclarationScanLines());
        for (int i = 0; i < declarationLimit; i++) {
            SourceLine line = lines.get(i);
            if (line.kind() != LineKind.DECLARATION) {
                continue;
            }
            Matcher matcher = CLOCK_INPUT.matcher(line.code());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        int edgeLimit = Math.min(lines.size(), settings.clockEdgeScanLines());
        for (int i = 0; i < edgeLimit; i++) {
            Matcher matcher = CLOCK_EDGE.matcher(lines.get(i).code());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return hints.clockHint().orElse(DEFAULT_CLOCK);
    }
}
