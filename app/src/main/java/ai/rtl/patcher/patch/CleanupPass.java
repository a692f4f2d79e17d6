package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final conservative sweep: drops lines holding a single stray operator and declares loop variables of generate
 * loops that have no {@code genvar}.
 */
public class CleanupPass implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(CleanupPass.class);

    private static final Pattern GENERATE_LOOP = Pattern.compile("^for\\s*\\(\\s*(genvar\\s+)?(\\w+)\\s*=");

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        List<SourceLine> output = new ArrayList<>(lines.size());
        int generateDepth = 0;
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (line.kind() == LineKind.OPERATOR_ONLY) {
                counter.removed();
                LOGGER.debug("Dropped stray operator '{}' at line {}", line.code(), i + 1);
                continue;
            }
            if (line.kind() == LineKind.GENERATE) {
                generateDepth++;
            } else if (line.kind() == LineKind.ENDGENERATE) {
                generateDepth = Math.max(0, generateDepth - 1);
            } else if (line.kind() == LineKind.FOR && generateDepth > 0) {
                Matcher loop = GENERATE_LOOP.matcher(line.code());
                if (loop.find() && loop.group(1) == null && !isDeclared(output, loop.group(2))) {
                    output.add(SourceLine.of(line.indent(), "genvar " + loop.group(2) + ";"));
                    counter.inserted();
                    LOGGER.debug("Declared genvar {} before line {}", loop.group(2), i + 1);
                }
            }
            output.add(line);
        }
        return new PassResult(output, counter.toStatistics());
    }

    /**
     * True when an earlier line declares the variable as a genvar or as a procedural loop counter.
     */
    private static boolean isDeclared(List<SourceLine> preceding, String variable) {
        Pattern declaration = Pattern.compile("\\b(?:genvar|integer|int)\\b[^;]*\\b" + Pattern.quote(variable) + "\\b");
        return preceding.stream().anyMatch(line -> declaration.matcher(line.code()).find());
    }
}
