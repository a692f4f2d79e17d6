package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.BlockScanner;
import ai.rtl.patcher.line.LineClassifier;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes {@code case} regions that contain nothing but labels and closes cases left without {@code endcase}.
 */
public class CaseStatementPatcher implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(CaseStatementPatcher.class);

    private static final Set<LineKind> CLOSING_TRIGGERS = EnumSet.of(
            LineKind.ALWAYS, LineKind.ASSIGN, LineKind.DECLARATION, LineKind.MODULE, LineKind.ENDMODULE,
            LineKind.BEGIN, LineKind.LABELED_BEGIN, LineKind.END, LineKind.END_KEYWORD, LineKind.ENDGENERATE,
            LineKind.IF, LineKind.ELSE, LineKind.ELSE_IF, LineKind.CASE);

    @Override
    public String name() {
        return "case";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        List<SourceLine> pruned = removeEmptyCases(lines, counter);
        List<SourceLine> closed = closeOpenCases(pruned, counter);
        return new PassResult(closed, counter.toStatistics());
    }

    /**
     * Finds every {@code case} region, pairing each opener with the first {@code endcase} that follows it.
     */
    public List<CaseStructure> findCaseStructures(List<SourceLine> lines) {
        List<CaseStructure> structures = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (!opensCase(lines.get(index))) {
                index++;
                continue;
            }
            int end = -1;
            for (int j = index + 1; j < lines.size(); j++) {
                if (lines.get(j).kind() == LineKind.ENDCASE) {
                    end = j;
                    break;
                }
            }
            if (end < 0) {
                break;
            }
            structures.add(new CaseStructure(index, end));
            index = end + 1;
        }
        return structures;
    }

    /**
     * A region is empty when no interior line does anything beyond naming a label.
     */
    public boolean isEmpty(List<SourceLine> lines, CaseStructure structure) {
        for (int i = structure.start() + 1; i < structure.end(); i++) {
            SourceLine line = lines.get(i);
            if (line.isSignificant() && !LineClassifier.isBareLabel(line.code())) {
                return false;
            }
        }
        return true;
    }

    private List<SourceLine> removeEmptyCases(List<SourceLine> lines, RepairCounter counter) {
        List<CaseStructure> empty = new ArrayList<>();
        for (CaseStructure structure : findCaseStructures(lines)) {
            if (isEmpty(lines, structure)) {
                empty.add(structure);
            }
        }
        if (empty.isEmpty()) {
            return lines;
        }
        List<SourceLine> result = new ArrayList<>(lines);
        empty.sort(Comparator.comparingInt(CaseStructure::start).reversed());
        for (CaseStructure structure : empty) {
            result.subList(structure.start(), structure.end() + 1).clear();
            counter.removed();
            LOGGER.debug("Removed empty case block at lines {}-{}", structure.start() + 1, structure.end() + 1);
        }
        return result;
    }

    private List<SourceLine> closeOpenCases(List<SourceLine> lines, RepairCounter counter) {
        List<SourceLine> output = new ArrayList<>(lines.size());
        Deque<OpenCase> open = new ArrayDeque<>();
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (line.kind() == LineKind.ENDCASE) {
                if (!open.isEmpty()) {
                    open.pop();
                }
            } else if (line.isSignificant() && CLOSING_TRIGGERS.contains(line.kind())) {
                while (!open.isEmpty() && open.peek().closedBy(line, depth)) {
                    OpenCase closed = open.pop();
                    output.add(SourceLine.of(closed.indent(), "endcase"));
                    counter.inserted();
                    LOGGER.debug("Inserted missing endcase for case at line {} before line {}",
                            closed.line() + 1, i + 1);
                }
            }
            if (opensCase(line)) {
                open.push(new OpenCase(i, line.indent(), depth));
            }
            output.add(line);
            depth = Math.max(0, depth + BlockScanner.depthDelta(line));
        }
        while (!open.isEmpty()) {
            OpenCase closed = open.pop();
            output.add(SourceLine.of(closed.indent(), "endcase"));
            counter.inserted();
            LOGGER.debug("Appended missing endcase for case at line {}", closed.line() + 1);
        }
        return output;
    }

    private static boolean opensCase(SourceLine line) {
        return line.isSignificant() && LineClassifier.opensCase(line.code());
    }

    private record OpenCase(int line, String indent, int depth) {

        boolean closedBy(SourceLine candidate, int currentDepth) {
            return candidate.indentWidth() <= indent.length() && currentDepth <= depth;
        }
    }
}
