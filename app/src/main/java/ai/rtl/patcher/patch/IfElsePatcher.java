package ai.rtl.patcher.patch;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.line.BlockScanner;
import ai.rtl.patcher.line.LineClassifier;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-derives which {@code if} each {@code else} belongs to and repairs the ones that belong to none.
 * <p>
 * An unpaired {@code else if} becomes a standalone {@code if}; an unpaired bare {@code else} is removed together
 * with its branch body.
 */
public class IfElsePatcher implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(IfElsePatcher.class);

    private static final Pattern ELSE_IF = Pattern.compile("\\belse\\s+if\\s*\\(");
    private static final Pattern LEADING_END = Pattern.compile("^end\\s+");
    private static final int BEGIN_LOOKAHEAD = 4;
    private static final int TERMINATOR_LOOKAHEAD = 9;
    private static final int FALLBACK_BODY_LINES = 3;

    private final RepairSettings settings;

    public IfElsePatcher() {
        this(RepairSettings.defaults());
    }

    public IfElsePatcher(RepairSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String name() {
        return "if-else";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        Map<Integer, PairingRecord> pairings = new HashMap<>();
        for (PairingRecord record : analyze(lines)) {
            pairings.put(record.elseLine(), record);
        }

        List<SourceLine> output = new ArrayList<>(lines.size());
        int index = 0;
        while (index < lines.size()) {
            SourceLine line = lines.get(index);
            PairingRecord record = pairings.get(index);
            if (record == null || record.matched()) {
                output.add(line);
                index++;
            } else if (line.kind() == LineKind.ELSE_IF) {
                promoteToIf(line, output);
                counter.fixed();
                LOGGER.debug("Promoted unpaired else-if at line {} to a standalone if", index + 1);
                index++;
            } else {
                int end = Math.max(index, BlockScanner.branchEnd(lines, index));
                if (line.code().startsWith("end")) {
                    output.add(SourceLine.of(line.indent(), "end"));
                }
                counter.removed();
                LOGGER.debug("Removed unpaired else at line {} with its body through line {}", index + 1, end + 1);
                index = end + 1;
            }
        }
        return new PassResult(output, counter.toStatistics());
    }

    /**
     * Pairs every {@code else}/{@code else if} line with the closest eligible {@code if} at the same indentation.
     * An {@code if} that follows other code on its line, such as a case label, also pairs with an {@code else}
     * aligned under the {@code if} keyword.
     */
    public List<PairingRecord> analyze(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        List<PairingRecord> records = new ArrayList<>();
        List<IfContext> active = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (!line.isSignificant()) {
                continue;
            }
            if (line.kind().isElse()) {
                IfContext match = findMatch(active, line, i);
                if (match != null) {
                    match.claimed = true;
                    records.add(PairingRecord.matched(i, match.line));
                } else {
                    records.add(PairingRecord.unmatched(i));
                }
                if (line.kind() == LineKind.ELSE_IF) {
                    active.add(new IfContext(i, line.indentWidth(), line.indentWidth(), blockEnd(lines, i)));
                }
                continue;
            }
            int position = i;
            active.removeIf(context -> position > context.blockEnd && line.indentWidth() <= context.indent);
            int ifOffset = LineClassifier.ifConditionOffset(line.code());
            if (ifOffset >= 0) {
                int keywordColumn = line.indentWidth() + ifOffset;
                active.add(new IfContext(i, line.indentWidth(), keywordColumn, blockEnd(lines, i)));
            }
        }
        return records;
    }

    private IfContext findMatch(List<IfContext> active, SourceLine line, int index) {
        boolean closesBlock = line.code().startsWith("end");
        for (int k = active.size() - 1; k >= 0; k--) {
            IfContext context = active.get(k);
            if (context.claimed || !context.alignsWith(line.indentWidth())) {
                continue;
            }
            boolean afterBlock = context.blockEnd < index || (context.blockEnd == index && closesBlock);
            if (afterBlock && index <= context.blockEnd + settings.elseLookahead()) {
                return context;
            }
        }
        return null;
    }

    /**
     * Last line of the branch body opened by the header on {@code header}.
     */
    int blockEnd(List<SourceLine> lines, int header) {
        int last = lines.size() - 1;
        String rest = BlockScanner.branchRemainder(lines.get(header).code());
        if (BlockScanner.opensBlock(rest)) {
            return BlockScanner.matchingEnd(lines, header);
        }
        if (rest.contains(";")) {
            return header;
        }
        int next = BlockScanner.nextSignificant(lines, header + 1);
        if (next < 0) {
            return header;
        }
        SourceLine body = lines.get(next);
        if (next - header <= BEGIN_LOOKAHEAD) {
            if (body.kind() == LineKind.BEGIN || body.kind() == LineKind.LABELED_BEGIN) {
                return BlockScanner.matchingEnd(lines, next);
            }
            if (body.kind() == LineKind.CASE) {
                return BlockScanner.matchingEndcase(lines, next);
            }
        }
        int headerIndent = lines.get(header).indentWidth();
        if (body.indentWidth() > headerIndent) {
            int end = next;
            for (int j = next + 1; j < lines.size(); j++) {
                SourceLine candidate = lines.get(j);
                if (!candidate.isSignificant()) {
                    continue;
                }
                if (candidate.indentWidth() <= headerIndent) {
                    break;
                }
                end = j;
            }
            return end;
        }
        for (int j = header + 1; j <= Math.min(header + TERMINATOR_LOOKAHEAD, last); j++) {
            if (lines.get(j).code().contains(";")) {
                return j;
            }
        }
        return Math.min(header + FALLBACK_BODY_LINES, last);
    }

    private static void promoteToIf(SourceLine line, List<SourceLine> output) {
        String content = line.content();
        Matcher leadingEnd = LEADING_END.matcher(content);
        if (leadingEnd.find()) {
            output.add(SourceLine.of(line.indent(), "end"));
            content = content.substring(leadingEnd.end());
        }
        output.add(SourceLine.of(line.indent(), ELSE_IF.matcher(content).replaceFirst("if (")));
    }

    private static final class IfContext {

        private final int line;
        private final int indent;
        private final int keywordColumn;
        private final int blockEnd;
        private boolean claimed;

        private IfContext(int line, int indent, int keywordColumn, int blockEnd) {
            this.line = line;
            this.indent = indent;
            this.keywordColumn = keywordColumn;
            this.blockEnd = blockEnd;
        }

        private boolean alignsWith(int elseIndent) {
            return elseIndent == indent || elseIndent == keywordColumn;
        }
    }
}
