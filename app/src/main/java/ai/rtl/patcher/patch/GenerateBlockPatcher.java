package ai.rtl.patcher.patch;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.line.BlockRegion;
import ai.rtl.patcher.line.BlockScanner;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps labeled blocks that sit outside any generate construct into {@code generate ... endgenerate}, adding a
 * {@code for} loop and its {@code genvar} when the blocks index with a loop variable.
 */
public class GenerateBlockPatcher implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerateBlockPatcher.class);

    private static final Pattern LABEL = Pattern.compile("^begin\\s*:\\s*(\\w+)");
    private static final Pattern LOOP_INDEX = Pattern.compile("\\[\\s*(idx|index|[ijkIJK])\\b");
    private static final Pattern PARAMETER_KEYWORD = Pattern.compile("\\b(?:parameter|localparam)\\b");
    private static final Pattern PARAMETER_NAME = Pattern.compile("(\\w+)\\s*=(?!=)");
    private static final Pattern SUBROUTINE_START =
            Pattern.compile("^(?:(?:virtual|static|automatic|protected|local)\\s+)*(?:function|task)\\b");
    private static final Pattern SUBROUTINE_END = Pattern.compile("^end(?:function|task)\\b");
    private static final Pattern PROCEDURAL_HEADER = Pattern.compile("^(?:initial|final)\\b|\\belse$");
    private static final Set<LineKind> CONTROL_KINDS =
            EnumSet.of(LineKind.ALWAYS, LineKind.IF, LineKind.ELSE, LineKind.ELSE_IF, LineKind.FOR);
    private static final Set<LineKind> SIBLING_STARTS =
            EnumSet.of(LineKind.LABELED_BEGIN, LineKind.ALWAYS, LineKind.ASSIGN);
    private static final List<String> BOUND_NAME_HINTS = List.of("width", "size", "num", "count");
    private static final String LEVEL = "  ";

    private final RepairSettings settings;

    public GenerateBlockPatcher() {
        this(RepairSettings.defaults());
    }

    public GenerateBlockPatcher(RepairSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String name() {
        return "generate";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        List<OrphanBlockGroup> groups = findOrphanGroups(lines);
        if (groups.isEmpty()) {
            return new PassResult(lines, counter.toStatistics());
        }

        List<SourceLine> output = new ArrayList<>(lines.size() + groups.size() * 6);
        int index = 0;
        for (OrphanBlockGroup group : groups) {
            output.addAll(lines.subList(index, group.start()));
            emitWrapped(lines, group, output, counter);
            index = group.end() + 1;
        }
        output.addAll(lines.subList(index, lines.size()));
        return new PassResult(output, counter.toStatistics());
    }

    /**
     * Groups of consecutive labeled blocks at module level that no generate construct, function, task or control
     * header owns.
     */
    public List<OrphanBlockGroup> findOrphanGroups(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        List<OrphanBlockGroup> groups = new ArrayList<>();
        String loopBound = null;
        int generateDepth = 0;
        int beginDepth = 0;
        int subroutineDepth = 0;
        int i = 0;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            if (line.kind() == LineKind.LABELED_BEGIN && generateDepth == 0 && beginDepth == 0
                    && subroutineDepth == 0 && !followsControlHeader(lines, i)) {
                List<LabeledBlock> blocks = collectBlocks(lines, i);
                Optional<String> loopVariable = loopVariable(lines, blocks);
                if (loopBound == null) {
                    loopBound = inferLoopBound(lines);
                }
                OrphanBlockGroup group = new OrphanBlockGroup(blocks, loopVariable, loopBound);
                groups.add(group);
                i = group.end() + 1;
                continue;
            }
            if (line.kind() == LineKind.GENERATE) {
                generateDepth++;
            } else if (line.kind() == LineKind.ENDGENERATE) {
                generateDepth = Math.max(0, generateDepth - 1);
            }
            if (SUBROUTINE_START.matcher(line.code()).find()) {
                subroutineDepth++;
            } else if (SUBROUTINE_END.matcher(line.code()).find()) {
                subroutineDepth = Math.max(0, subroutineDepth - 1);
            }
            beginDepth = Math.max(0, beginDepth + BlockScanner.depthDelta(line));
            i++;
        }
        return groups;
    }

    /**
     * First parameter within the scan window whose name suggests a width, size or count, else the default bound.
     */
    String inferLoopBound(List<SourceLine> lines) {
        int limit = Math.min(lines.size(), settings.parameterScanLines());
        for (int i = 0; i < limit; i++) {
            String code = lines.get(i).code();
            Matcher keyword = PARAMETER_KEYWORD.matcher(code);
            if (!keyword.find()) {
                continue;
            }
            Matcher name = PARAMETER_NAME.matcher(code.substring(keyword.end()));
            while (name.find()) {
                String candidate = name.group(1);
                String lower = candidate.toLowerCase(Locale.ROOT);
                if (BOUND_NAME_HINTS.stream().anyMatch(lower::contains)) {
                    return candidate;
                }
            }
        }
        return Integer.toString(settings.defaultLoopBound());
    }

    private void emitWrapped(List<SourceLine> lines, OrphanBlockGroup group, List<SourceLine> output,
                             RepairCounter counter) {
        String base = lines.get(group.start()).indent();
        String bodyShift = group.needsGenvar() ? LEVEL + LEVEL : LEVEL;
        if (group.needsGenvar()) {
            String variable = group.loopVariable().get();
            if (!declaresGenvar(output, variable)) {
                output.add(SourceLine.of(base, "genvar " + variable + ";"));
                counter.inserted();
            }
        }
        output.add(SourceLine.of(base, "generate"));
        if (group.needsGenvar()) {
            String variable = group.loopVariable().get();
            output.add(SourceLine.of(base + LEVEL, "for (" + variable + " = 0; " + variable + " < "
                    + group.loopBound() + "; " + variable + " = " + variable + " + 1) begin"));
        }

        int previousEnd = group.start() - 1;
        for (LabeledBlock block : group.blocks()) {
            BlockRegion region = block.region();
            for (int j = previousEnd + 1; j <= region.end(); j++) {
                output.add(lines.get(j).shiftedBy(bodyShift));
            }
            if (!block.terminated()) {
                output.add(SourceLine.of(bodyShift + lines.get(region.start()).indent(), "end"));
                counter.inserted();
                LOGGER.debug("Closed unterminated block '{}' at line {}", region.label().orElse(""),
                        region.start() + 1);
            }
            counter.fixed();
            previousEnd = region.end();
        }

        if (group.needsGenvar()) {
            output.add(SourceLine.of(base + LEVEL, "end"));
        }
        output.add(SourceLine.of(base, "endgenerate"));
        LOGGER.debug("Wrapped {} orphan labeled block(s) at lines {}-{} in a generate region{}",
                group.blocks().size(), group.start() + 1, group.end() + 1,
                group.loopVariable().map(variable -> " looping " + variable + " to " + group.loopBound()).orElse(""));
    }

    private static List<LabeledBlock> collectBlocks(List<SourceLine> lines, int start) {
        List<LabeledBlock> blocks = new ArrayList<>();
        int baseIndent = lines.get(start).indentWidth();
        int i = start;
        while (true) {
            LabeledBlock block = scanBlock(lines, i);
            blocks.add(block);
            int next = block.region().end() + 1;
            while (next < lines.size() && lines.get(next).isBlank()) {
                next++;
            }
            if (next >= lines.size() || lines.get(next).kind() != LineKind.LABELED_BEGIN
                    || lines.get(next).indentWidth() != baseIndent) {
                return blocks;
            }
            i = next;
        }
    }

    private static LabeledBlock scanBlock(List<SourceLine> lines, int start) {
        SourceLine header = lines.get(start);
        Matcher label = LABEL.matcher(header.code());
        Optional<String> name = label.find() ? Optional.of(label.group(1)) : Optional.empty();
        int depth = 0;
        int j = start;
        for (; j < lines.size(); j++) {
            SourceLine line = lines.get(j);
            if (j > start && line.isSignificant() && cutsBlock(line, header.indentWidth())) {
                break;
            }
            depth += BlockScanner.depthDelta(line);
            if (depth <= 0) {
                return new LabeledBlock(new BlockRegion(start, j, 0, name), true);
            }
        }
        int end = j - 1;
        while (end > start && lines.get(end).isBlank()) {
            end--;
        }
        return new LabeledBlock(new BlockRegion(start, end, 0, name), false);
    }

    private static boolean cutsBlock(SourceLine line, int startIndent) {
        if (line.kind() == LineKind.MODULE || line.kind() == LineKind.ENDMODULE) {
            return true;
        }
        return SIBLING_STARTS.contains(line.kind()) && line.indentWidth() <= startIndent;
    }

    private static boolean followsControlHeader(List<SourceLine> lines, int index) {
        int previous = BlockScanner.previousSignificant(lines, index);
        if (previous < 0) {
            return false;
        }
        SourceLine line = lines.get(previous);
        return line.code().endsWith(")") || CONTROL_KINDS.contains(line.kind())
                || PROCEDURAL_HEADER.matcher(line.code()).find();
    }

    private static Optional<String> loopVariable(List<SourceLine> lines, List<LabeledBlock> blocks) {
        for (LabeledBlock block : blocks) {
            for (int j = block.region().start(); j <= block.region().end(); j++) {
                Matcher matcher = LOOP_INDEX.matcher(lines.get(j).code());
                if (matcher.find()) {
                    return Optional.of(matcher.group(1));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean declaresGenvar(List<SourceLine> preceding, String variable) {
        Pattern declaration = Pattern.compile("\\bgenvar\\b[^;]*\\b" + Pattern.quote(variable) + "\\b");
        return preceding.stream().anyMatch(line -> declaration.matcher(line.code()).find());
    }
}
