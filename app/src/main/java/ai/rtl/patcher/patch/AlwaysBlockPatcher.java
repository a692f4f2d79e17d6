package ai.rtl.patcher.patch;

import ai.rtl.patcher.config.RepairSettings;
import ai.rtl.patcher.hint.SourceHints;
import ai.rtl.patcher.line.BlockScanner;
import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes {@code always} headers that lost their event control.
 * <p>
 * {@code always()} and {@code always @()} become combinational. A bare {@code always} or {@code always @} takes
 * the event control of a matching reference block when one is known, a clock edge when non-blocking
 * assignments are nearby, and {@code @(*)} otherwise; its body is wrapped in {@code begin ... end}.
 */
public class AlwaysBlockPatcher implements RepairPass {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlwaysBlockPatcher.class);

    private static final Pattern EMPTY_EVENT_CONTROL = Pattern.compile("^always\\s*@?\\s*\\(\\s*\\)");
    private static final Pattern MISSING_EVENT_CONTROL = Pattern.compile("^always\\s*@?\\s*$");
    private static final String COMBINATIONAL = "@(*)";
    private static final int SIGNATURE_LINES = 3;
    private static final Set<LineKind> STRUCTURAL = EnumSet.of(LineKind.ALWAYS, LineKind.ASSIGN, LineKind.MODULE,
            LineKind.ENDMODULE, LineKind.DECLARATION, LineKind.PARAMETER, LineKind.END_KEYWORD,
            LineKind.ENDGENERATE, LineKind.GENERATE);

    private final RepairSettings settings;
    private final SourceHints hints;

    public AlwaysBlockPatcher() {
        this(RepairSettings.defaults(), SourceHints.empty());
    }

    public AlwaysBlockPatcher(RepairSettings settings, SourceHints hints) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hints = Objects.requireNonNull(hints, "hints");
    }

    @Override
    public String name() {
        return "always";
    }

    @Override
    public PassResult repair(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");
        RepairCounter counter = new RepairCounter(name());
        ClockInference clockInference = new ClockInference(settings, hints);
        Map<Integer, List<SourceLine>> pendingEnds = new TreeMap<>();
        List<SourceLine> output = new ArrayList<>(lines.size() + 4);

        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            SourceLine emitted = line;
            if (line.kind() == LineKind.ALWAYS) {
                String code = line.code();
                Matcher empty = EMPTY_EVENT_CONTROL.matcher(code);
                if (empty.find()) {
                    String rest = line.content().substring(empty.end());
                    emitted = line.withContent("always " + COMBINATIONAL + rest);
                    counter.fixed();
                    LOGGER.debug("Completed empty event control at line {}", i + 1);
                } else if (MISSING_EVENT_CONTROL.matcher(code).matches()) {
                    String eventControl = eventControl(lines, i, clockInference);
                    boolean bodyHasBegin = bodyStartsWithBegin(lines, i);
                    String header = "always " + eventControl + (bodyHasBegin ? "" : " begin");
                    emitted = line.withContent(line.hasComment() ? header + " " + line.comment() : header);
                    counter.fixed();
                    LOGGER.debug("Completed always header at line {} as '{}'", i + 1, header);
                    if (!bodyHasBegin) {
                        int endAfter = closingEndPosition(lines, i);
                        if (endAfter >= 0) {
                            pendingEnds.computeIfAbsent(endAfter, key -> new ArrayList<>())
                                    .add(SourceLine.of(line.indent(), "end"));
                            counter.inserted();
                            LOGGER.debug("Inserted end for always block at line {} after line {}", i + 1, endAfter + 1);
                        }
                    }
                }
            }
            output.add(emitted);
            List<SourceLine> ends = pendingEnds.remove(i);
            if (ends != null) {
                for (int k = ends.size() - 1; k >= 0; k--) {
                    output.add(ends.get(k));
                }
            }
        }
        return new PassResult(output, counter.toStatistics());
    }

    private String eventControl(List<SourceLine> lines, int header, ClockInference clockInference) {
        Optional<String> hinted = hints.eventControlFor(SourceHints.signatureOf(bodySignature(lines, header)));
        if (hinted.isPresent()) {
            return hinted.get();
        }
        if (hasNonBlockingAssignmentNearby(lines, header)) {
            return "@(posedge " + clockInference.infer(lines) + ")";
        }
        return COMBINATIONAL;
    }

    private boolean hasNonBlockingAssignmentNearby(List<SourceLine> lines, int header) {
        int from = Math.max(0, header - settings.sequentialProbeRadius());
        int to = Math.min(lines.size() - 1, header + settings.sequentialProbeRadius());
        for (int j = from; j <= to; j++) {
            SourceLine candidate = lines.get(j);
            if (j != header && candidate.isSignificant() && candidate.code().contains("<=")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the line after which the synthesized {@code end} goes, or -1 when the body is already closed.
     */
    private static int closingEndPosition(List<SourceLine> lines, int header) {
        int first = BlockScanner.nextSignificant(lines, header + 1);
        if (first < 0 || STRUCTURAL.contains(lines.get(first).kind())) {
            return header;
        }
        if (lines.get(first).kind() == LineKind.END) {
            return -1;
        }
        int bodyEnd = BlockScanner.statementEnd(lines, first);
        if (bodyEnd < 0) {
            return header;
        }
        int after = BlockScanner.nextSignificant(lines, bodyEnd + 1);
        if (after >= 0 && lines.get(after).kind() == LineKind.END
                && lines.get(after).indentWidth() == lines.get(header).indentWidth()) {
            return -1;
        }
        return bodyEnd;
    }

    private static boolean bodyStartsWithBegin(List<SourceLine> lines, int header) {
        int first = BlockScanner.nextSignificant(lines, header + 1);
        if (first < 0) {
            return false;
        }
        LineKind kind = lines.get(first).kind();
        return kind == LineKind.BEGIN || kind == LineKind.LABELED_BEGIN;
    }

    private static List<String> bodySignature(List<SourceLine> lines, int header) {
        List<String> signature = new ArrayList<>(SIGNATURE_LINES);
        int start = header + 1;
        int first = BlockScanner.nextSignificant(lines, start);
        if (first >= 0 && (lines.get(first).kind() == LineKind.BEGIN || lines.get(first).kind() == LineKind.LABELED_BEGIN)) {
            start = first + 1;
        }
        for (int j = start; j < lines.size() && signature.size() < SIGNATURE_LINES; j++) {
            SourceLine candidate = lines.get(j);
            if (candidate.isSignificant()) {
                signature.add(candidate.code());
            }
        }
        return signature;
    }
}
