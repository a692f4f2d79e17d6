package ai.rtl.patcher.hint;

import ai.rtl.patcher.line.LineKind;
import ai.rtl.patcher.line.SourceLine;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a reference HDL source and extracts {@link SourceHints}. Unreadable input yields empty hints.
 */
public class SourceHintLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceHintLoader.class);

    private static final Pattern MODULE_NAME = Pattern.compile("^(?:macro)?module\\s+(\\w+)");
    private static final Pattern CLOCK_EDGE = Pattern.compile("\\b(?:posedge|negedge)\\s+(\\w+)");
    private static final Pattern CLOCK_INPUT = Pattern.compile("^input\\b.*?\\b(\\w*(?:clk|clock)\\w*)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_OPENS_BODY = Pattern.compile("\\bbegin(?:\\s*:\\s*\\w+)?$");
    private static final String UNNAMED_MODULE = "";
    private static final int BEGIN_LOOKAHEAD = 4;
    private static final int SIGNATURE_LINES = 3;

    public SourceHints load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            LOGGER.warn("Reference source {} not found; using default always-block heuristics", path);
            return SourceHints.empty();
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<String> lines = reader.lines().collect(Collectors.toList());
            SourceHints hints = extract(lines);
            LOGGER.info("Loaded reference hints from {}: {} module(s), clocks {}",
                    path, hints.alwaysBlocksByModule().size(), hints.clockNames());
            return hints;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.warn("Failed to read reference source {}; using default always-block heuristics", path, ex);
            return SourceHints.empty();
        }
    }

    public SourceHints extract(List<String> rawLines) {
        Objects.requireNonNull(rawLines, "rawLines");
        List<SourceLine> lines = SourceLine.ofAll(rawLines);
        Map<String, List<AlwaysBlockHint>> byModule = new LinkedHashMap<>();
        Set<String> clocks = new LinkedHashSet<>();
        String module = UNNAMED_MODULE;

        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (!line.isSignificant()) {
                continue;
            }
            Matcher moduleMatcher = MODULE_NAME.matcher(line.code());
            if (moduleMatcher.find()) {
                module = moduleMatcher.group(1);
            }
            Matcher edge = CLOCK_EDGE.matcher(line.code());
            while (edge.find()) {
                clocks.add(edge.group(1));
            }
            Matcher input = CLOCK_INPUT.matcher(line.code());
            if (input.find()) {
                clocks.add(input.group(1));
            }
            if (line.kind() == LineKind.ALWAYS) {
                String signature = SourceHints.signatureOf(bodySignatureLines(lines, i));
                byModule.computeIfAbsent(module, key -> new ArrayList<>())
                        .add(new AlwaysBlockHint(line.code(), signature, i + 1));
            }
        }
        return new SourceHints(byModule, new ArrayList<>(clocks));
    }

    private static List<String> bodySignatureLines(List<SourceLine> lines, int header) {
        int start = -1;
        if (HEADER_OPENS_BODY.matcher(lines.get(header).code()).find()) {
            start = header + 1;
        } else {
            for (int j = header + 1; j < Math.min(lines.size(), header + 1 + BEGIN_LOOKAHEAD); j++) {
                SourceLine candidate = lines.get(j);
                if (candidate.kind() == LineKind.BEGIN || candidate.kind() == LineKind.LABELED_BEGIN) {
                    start = j + 1;
                    break;
                }
            }
        }
        if (start < 0) {
            start = header + 1;
        }
        List<String> signature = new ArrayList<>(SIGNATURE_LINES);
        for (int j = start; j < lines.size() && signature.size() < SIGNATURE_LINES; j++) {
            SourceLine candidate = lines.get(j);
            if (candidate.isSignificant()) {
                signature.add(candidate.code());
            }
        }
        return signature;
    }
}
