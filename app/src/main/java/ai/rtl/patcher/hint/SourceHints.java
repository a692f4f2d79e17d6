package ai.rtl.patcher.hint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structural facts harvested from a reference source that help complete broken always headers.
 */
public record SourceHints(Map<String, List<AlwaysBlockHint>> alwaysBlocksByModule, List<String> clockNames) {

    private static final Pattern EVENT_CONTROL = Pattern.compile("always\\w*\\s*(@\\s*(?:\\([^)]*\\)|\\*))");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public SourceHints {
        Objects.requireNonNull(alwaysBlocksByModule, "alwaysBlocksByModule");
        Objects.requireNonNull(clockNames, "clockNames");
        Map<String, List<AlwaysBlockHint>> copy = new LinkedHashMap<>();
        alwaysBlocksByModule.forEach((module, hints) -> copy.put(module, List.copyOf(hints)));
        alwaysBlocksByModule = Collections.unmodifiableMap(copy);
        clockNames = List.copyOf(clockNames);
    }

    public static SourceHints empty() {
        return new SourceHints(Map.of(), List.of());
    }

    public boolean isEmpty() {
        return alwaysBlocksByModule.isEmpty() && clockNames.isEmpty();
    }

    /**
     * First clock name seen in the reference, if any.
     */
    public Optional<String> clockHint() {
        return clockNames.stream().findFirst();
    }

    /**
     * Event control of the first reference always block whose body signature equals {@code signature}.
     */
    public Optional<String> eventControlFor(String signature) {
        String normalized = normalizeSignature(signature);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return alwaysBlocksByModule.values().stream()
                .flatMap(List::stream)
                .filter(hint -> hint.signature().equals(normalized))
                .map(hint -> EVENT_CONTROL.matcher(hint.declaration()))
                .filter(Matcher::find)
                .map(matcher -> normalizeSignature(matcher.group(1)).replaceFirst("^@\\s*", "@"))
                .findFirst();
    }

    public static String normalizeSignature(String signature) {
        return WHITESPACE.matcher(signature.strip()).replaceAll(" ");
    }

    public static String signatureOf(List<String> bodyLines) {
        return normalizeSignature(bodyLines.stream().map(String::strip).collect(Collectors.joining(" ")));
    }
}
