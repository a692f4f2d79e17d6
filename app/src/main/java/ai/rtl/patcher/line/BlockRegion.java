package ai.rtl.patcher.line;

import java.util.Objects;
import java.util.Optional;

/**
 * Contiguous span of lines bounded by a declared construct, with the nesting depth at its first line.
 */
public record BlockRegion(int start, int end, int depth, Optional<String> label) {

    public BlockRegion {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid block region boundaries: " + start + "-" + end);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
        label = Objects.requireNonNullElse(label, Optional.empty());
    }
}
