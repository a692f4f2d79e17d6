package ai.rtl.patcher.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Counters reported by one pass for one run.
 */
public record PassStatistics(String pass, int fixed, int merged, int removed, int inserted) {

    public PassStatistics {
        Objects.requireNonNull(pass, "pass");
        if (fixed < 0 || merged < 0 || removed < 0 || inserted < 0) {
            throw new IllegalArgumentException("Counters must not be negative");
        }
    }

    public static PassStatistics unchanged(String pass) {
        return new PassStatistics(pass, 0, 0, 0, 0);
    }

    public int total() {
        return fixed + merged + removed + inserted;
    }

    public boolean changed() {
        return total() > 0;
    }

    public String summary() {
        if (!changed()) {
            return pass + " patch: no changes needed";
        }
        List<String> parts = new ArrayList<>();
        if (fixed > 0) {
            parts.add("fixed " + fixed);
        }
        if (merged > 0) {
            parts.add("merged " + merged);
        }
        if (removed > 0) {
            parts.add("removed " + removed);
        }
        if (inserted > 0) {
            parts.add("inserted " + inserted);
        }
        return pass + " patch: " + String.join(", ", parts);
    }
}
