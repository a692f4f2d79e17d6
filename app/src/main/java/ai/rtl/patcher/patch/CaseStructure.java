package ai.rtl.patcher.patch;

/**
 * A {@code case ... endcase} region, both bounds inclusive.
 */
public record CaseStructure(int start, int end) {

    public CaseStructure {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid case region: " + start + "-" + end);
        }
    }

    public boolean hasInterior() {
        return end - start > 1;
    }
}
