package ai.rtl.patcher.patch;

/**
 * Mutable tally owned by a single pass invocation.
 */
final class RepairCounter {

    private final String pass;
    private int fixed;
    private int merged;
    private int removed;
    private int inserted;

    RepairCounter(String pass) {
        this.pass = pass;
    }

    void fixed() {
        fixed++;
    }

    void merged() {
        merged++;
    }

    void removed() {
        removed++;
    }

    void inserted() {
        inserted++;
    }

    PassStatistics toStatistics() {
        return new PassStatistics(pass, fixed, merged, removed, inserted);
    }
}
