package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.SourceLine;
import java.util.List;

/**
 * A single structural repair over a whole line sequence.
 * <p>
 * Implementations keep no state between invocations: every call builds its own scanning state and counters, so
 * one instance can repair independent inputs one after another or concurrently.
 */
public interface RepairPass {

    /**
     * Short identifier used in logs and reports.
     */
    String name();

    PassResult repair(List<SourceLine> lines);
}
