package ai.rtl.patcher.patch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Consecutive labeled blocks found outside any generate region, with the loop they should be wrapped in.
 */
public record OrphanBlockGroup(List<LabeledBlock> blocks, Optional<String> loopVariable, String loopBound) {

    public OrphanBlockGroup {
        Objects.requireNonNull(blocks, "blocks");
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("blocks must not be empty");
        }
        blocks = List.copyOf(blocks);
        loopVariable = loopVariable == null ? Optional.empty() : loopVariable;
        Objects.requireNonNull(loopBound, "loopBound");
    }

    public int start() {
        return blocks.get(0).region().start();
    }

    public int end() {
        return blocks.get(blocks.size() - 1).region().end();
    }

    public boolean needsGenvar() {
        return loopVariable.isPresent();
    }
}
