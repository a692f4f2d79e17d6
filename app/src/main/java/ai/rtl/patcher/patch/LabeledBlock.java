package ai.rtl.patcher.patch;

import ai.rtl.patcher.line.BlockRegion;
import java.util.Objects;

/**
 * A {@code begin : label ... end} block; {@code terminated} is false when the block was cut off before its
 * {@code end}.
 */
public record LabeledBlock(BlockRegion region, boolean terminated) {

    public LabeledBlock {
        Objects.requireNonNull(region, "region");
    }
}
