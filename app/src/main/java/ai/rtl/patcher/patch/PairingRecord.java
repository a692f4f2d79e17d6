package ai.rtl.patcher.patch;

import java.util.OptionalInt;

/**
 * Outcome of pairing one {@code else} or {@code else if} line with a preceding {@code if}.
 */
public record PairingRecord(int elseLine, boolean matched, OptionalInt ifLine) {

    public PairingRecord {
        if (elseLine < 0) {
            throw new IllegalArgumentException("elseLine must not be negative");
        }
        ifLine = ifLine == null ? OptionalInt.empty() : ifLine;
        if (matched != ifLine.isPresent()) {
            throw new IllegalArgumentException("a matched else must name its if line and only then");
        }
    }

    public static PairingRecord matched(int elseLine, int ifLine) {
        return new PairingRecord(elseLine, true, OptionalInt.of(ifLine));
    }

    public static PairingRecord unmatched(int elseLine) {
        return new PairingRecord(elseLine, false, OptionalInt.empty());
    }
}
