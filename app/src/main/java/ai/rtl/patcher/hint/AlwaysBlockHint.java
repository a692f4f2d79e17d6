package ai.rtl.patcher.hint;

import java.util.Objects;

/**
 * An always block seen in a reference source: its header, a normalized signature of its first body lines and
 * the 1-based line it was declared on.
 */
public record AlwaysBlockHint(String declaration, String signature, int lineNumber) {

    public AlwaysBlockHint {
        Objects.requireNonNull(declaration, "declaration");
        Objects.requireNonNull(signature, "signature");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive");
        }
    }
}
