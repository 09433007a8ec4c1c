package work.blocks.ast.node;

import java.util.Locale;
import java.util.Objects;

/**
 * Non-fatal note attached to a node describing how its input was corrected.
 */
public record Diagnostic(DiagnosticCode code, String subject, String message) {
    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return code.name().toLowerCase(Locale.ROOT) + ": " + message;
    }
}
