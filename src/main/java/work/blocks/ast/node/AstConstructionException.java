package work.blocks.ast.node;

import java.util.Objects;

/**
 * Raised when a node cannot be constructed; the node never exists.
 */
public final class AstConstructionException extends RuntimeException {
    private final Violation violation;
    private final String subject;

    public AstConstructionException(Violation violation, String subject, String message) {
        super(message);
        this.violation = Objects.requireNonNull(violation, "violation");
        this.subject = subject;
    }

    public AstConstructionException(Violation violation, String subject, String message, Throwable cause) {
        super(message, cause);
        this.violation = Objects.requireNonNull(violation, "violation");
        this.subject = subject;
    }

    public Violation violation() {
        return violation;
    }

    public String code() {
        return violation.code();
    }

    /** Name of the argument or instruction being built, when known. */
    public String subject() {
        return subject;
    }
}
