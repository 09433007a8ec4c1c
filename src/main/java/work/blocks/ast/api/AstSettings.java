package work.blocks.ast.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for a tree-building pass.
 */
public record AstSettings(
    DiagnosticLevel diagnosticLevel,
    Optional<Path> catalogue,
    boolean useSharedRegistry
) {
    public AstSettings {
        Objects.requireNonNull(diagnosticLevel, "diagnosticLevel");
        Objects.requireNonNull(catalogue, "catalogue");
    }

    public static AstSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DiagnosticLevel diagnosticLevel = DiagnosticLevel.DEFAULT;
        private Optional<Path> catalogue = Optional.empty();
        private boolean useSharedRegistry;

        public Builder diagnosticLevel(DiagnosticLevel diagnosticLevel) {
            this.diagnosticLevel = diagnosticLevel;
            return this;
        }

        public Builder catalogue(Path catalogue) {
            this.catalogue = Optional.ofNullable(catalogue);
            return this;
        }

        public Builder useSharedRegistry(boolean useSharedRegistry) {
            this.useSharedRegistry = useSharedRegistry;
            return this;
        }

        public AstSettings build() {
            return new AstSettings(diagnosticLevel, catalogue, useSharedRegistry);
        }
    }
}
