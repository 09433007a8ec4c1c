package work.blocks.ast.catalogue;

import java.util.Objects;

/**
 * One catalogue entry: a block name, its kind ({@code function}, {@code value}, {@code flow} or {@code clamp})
 * and, optionally, the exact number of arguments it takes.
 */
public record BlockDefinition(String name, String kind, Integer arity) {
    public BlockDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (arity != null && arity < 0) {
            throw new IllegalArgumentException("arity must not be negative: " + arity);
        }
    }

    public boolean hasArity() {
        return arity != null;
    }
}
