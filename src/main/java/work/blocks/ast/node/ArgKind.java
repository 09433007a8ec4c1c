package work.blocks.ast.node;

/**
 * Variant tag of an {@link ArgElement}: a function with sub-arguments or a literal value.
 */
public enum ArgKind {
    FUNCTION("function"),
    VALUE("value");

    private final String tag;

    ArgKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ArgKind from(String value) {
        if (value != null) {
            for (ArgKind kind : values()) {
                if (kind.tag.equals(value.trim())) {
                    return kind;
                }
            }
        }
        throw new AstConstructionException(
            Violation.UNKNOWN_ARG_KIND,
            value,
            "Invalid argument type: \"" + value + "\" type doesn't exist"
        );
    }
}
