package work.blocks.ast.node;

/**
 * Instruction categories, each fixing whether a {@link SyntaxElement} holds arguments and/or a child stack.
 */
public enum InstructionCategory {
    START("start"),
    ACTION("action"),
    FLOW("flow"),
    FLOW_NO_ARGS("flow-no-args"),
    CLAMP("clamp"),
    CLAMP_NO_ARGS("clamp-no-args");

    private final String tag;

    InstructionCategory(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Category used for instruction name checks; the no-args variants share their family's names.
     */
    public InstructionCategory base() {
        return switch (this) {
            case FLOW, FLOW_NO_ARGS -> FLOW;
            case CLAMP, CLAMP_NO_ARGS -> CLAMP;
            case START -> START;
            case ACTION -> ACTION;
        };
    }

    public boolean takesArgs() {
        return switch (this) {
            case ACTION, FLOW, CLAMP -> true;
            case START, FLOW_NO_ARGS, CLAMP_NO_ARGS -> false;
        };
    }

    public boolean takesChildStack() {
        return switch (this) {
            case START, ACTION, CLAMP, CLAMP_NO_ARGS -> true;
            case FLOW, FLOW_NO_ARGS -> false;
        };
    }

    public static InstructionCategory from(String value) {
        if (value != null) {
            for (InstructionCategory category : values()) {
                if (category.tag.equals(value.trim())) {
                    return category;
                }
            }
        }
        throw new AstConstructionException(
            Violation.UNKNOWN_CATEGORY,
            value,
            "Invalid instruction type: \"" + value + "\" instruction doesn't exist"
        );
    }
}
