package work.blocks.ast.node;

/**
 * Structural invariants whose violation aborts node construction.
 */
public enum Violation {
    UNKNOWN_ARG_KIND("unknown_arg_kind"),
    UNKNOWN_CATEGORY("unknown_category"),
    ARGS_REQUIRED("args_required"),
    VALUE_REQUIRED("value_required"),
    INVALID_ARG_NAME("invalid_arg_name"),
    INVALID_INSTRUCTION_NAME("invalid_instruction_name"),
    INVALID_ARGS("invalid_args"),
    MALFORMED_PROPS("malformed_props");

    private final String code;

    Violation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
