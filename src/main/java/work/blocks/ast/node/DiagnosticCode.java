package work.blocks.ast.node;

/**
 * Tolerated input problems. Construction proceeds with a corrected or defaulted value.
 */
public enum DiagnosticCode {
    NAME_COERCED,
    ARGS_IGNORED,
    VALUE_IGNORED,
    CHILD_STACK_IGNORED,
    CHILD_STACK_DEFAULTED
}
