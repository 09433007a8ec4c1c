package work.blocks.ast.node;

import java.util.List;

/**
 * Semantic checks consulted while nodes are constructed. Implementations either answer
 * {@code false} for unknown names or throw {@link AstConstructionException} with
 * {@link Violation#INVALID_ARGS} for unacceptable argument lists.
 */
public interface AstValidator {
    boolean isValidArgName(ArgKind kind, String argName);

    /**
     * @param category the {@link InstructionCategory#base() base} category of the instruction
     */
    boolean isValidInstructionName(InstructionCategory category, String instruction);

    /**
     * Returns the argument list to store for {@code owner}.
     */
    List<ArgElement> validateArgs(String owner, List<ArgElement> args);

    static AstValidator permissive() {
        return Permissive.INSTANCE;
    }

    enum Permissive implements AstValidator {
        INSTANCE;

        @Override
        public boolean isValidArgName(ArgKind kind, String argName) {
            return true;
        }

        @Override
        public boolean isValidInstructionName(InstructionCategory category, String instruction) {
            return true;
        }

        @Override
        public List<ArgElement> validateArgs(String owner, List<ArgElement> args) {
            return args;
        }
    }
}
