package work.blocks.ast.catalogue;

import java.util.List;
import java.util.Objects;
import work.blocks.ast.node.ArgElement;
import work.blocks.ast.node.ArgKind;
import work.blocks.ast.node.AstConstructionException;
import work.blocks.ast.node.AstValidator;
import work.blocks.ast.node.InstructionCategory;
import work.blocks.ast.node.Violation;

/**
 * Accepts only names defined in a {@link BlockCatalogue} under the matching kind, and enforces declared arities.
 */
public final class CatalogueValidator implements AstValidator {
    private final BlockCatalogue catalogue;

    public CatalogueValidator(BlockCatalogue catalogue) {
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
    }

    @Override
    public boolean isValidArgName(ArgKind kind, String argName) {
        return catalogue.find(argName)
            .map(definition -> definition.kind().equals(kind.tag()))
            .orElse(false);
    }

    @Override
    public boolean isValidInstructionName(InstructionCategory category, String instruction) {
        return catalogue.find(instruction)
            .map(definition -> definition.kind().equals(category.base().tag()))
            .orElse(false);
    }

    @Override
    public List<ArgElement> validateArgs(String owner, List<ArgElement> args) {
        var definition = catalogue.find(owner).orElse(null);
        if (definition != null && definition.hasArity() && definition.arity() != args.size()) {
            throw new AstConstructionException(
                Violation.INVALID_ARGS,
                owner,
                "Invalid arguments: \"" + owner + "\" takes " + definition.arity() + " argument(s), got " + args.size()
            );
        }
        return args;
    }

    public BlockCatalogue catalogue() {
        return catalogue;
    }
}
