package work.blocks.ast.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.blocks.ast.api.AstSettings;
import work.blocks.ast.api.DiagnosticLevel;
import work.blocks.ast.catalogue.BlockCatalogue;
import work.blocks.ast.catalogue.CatalogueValidator;
import work.blocks.ast.node.ArgElement;
import work.blocks.ast.node.ArgKind;
import work.blocks.ast.node.AstValidator;
import work.blocks.ast.node.Diagnostic;
import work.blocks.ast.node.InstructionCategory;
import work.blocks.ast.node.SyntaxElement;

/**
 * Carries the validator, the target registry and the collected diagnostics through one tree-building pass.
 * Not thread-safe; use one context per pass.
 */
public final class BuildContext {
    private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

    private final AstValidator validator;
    private final ProgramRegistry registry;
    private final DiagnosticLevel diagnosticLevel;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public BuildContext() {
        this(AstValidator.permissive(), new ProgramRegistry(), DiagnosticLevel.WARN);
    }

    public BuildContext(AstValidator validator, ProgramRegistry registry, DiagnosticLevel diagnosticLevel) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.diagnosticLevel = Objects.requireNonNull(diagnosticLevel, "diagnosticLevel");
    }

    /**
     * Context for the given settings: a {@link CatalogueValidator} when a catalogue is configured, and either the
     * shared registry or a fresh one.
     */
    public static BuildContext fromSettings(AstSettings settings) {
        AstValidator validator = settings.catalogue()
            .map(BlockCatalogue::load)
            .<AstValidator>map(CatalogueValidator::new)
            .orElseGet(AstValidator::permissive);
        ProgramRegistry registry = settings.useSharedRegistry() ? ProgramRegistry.shared() : new ProgramRegistry();
        return new BuildContext(validator, registry, settings.diagnosticLevel());
    }

    public AstValidator validator() {
        return validator;
    }

    public ProgramRegistry registry() {
        return registry;
    }

    /** Diagnostics of every node built through this context, in construction order. */
    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public ArgElement arg(String argType, String returnType, Map<String, Object> props) {
        return record(ArgElement.create(argType, returnType, props, validator));
    }

    public ArgElement functionArg(String returnType, String argName, List<ArgElement> args) {
        var props = new LinkedHashMap<String, Object>();
        props.put(ArgElement.ARG_NAME, argName);
        props.put(ArgElement.ARGS, args);
        return record(new ArgElement(ArgKind.FUNCTION, returnType, props, validator));
    }

    public ArgElement valueArg(String returnType, String argName, Object value) {
        var props = new LinkedHashMap<String, Object>();
        props.put(ArgElement.ARG_NAME, argName);
        props.put(ArgElement.VALUE, value);
        return record(new ArgElement(ArgKind.VALUE, returnType, props, validator));
    }

    public SyntaxElement instruction(String type, Map<String, Object> props) {
        return record(SyntaxElement.create(type, props, validator));
    }

    public SyntaxElement start(List<SyntaxElement> childStack) {
        return build(InstructionCategory.START, "start", null, childStack);
    }

    public SyntaxElement action(List<ArgElement> args, List<SyntaxElement> childStack) {
        return build(InstructionCategory.ACTION, "action", args, childStack);
    }

    public SyntaxElement flow(String instruction, List<ArgElement> args) {
        return build(InstructionCategory.FLOW, instruction, args, null);
    }

    public SyntaxElement flowNoArgs(String instruction) {
        return build(InstructionCategory.FLOW_NO_ARGS, instruction, null, null);
    }

    public SyntaxElement clamp(String instruction, List<ArgElement> args, List<SyntaxElement> childStack) {
        return build(InstructionCategory.CLAMP, instruction, args, childStack);
    }

    public SyntaxElement clampNoArgs(String instruction, List<SyntaxElement> childStack) {
        return build(InstructionCategory.CLAMP_NO_ARGS, instruction, null, childStack);
    }

    private SyntaxElement build(InstructionCategory type, String instruction, List<ArgElement> args, List<SyntaxElement> childStack) {
        var props = new LinkedHashMap<String, Object>();
        props.put(SyntaxElement.INSTRUCTION, instruction);
        props.put(SyntaxElement.ARGS, args);
        props.put(SyntaxElement.CHILD_STACK, childStack);
        return record(new SyntaxElement(type, props, validator));
    }

    public List<SyntaxElement> addStartStack(List<SyntaxElement> stack) {
        var copy = List.copyOf(stack);
        registry.startStacks().add(copy);
        return copy;
    }

    public List<SyntaxElement> addActionStack(List<SyntaxElement> stack) {
        var copy = List.copyOf(stack);
        registry.actionStacks().add(copy);
        return copy;
    }

    private ArgElement record(ArgElement node) {
        report(node.diagnostics());
        return node;
    }

    private SyntaxElement record(SyntaxElement node) {
        report(node.diagnostics());
        return node;
    }

    private void report(List<Diagnostic> found) {
        for (Diagnostic diagnostic : found) {
            diagnostics.add(diagnostic);
            switch (diagnosticLevel) {
                case OFF -> { }
                case DEBUG -> log.debug("{}", diagnostic);
                case INFO -> log.info("{}", diagnostic);
                case WARN -> log.warn("{}", diagnostic);
            }
        }
    }
}
