package work.blocks.ast.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instruction node. Whether {@link #args()} and {@link #childStack()} are populated depends only on
 * {@link #type()}:
 * <pre>
 *   category        args   childStack
 *   start           -      yes
 *   action          yes    yes
 *   flow            yes    -
 *   flow-no-args    -      -
 *   clamp           yes    yes
 *   clamp-no-args   -      yes
 * </pre>
 * Forbidden fields supplied by the caller are discarded with a {@link Diagnostic}; a missing child
 * stack defaults to an empty one. Instances are immutable.
 */
public final class SyntaxElement {
    public static final String INSTRUCTION = "instruction";
    public static final String ARGS = "args";
    public static final String CHILD_STACK = "childStack";

    private final InstructionCategory type;
    private final String instruction;
    private final List<ArgElement> args;
    private final List<SyntaxElement> childStack;
    private final List<Diagnostic> diagnostics;

    public SyntaxElement(InstructionCategory type, Map<String, Object> props) {
        this(type, props, AstValidator.permissive());
    }

    public SyntaxElement(InstructionCategory type, Map<String, Object> props, AstValidator validator) {
        if (type == null) {
            throw new AstConstructionException(Violation.UNKNOWN_CATEGORY, null, "Invalid instruction type: type is required");
        }
        var input = Props.orEmpty(props);
        var checks = validator == null ? AstValidator.permissive() : validator;
        var notes = new ArrayList<Diagnostic>();
        String name = Props.string(input, INSTRUCTION, null);

        Shape shape = switch (type) {
            case START -> {
                String fixed = coerceName(InstructionCategory.START, name, notes);
                ignoreArgs(fixed, input, notes);
                yield new Shape(fixed, null, childStackOrEmpty(fixed, input, notes));
            }
            case ACTION -> {
                String fixed = coerceName(InstructionCategory.ACTION, name, notes);
                List<ArgElement> given = requireArgs(fixed, input);
                yield new Shape(fixed, List.copyOf(given), childStackOrEmpty(fixed, input, notes));
            }
            case FLOW -> {
                String checked = checkName(InstructionCategory.FLOW, name, checks);
                List<ArgElement> accepted = validatedArgs(checked, input, checks);
                ignoreChildStack(checked, input, notes);
                yield new Shape(checked, accepted, null);
            }
            case FLOW_NO_ARGS -> {
                String checked = checkName(InstructionCategory.FLOW, name, checks);
                ignoreArgs(checked, input, notes);
                ignoreChildStack(checked, input, notes);
                yield new Shape(checked, null, null);
            }
            case CLAMP -> {
                String checked = checkName(InstructionCategory.CLAMP, name, checks);
                List<ArgElement> accepted = validatedArgs(checked, input, checks);
                yield new Shape(checked, accepted, childStackOrEmpty(checked, input, notes));
            }
            case CLAMP_NO_ARGS -> {
                String checked = checkName(InstructionCategory.CLAMP, name, checks);
                ignoreArgs(checked, input, notes);
                yield new Shape(checked, null, childStackOrEmpty(checked, input, notes));
            }
        };

        this.type = type;
        this.instruction = shape.instruction();
        this.args = shape.args();
        this.childStack = shape.childStack();
        this.diagnostics = Collections.unmodifiableList(notes);
    }

    /**
     * Builds an instruction node from its category tag, e.g. {@code "flow-no-args"}.
     */
    public static SyntaxElement create(String type, Map<String, Object> props) {
        return new SyntaxElement(InstructionCategory.from(type), props);
    }

    public static SyntaxElement create(String type, Map<String, Object> props, AstValidator validator) {
        return new SyntaxElement(InstructionCategory.from(type), props, validator);
    }

    private static String coerceName(InstructionCategory category, String name, List<Diagnostic> notes) {
        String fixed = category.tag();
        if (!fixed.equals(name)) {
            notes.add(new Diagnostic(
                DiagnosticCode.NAME_COERCED,
                name,
                "instruction for \"" + fixed + "\" should be \"" + fixed + "\""
            ));
        }
        return fixed;
    }

    private static String checkName(InstructionCategory base, String name, AstValidator checks) {
        if (name == null) {
            throw Props.malformed(null, "\"" + INSTRUCTION + "\" is required for a " + base.tag());
        }
        if (!checks.isValidInstructionName(base, name)) {
            throw new AstConstructionException(
                Violation.INVALID_INSTRUCTION_NAME,
                name,
                "Invalid instruction category: \"" + name + "\" is not a " + base.tag()
            );
        }
        return name;
    }

    private static List<ArgElement> requireArgs(String name, Map<String, Object> input) {
        List<ArgElement> given = Props.args(input, ARGS, name);
        if (given == null) {
            throw new AstConstructionException(
                Violation.ARGS_REQUIRED,
                name,
                "Invalid arguments: \"" + name + "\" requires arguments"
            );
        }
        return given;
    }

    private static List<ArgElement> validatedArgs(String name, Map<String, Object> input, AstValidator checks) {
        List<ArgElement> accepted = checks.validateArgs(name, List.copyOf(requireArgs(name, input)));
        if (accepted == null) {
            throw new AstConstructionException(Violation.INVALID_ARGS, name, "Invalid arguments: \"" + name + "\" was rejected");
        }
        return List.copyOf(accepted);
    }

    private static List<SyntaxElement> childStackOrEmpty(String name, Map<String, Object> input, List<Diagnostic> notes) {
        List<SyntaxElement> given = Props.childStack(input, CHILD_STACK, name);
        if (given == null) {
            notes.add(new Diagnostic(
                DiagnosticCode.CHILD_STACK_DEFAULTED,
                name,
                "\"" + name + "\" takes a child flow"
            ));
            return List.of();
        }
        return List.copyOf(given);
    }

    private static void ignoreArgs(String name, Map<String, Object> input, List<Diagnostic> notes) {
        if (Props.has(input, ARGS)) {
            notes.add(new Diagnostic(
                DiagnosticCode.ARGS_IGNORED,
                name,
                "\"" + name + "\" takes no arguments"
            ));
        }
    }

    private static void ignoreChildStack(String name, Map<String, Object> input, List<Diagnostic> notes) {
        if (Props.has(input, CHILD_STACK)) {
            notes.add(new Diagnostic(
                DiagnosticCode.CHILD_STACK_IGNORED,
                name,
                "\"" + name + "\" takes no child flow"
            ));
        }
    }

    public InstructionCategory type() {
        return type;
    }

    public String instruction() {
        return instruction;
    }

    /** {@code null} unless the category takes arguments. */
    public List<ArgElement> args() {
        return args;
    }

    /** {@code null} unless the category takes a child stack. */
    public List<SyntaxElement> childStack() {
        return childStack;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public Map<String, Object> props() {
        var props = new LinkedHashMap<String, Object>();
        props.put(INSTRUCTION, instruction);
        if (args != null) {
            props.put(ARGS, args);
        }
        if (childStack != null) {
            props.put(CHILD_STACK, childStack);
        }
        return Collections.unmodifiableMap(props);
    }

    @Override
    public String toString() {
        return "SyntaxElement[" + type.tag() + " " + instruction + "]";
    }

    private record Shape(String instruction, List<ArgElement> args, List<SyntaxElement> childStack) {}
}
