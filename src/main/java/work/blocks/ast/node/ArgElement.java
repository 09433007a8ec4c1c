package work.blocks.ast.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument node: either a function over ordered sub-arguments or a literal value.
 * <p>
 * Exactly one of {@link #args()} and {@link #value()} is non-null, selected by {@link #argType()}.
 * Instances are immutable.
 */
public final class ArgElement {
    public static final String ARG_NAME = "argName";
    public static final String ARGS = "args";
    public static final String VALUE = "value";

    private final ArgKind argType;
    private final String returnType;
    private final String argName;
    private final List<ArgElement> args;
    private final Object value;
    private final List<Diagnostic> diagnostics;

    public ArgElement(ArgKind argType, String returnType, Map<String, Object> props) {
        this(argType, returnType, props, AstValidator.permissive());
    }

    public ArgElement(ArgKind argType, String returnType, Map<String, Object> props, AstValidator validator) {
        if (argType == null) {
            throw new AstConstructionException(Violation.UNKNOWN_ARG_KIND, null, "Invalid argument type: type is required");
        }
        var input = Props.orEmpty(props);
        var checks = validator == null ? AstValidator.permissive() : validator;
        var notes = new ArrayList<Diagnostic>();
        String name = Props.string(input, ARG_NAME, null);
        if (name == null) {
            throw Props.malformed(null, "\"" + ARG_NAME + "\" is required");
        }

        Shape shape = switch (argType) {
            case FUNCTION -> functionShape(name, input, checks, notes);
            case VALUE -> valueShape(name, input, checks, notes);
        };

        this.argType = argType;
        this.returnType = returnType;
        this.argName = name;
        this.args = shape.args();
        this.value = shape.value();
        this.diagnostics = Collections.unmodifiableList(notes);
    }

    /**
     * Builds an argument node from its string tag ({@code "function"} or {@code "value"}).
     */
    public static ArgElement create(String argType, String returnType, Map<String, Object> props) {
        return new ArgElement(ArgKind.from(argType), returnType, props);
    }

    public static ArgElement create(String argType, String returnType, Map<String, Object> props, AstValidator validator) {
        return new ArgElement(ArgKind.from(argType), returnType, props, validator);
    }

    private static Shape functionShape(String name, Map<String, Object> input, AstValidator checks, List<Diagnostic> notes) {
        if (!checks.isValidArgName(ArgKind.FUNCTION, name)) {
            throw new AstConstructionException(
                Violation.INVALID_ARG_NAME,
                name,
                "Invalid argument type: \"" + name + "\" is not a function"
            );
        }
        List<ArgElement> given = Props.args(input, ARGS, name);
        if (given == null) {
            throw new AstConstructionException(
                Violation.ARGS_REQUIRED,
                name,
                "Invalid arguments: \"" + name + "\" requires arguments"
            );
        }
        List<ArgElement> accepted = checks.validateArgs(name, List.copyOf(given));
        if (accepted == null) {
            throw new AstConstructionException(Violation.INVALID_ARGS, name, "Invalid arguments: \"" + name + "\" was rejected");
        }
        if (Props.has(input, VALUE)) {
            notes.add(new Diagnostic(
                DiagnosticCode.VALUE_IGNORED,
                name,
                "\"" + name + "\" is a function and doesn't store a value"
            ));
        }
        return new Shape(List.copyOf(accepted), null);
    }

    private static Shape valueShape(String name, Map<String, Object> input, AstValidator checks, List<Diagnostic> notes) {
        if (!checks.isValidArgName(ArgKind.VALUE, name)) {
            throw new AstConstructionException(
                Violation.INVALID_ARG_NAME,
                name,
                "Invalid argument type: \"" + name + "\" is not a value"
            );
        }
        if (Props.has(input, ARGS)) {
            notes.add(new Diagnostic(
                DiagnosticCode.ARGS_IGNORED,
                name,
                "\"" + name + "\" is a value and doesn't take arguments"
            ));
        }
        Object literal = input.get(VALUE);
        if (literal == null) {
            throw new AstConstructionException(
                Violation.VALUE_REQUIRED,
                name,
                "Invalid argument value: value is required"
            );
        }
        if (!isScalar(literal)) {
            throw Props.malformed(name, "\"" + VALUE + "\" must be a scalar (got " + literal.getClass().getSimpleName() + ")");
        }
        return new Shape(null, literal);
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number
            || value instanceof String
            || value instanceof Boolean
            || value instanceof Character;
    }

    public ArgKind argType() {
        return argType;
    }

    public String returnType() {
        return returnType;
    }

    public String argName() {
        return argName;
    }

    /** Sub-arguments of a function node; {@code null} for value nodes. */
    public List<ArgElement> args() {
        return args;
    }

    /** Literal of a value node; {@code null} for function nodes. */
    public Object value() {
        return value;
    }

    public boolean isFunction() {
        return argType == ArgKind.FUNCTION;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * State of the node with absent fields omitted: {@code argName}, then {@code args} or {@code value}.
     */
    public Map<String, Object> props() {
        var props = new LinkedHashMap<String, Object>();
        props.put(ARG_NAME, argName);
        if (args != null) {
            props.put(ARGS, args);
        }
        if (value != null) {
            props.put(VALUE, value);
        }
        return Collections.unmodifiableMap(props);
    }

    @Override
    public String toString() {
        return "ArgElement[" + argType.tag() + " " + argName + (value != null ? "=" + value : "(" + args.size() + ")") + "]";
    }

    private record Shape(List<ArgElement> args, Object value) {}
}
