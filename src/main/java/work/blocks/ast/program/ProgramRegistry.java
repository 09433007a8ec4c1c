package work.blocks.ast.program;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import work.blocks.ast.node.SyntaxElement;

/**
 * Top-level stacks of a program: start stacks (entry flows) and action stacks (independently triggered flows).
 * <p>
 * {@link #startStacks()} and {@link #actionStacks()} return the live backing lists; callers append stacks to
 * them directly and every holder of the registry sees the change. The lists tolerate concurrent appends.
 * No validation happens here.
 */
public final class ProgramRegistry {
    private static final Object SHARED_LOCK = new Object();
    private static volatile ProgramRegistry shared;

    private final List<List<SyntaxElement>> startStacks = new CopyOnWriteArrayList<>();
    private final List<List<SyntaxElement>> actionStacks = new CopyOnWriteArrayList<>();

    /**
     * Creates an independent registry, not related to {@link #shared()}.
     */
    public ProgramRegistry() {}

    /**
     * Returns the process-wide registry, creating it on first use.
     */
    public static ProgramRegistry shared() {
        ProgramRegistry instance = shared;
        if (instance == null) {
            synchronized (SHARED_LOCK) {
                instance = shared;
                if (instance == null) {
                    instance = new ProgramRegistry();
                    shared = instance;
                }
            }
        }
        return instance;
    }

    /**
     * The process-wide registry if {@link #shared()} has been called.
     */
    public static Optional<ProgramRegistry> current() {
        return Optional.ofNullable(shared);
    }

    public List<List<SyntaxElement>> startStacks() {
        return startStacks;
    }

    public List<List<SyntaxElement>> actionStacks() {
        return actionStacks;
    }
}
