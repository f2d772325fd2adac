package ai.flowir.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a foreign workflow graph, as consumed by {@link GraphBuilder}.
 * Implementations are thin shims over a concrete graph library or file format.
 * <p>
 * All sequences and maps are read in iteration order, so implementations should
 * return ordered collections.
 */
public interface SourceGraphAdapter {

    String DEFAULT_START_TOKEN = "__start__";
    String DEFAULT_END_TOKEN = "__end__";

    /**
     * Declared computation steps. Location and definition may be null.
     */
    List<DeclaredStep> nodes();

    /**
     * Always-taken transitions.
     */
    List<Transition> unconditionalTransitions();

    /**
     * Transitions where all sources must complete before the target runs.
     */
    List<JoinTransition> joinTransitions();

    /**
     * source name -> (branch label -> branch spec), both levels ordered.
     */
    Map<String, Map<String, BranchSpec>> branches();

    /**
     * Targets a step may jump to by itself: null when it has none, otherwise a
     * {@code List<String>} of target names or a {@code Map} keyed by target name.
     * Any other shape is a contract violation.
     */
    Object dynamicTargets(String nodeName);

    /**
     * Name the source graph uses for its entry marker.
     */
    default String startToken() {
        return DEFAULT_START_TOKEN;
    }

    /**
     * Name the source graph uses for its termination marker.
     */
    default String endToken() {
        return DEFAULT_END_TOKEN;
    }

    default String stateSchemaDescription() {
        return null;
    }

    default String inputSchemaDescription() {
        return null;
    }

    default String outputSchemaDescription() {
        return null;
    }

    record DeclaredStep(
            String name,
            String definedAt,   // <file>:<line> or null
            String definition   // or null
    ) {
        public DeclaredStep {
            Objects.requireNonNull(name, "name");
        }
    }

    record Transition(String source, String target) {
        public Transition {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
        }
    }

    record JoinTransition(List<String> sources, String target) {
        public JoinTransition {
            sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
            Objects.requireNonNull(target, "target");
        }
    }

    /**
     * @param name resolvable routing function name, or null when unknown
     */
    record BranchSpec(String name) {
    }
}
