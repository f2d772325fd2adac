package ai.flowir.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.flowir.model.CommandEdge;
import ai.flowir.model.Edge;
import ai.flowir.model.RoutingEdge;
import ai.flowir.model.StaticEdge;

/**
 * Optional referential check over a built graph. Reports, never rejects:
 * the builder itself does not require edges to point at known nodes.
 */
public final class GraphValidator {

    private GraphValidator() {
    }

    /**
     * Every edge endpoint missing from the graph's nodes, in edge order.
     * A missing source is reported once, with the source as its own reference.
     */
    public static List<DanglingReference> findDanglingReferences(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        final var nodes = graph.nodes();
        final List<DanglingReference> out = new ArrayList<>();

        for (var e : graph.edges().entrySet()) {
            final String source = e.getKey();
            if (!nodes.containsKey(source)) {
                out.add(new DanglingReference(source, source));
            }
            for (Edge edge : e.getValue()) {
                for (String target : targetsOf(edge)) {
                    if (!nodes.containsKey(target)) {
                        out.add(new DanglingReference(source, target));
                    }
                }
            }
        }
        return out;
    }

    private static List<String> targetsOf(Edge edge) {
        if (edge instanceof StaticEdge s) {
            return List.of(s.target());
        }
        if (edge instanceof RoutingEdge r) {
            return r.possibleTargets() == null ? List.of() : r.possibleTargets();
        }
        if (edge instanceof CommandEdge c) {
            return c.possibleTargets();
        }
        throw new IllegalStateException("Unknown edge type: " + edge.getClass().getName());
    }

    /**
     * @param source    edge source the reference was found under
     * @param reference the unknown node name (equals source when the source itself is unknown)
     */
    public record DanglingReference(String source, String reference) {
        public String describe() {
            return source.equals(reference)
                    ? "edge source '" + source + "' is not a node"
                    : "edge from '" + source + "' references unknown node '" + reference + "'";
        }
    }
}
