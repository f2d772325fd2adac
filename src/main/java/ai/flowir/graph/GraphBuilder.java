package ai.flowir.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.flowir.model.CommandEdge;
import ai.flowir.model.Node;
import ai.flowir.model.NodeNames;
import ai.flowir.model.RoutingEdge;
import ai.flowir.model.StaticEdge;

/**
 * Lowers a {@link SourceGraphAdapter} into a {@link Graph}.
 * Deterministic: the same adapter input always yields the same node and edge order.
 * <p>
 * Missing introspection data never fails the build. The only failure is a
 * malformed dynamic-target descriptor, reported as {@link IllegalArgumentException}.
 */
public final class GraphBuilder {

    private final SourceGraphAdapter source;

    public GraphBuilder(SourceGraphAdapter source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public Graph build() {
        final String startToken = source.startToken();
        final String endToken = source.endToken();

        final Graph graph = new Graph(
                source.stateSchemaDescription(),
                source.inputSchemaDescription(),
                source.outputSchemaDescription());

        // Step 1: pseudo nodes, whether or not the source graph mentions them
        graph.addNode(Node.of(NodeNames.START));
        graph.addNode(Node.of(NodeNames.END));

        // Step 2: declared steps
        final List<SourceGraphAdapter.DeclaredStep> steps = source.nodes();
        for (var step : steps) {
            if (step.name().equals(startToken) || step.name().equals(endToken)) {
                continue; // already registered as a pseudo node
            }
            graph.addNode(new Node(step.name(), step.definedAt(), step.definition()));
        }

        // Step 3: unconditional transitions
        for (var t : source.unconditionalTransitions()) {
            graph.addEdge(mapName(t.source()), new StaticEdge(mapName(t.target())));
        }

        // Step 4: joins, flattened into one static edge per source
        for (var join : source.joinTransitions()) {
            final String target = mapName(join.target());
            for (String from : join.sources()) {
                graph.addEdge(mapName(from), new StaticEdge(target));
            }
        }

        // Step 5: conditional branches
        for (var e : source.branches().entrySet()) {
            final String from = mapName(e.getKey());
            for (var branch : e.getValue().entrySet()) {
                final var spec = branch.getValue();
                final String routingFn = spec != null && spec.name() != null
                        ? spec.name()
                        : branch.getKey();
                graph.addEdge(from, new RoutingEdge(routingFn, null));
            }
        }

        // Step 6: command edges, once per distinct step name
        final Set<String> stepNames = new LinkedHashSet<>();
        for (var step : steps) {
            stepNames.add(step.name());
        }
        for (String name : stepNames) {
            final List<String> targets = dynamicTargetNames(name, source.dynamicTargets(name));
            if (!targets.isEmpty()) {
                graph.addEdge(mapName(name), new CommandEdge(targets));
            }
        }

        return graph;
    }

    private List<String> dynamicTargetNames(String nodeName, Object descriptor) {
        if (descriptor == null) {
            return List.of();
        }
        final Iterable<?> names;
        if (descriptor instanceof List<?> list) {
            names = list;
        } else if (descriptor instanceof Map<?, ?> map) {
            names = map.keySet();
        } else {
            throw new IllegalArgumentException("Dynamic targets of node '" + nodeName
                    + "' must be a list or a map, got " + descriptor.getClass().getName());
        }

        final List<String> out = new ArrayList<>();
        for (Object name : names) {
            if (!(name instanceof String s)) {
                throw new IllegalArgumentException("Dynamic target of node '" + nodeName
                        + "' is not a name: " + name);
            }
            out.add(mapName(s));
        }
        return out;
    }

    private String mapName(String name) {
        if (name.equals(source.startToken())) {
            return NodeNames.START;
        }
        if (name.equals(source.endToken())) {
            return NodeNames.END;
        }
        return name;
    }
}
