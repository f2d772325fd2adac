package ai.flowir.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import ai.flowir.graph.Graph;
import ai.flowir.model.CommandEdge;
import ai.flowir.model.Edge;
import ai.flowir.model.Node;
import ai.flowir.model.RoutingEdge;
import ai.flowir.model.StaticEdge;

/**
 * Text projections of a {@link Graph}:
 * - canonical JSON (nodes + edges), stable byte for byte across runs and platforms
 * - prompt text: the JSON plus schema descriptions and node definitions, in tagged sections
 * <p>
 * A schema description that could not be resolved leaves an empty line between its tags.
 */
public final class GraphSerializer {

    public static final String TYPE_STATIC = "static";
    public static final String TYPE_ROUTING = "routing";
    public static final String TYPE_COMMAND = "command";

    private final ObjectWriter jsonWriter;

    public GraphSerializer() {
        final DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter(
                Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        this.jsonWriter = new ObjectMapper().writer(printer);
    }

    public GraphDocument toDocument(Graph graph) {
        Objects.requireNonNull(graph, "graph");

        final List<NodeEntry> nodes = new ArrayList<>(graph.nodes().size());
        for (Node node : graph.nodes().values()) {
            nodes.add(new NodeEntry(node.name(), node.definedAt()));
        }

        final Map<String, List<EdgeEntry>> edges = new LinkedHashMap<>();
        for (var e : graph.edges().entrySet()) {
            final List<EdgeEntry> entries = new ArrayList<>(e.getValue().size());
            for (Edge edge : e.getValue()) {
                entries.add(toEntry(edge));
            }
            edges.put(e.getKey(), entries);
        }
        return new GraphDocument(nodes, edges);
    }

    public String toJson(Graph graph) {
        try {
            return jsonWriter.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize graph", ex);
        }
    }

    public String toPrompt(Graph graph) {
        Objects.requireNonNull(graph, "graph");

        final List<String> definitions = new ArrayList<>();
        for (Node node : graph.nodes().values()) {
            if (node.definition() != null && !node.definition().isEmpty()) {
                definitions.add("Function for node \"" + node.name() + "\" " + node.definition());
            }
        }

        return "<graph_json>\n"
                + toJson(graph) + "\n"
                + "</graph_json>\n"
                + "\n"
                + "<state_schema_description>\n"
                + orEmpty(graph.stateSchemaDescription()) + "\n"
                + "</state_schema_description>\n"
                + "\n"
                + "<input_schema_description>\n"
                + orEmpty(graph.inputSchemaDescription()) + "\n"
                + "</input_schema_description>\n"
                + "\n"
                + "<output_schema_description>\n"
                + orEmpty(graph.outputSchemaDescription()) + "\n"
                + "</output_schema_description>\n"
                + "\n"
                + "<node_definitions>\n"
                + String.join("\n\n", definitions) + "\n"
                + "</node_definitions>";
    }

    private static EdgeEntry toEntry(Edge edge) {
        if (edge instanceof StaticEdge s) {
            return new StaticEntry(TYPE_STATIC, s.target());
        }
        if (edge instanceof RoutingEdge r) {
            return new RoutingEntry(TYPE_ROUTING, r.routingFn(), r.possibleTargets());
        }
        if (edge instanceof CommandEdge c) {
            return new CommandEntry(TYPE_COMMAND, c.possibleTargets());
        }
        throw new IllegalStateException("Unknown edge type: " + edge.getClass().getName());
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    // --- canonical JSON records ---

    @JsonPropertyOrder({"nodes", "edges"})
    public record GraphDocument(
            List<NodeEntry> nodes,
            Map<String, List<EdgeEntry>> edges
    ) {
    }

    @JsonPropertyOrder({"name", "definedAt"})
    public record NodeEntry(
            String name,
            @JsonInclude(JsonInclude.Include.NON_NULL) String definedAt
    ) {
    }

    public sealed interface EdgeEntry permits StaticEntry, RoutingEntry, CommandEntry {
        String type();
    }

    @JsonPropertyOrder({"type", "target"})
    public record StaticEntry(String type, String target) implements EdgeEntry {
    }

    @JsonPropertyOrder({"type", "routingFn", "possibleTargets"})
    public record RoutingEntry(
            String type,
            String routingFn,
            List<String> possibleTargets // null when not enumerable, written as null
    ) implements EdgeEntry {
    }

    @JsonPropertyOrder({"type", "possibleTargets"})
    public record CommandEntry(String type, List<String> possibleTargets) implements EdgeEntry {
    }
}
