package ai.flowir.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.flowir.model.Edge;
import ai.flowir.model.Node;

/**
 * Control-flow graph of a workflow, ready for serialization.
 * - nodes: name -> node, insertion ordered
 * - edges: source name -> outgoing edges in declaration order
 * <p>
 * Edges are not checked against nodes; a target may name an unknown node.
 */
public final class Graph {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, List<Edge>> edges = new LinkedHashMap<>();

    private final String stateSchemaDescription;
    private final String inputSchemaDescription;
    private final String outputSchemaDescription;

    public Graph() {
        this(null, null, null);
    }

    public Graph(String stateSchemaDescription,
                 String inputSchemaDescription,
                 String outputSchemaDescription) {
        this.stateSchemaDescription = stateSchemaDescription;
        this.inputSchemaDescription = inputSchemaDescription;
        this.outputSchemaDescription = outputSchemaDescription;
    }

    /**
     * Registers a node. A node with the same name is replaced in place (last write wins).
     */
    public void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        nodes.put(node.name(), node);
    }

    public void addEdge(String from, Edge edge) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(edge, "edge");
        edges.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
    }

    public Map<String, Node> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Map<String, List<Edge>> edges() {
        final Map<String, List<Edge>> view = new LinkedHashMap<>();
        for (var e : edges.entrySet()) {
            view.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    public List<Edge> edgesFrom(String source) {
        final List<Edge> out = edges.get(source);
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    public int edgeCount() {
        int count = 0;
        for (List<Edge> list : edges.values()) {
            count += list.size();
        }
        return count;
    }

    public String stateSchemaDescription() {
        return stateSchemaDescription;
    }

    public String inputSchemaDescription() {
        return inputSchemaDescription;
    }

    public String outputSchemaDescription() {
        return outputSchemaDescription;
    }
}
