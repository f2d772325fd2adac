package ai.flowir.source;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON description of a source workflow graph.
 * <p>
 * Function references are "<type>#<method>"; schema references are type names.
 * Types may be fully qualified or, when unique in the scanned sources, simple names.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDocument(
        String name,
        String stateSchema,
        String inputSchema,   // defaults to stateSchema
        String outputSchema,  // defaults to stateSchema
        List<NodeSpec> nodes,
        List<EdgeSpec> edges,
        List<WaitingEdgeSpec> waitingEdges,
        Map<String, Map<String, BranchDoc>> branches
) {
    public WorkflowDocument {
        nodes = nodes == null ? List.of() : nodes;
        edges = edges == null ? List.of() : edges;
        waitingEdges = waitingEdges == null ? List.of() : waitingEdges;
        branches = branches == null ? Map.of() : branches;
    }

    public String effectiveInputSchema() {
        return inputSchema != null ? inputSchema : stateSchema;
    }

    public String effectiveOutputSchema() {
        return outputSchema != null ? outputSchema : stateSchema;
    }

    /**
     * @param ends targets the step may jump to by itself: an array of names or an
     *             object keyed by name; kept raw so its shape is checked by the builder
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NodeSpec(String name, String function, JsonNode ends) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EdgeSpec(String source, String target) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WaitingEdgeSpec(List<String> sources, String target) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BranchDoc(String name, String function) {
    }
}
