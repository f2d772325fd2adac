package ai.flowir.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.flowir.graph.SourceGraphAdapter;
import ai.flowir.scan.CodeDefinition;
import ai.flowir.scan.SourceIndex;

/**
 * {@link SourceGraphAdapter} over a {@link WorkflowDocument}.
 * Step and schema metadata is looked up in a {@link SourceIndex}; anything
 * that cannot be resolved is reported as absent.
 */
public final class JsonWorkflowAdapter implements SourceGraphAdapter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WorkflowDocument document;
    private final SourceIndex index;
    private final Map<String, WorkflowDocument.NodeSpec> nodesByName = new HashMap<>();

    public JsonWorkflowAdapter(WorkflowDocument document, SourceIndex index) {
        this.document = Objects.requireNonNull(document, "document");
        this.index = Objects.requireNonNull(index, "index");
        checkDocument(document);
        for (var spec : document.nodes()) {
            nodesByName.put(spec.name(), spec); // last declaration wins, as in the graph
        }
    }

    public static WorkflowDocument read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return MAPPER.readValue(file.toFile(), WorkflowDocument.class);
    }

    public static JsonWorkflowAdapter load(Path file, SourceIndex index) throws IOException {
        return new JsonWorkflowAdapter(read(file), index);
    }

    @Override
    public List<DeclaredStep> nodes() {
        final List<DeclaredStep> out = new ArrayList<>(document.nodes().size());
        for (var spec : document.nodes()) {
            final CodeDefinition def = index.resolveFunction(spec.function());
            out.add(def == null
                    ? new DeclaredStep(spec.name(), null, null)
                    : new DeclaredStep(spec.name(), def.location(), def.describeFunction()));
        }
        return out;
    }

    @Override
    public List<Transition> unconditionalTransitions() {
        final List<Transition> out = new ArrayList<>(document.edges().size());
        for (var edge : document.edges()) {
            out.add(new Transition(edge.source(), edge.target()));
        }
        return out;
    }

    @Override
    public List<JoinTransition> joinTransitions() {
        final List<JoinTransition> out = new ArrayList<>(document.waitingEdges().size());
        for (var edge : document.waitingEdges()) {
            out.add(new JoinTransition(edge.sources(), edge.target()));
        }
        return out;
    }

    @Override
    public Map<String, Map<String, BranchSpec>> branches() {
        final Map<String, Map<String, BranchSpec>> out = new LinkedHashMap<>();
        for (var e : document.branches().entrySet()) {
            final Map<String, BranchSpec> specs = new LinkedHashMap<>();
            for (var branch : e.getValue().entrySet()) {
                specs.put(branch.getKey(), new BranchSpec(routingFunctionName(branch.getValue())));
            }
            out.put(e.getKey(), specs);
        }
        return out;
    }

    @Override
    public Object dynamicTargets(String nodeName) {
        final var spec = nodesByName.get(nodeName);
        if (spec == null) {
            return null;
        }
        final JsonNode ends = spec.ends();
        if (ends == null || ends.isNull() || ends.isMissingNode()) {
            return null;
        }
        // array -> List, object -> LinkedHashMap, scalars stay scalars
        return MAPPER.convertValue(ends, Object.class);
    }

    @Override
    public String stateSchemaDescription() {
        return describeType(document.stateSchema());
    }

    @Override
    public String inputSchemaDescription() {
        return describeType(document.effectiveInputSchema());
    }

    @Override
    public String outputSchemaDescription() {
        return describeType(document.effectiveOutputSchema());
    }

    private String describeType(String typeRef) {
        final CodeDefinition def = index.resolveType(typeRef);
        return def == null ? null : def.describeType();
    }

    /**
     * Explicit name, else the method part of the function reference, else null.
     */
    static String routingFunctionName(WorkflowDocument.BranchDoc branch) {
        if (branch == null) {
            return null;
        }
        if (branch.name() != null && !branch.name().isBlank()) {
            return branch.name();
        }
        final String fn = branch.function();
        if (fn == null || fn.isBlank()) {
            return null;
        }
        final int hash = fn.lastIndexOf('#');
        final String method = hash >= 0 ? fn.substring(hash + 1) : fn;
        return method.isBlank() ? null : method.trim();
    }

    private static void checkDocument(WorkflowDocument document) {
        for (var spec : document.nodes()) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                throw new IllegalArgumentException("Workflow node without a name");
            }
        }
        for (var edge : document.edges()) {
            if (edge == null || edge.source() == null || edge.target() == null) {
                throw new IllegalArgumentException("Workflow edge needs source and target: " + edge);
            }
        }
        for (var edge : document.waitingEdges()) {
            if (edge == null || edge.sources() == null || edge.target() == null
                    || edge.sources().stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Workflow waiting edge needs sources and target: " + edge);
            }
        }
        for (var e : document.branches().entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Workflow branches of '" + e.getKey() + "' must be an object");
            }
        }
    }
}
