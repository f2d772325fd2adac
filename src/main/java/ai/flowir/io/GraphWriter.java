package ai.flowir.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.flowir.graph.Graph;
import ai.flowir.model.CommandEdge;
import ai.flowir.model.Edge;
import ai.flowir.model.RoutingEdge;
import ai.flowir.model.StaticEdge;

public final class GraphWriter {

    public static final String SCHEMA_VERSION = "flow-ir/v1";

    public static final String GRAPH_FILE = "graph.json";
    public static final String PROMPT_FILE = "prompt.txt";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final GraphSerializer serializer;
    private final ObjectMapper jsonMapper;

    public GraphWriter(Path outDir) {
        this(outDir, new GraphSerializer());
    }

    public GraphWriter(Path outDir, GraphSerializer serializer) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Summary writeAll(Graph graph, String generatedAt) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        writeText(outDir.resolve(GRAPH_FILE), serializer.toJson(graph) + "\n");
        writeText(outDir.resolve(PROMPT_FILE), serializer.toPrompt(graph) + "\n");

        final Summary summary = summarize(graph);
        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                GRAPH_FILE,
                PROMPT_FILE,
                summary
        );
        jsonMapper.writeValue(outDir.resolve(INDEX_FILE).toFile(), idx);
        return summary;
    }

    static Summary summarize(Graph graph) {
        int staticEdges = 0;
        int routingEdges = 0;
        int commandEdges = 0;
        for (List<Edge> edges : graph.edges().values()) {
            for (Edge edge : edges) {
                if (edge instanceof StaticEdge) {
                    staticEdges++;
                } else if (edge instanceof RoutingEdge) {
                    routingEdges++;
                } else if (edge instanceof CommandEdge) {
                    commandEdges++;
                }
            }
        }
        return new Summary(
                graph.nodes().size(),
                graph.edgeCount(),
                graph.edges().size(),
                staticEdges,
                routingEdges,
                commandEdges
        );
    }

    private static void writeText(Path file, String text) throws IOException {
        // overwrite each time (simple + deterministic)
        Files.writeString(file, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    // --- index records ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            String graph,
            String prompt,
            Summary summary
    ) {
    }

    public record Summary(
            int nodes,
            int edges,
            int sources,
            int staticEdges,
            int routingEdges,
            int commandEdges
    ) {
    }
}
