package ai.flowir.io;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.flowir.graph.Graph;
import ai.flowir.model.CommandEdge;
import ai.flowir.model.Node;
import ai.flowir.model.RoutingEdge;
import ai.flowir.model.StaticEdge;

import static org.assertj.core.api.Assertions.assertThat;

class GraphWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesGraphPromptAndIndex() throws Exception {
        // Given
        Graph graph = sampleGraph();
        Path outDir = tempDir.resolve("out");
        GraphSerializer serializer = new GraphSerializer();

        // When
        GraphWriter.Summary summary = new GraphWriter(outDir).writeAll(graph, "2024-01-01T00:00:00Z");

        // Then
        assertThat(Files.readString(outDir.resolve(GraphWriter.GRAPH_FILE), StandardCharsets.UTF_8))
                .isEqualTo(serializer.toJson(graph) + "\n");
        assertThat(Files.readString(outDir.resolve(GraphWriter.PROMPT_FILE), StandardCharsets.UTF_8))
                .isEqualTo(serializer.toPrompt(graph) + "\n");

        JsonNode index = new ObjectMapper().readTree(outDir.resolve(GraphWriter.INDEX_FILE).toFile());
        assertThat(index.get("schema").asText()).isEqualTo(GraphWriter.SCHEMA_VERSION);
        assertThat(index.get("generatedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(index.get("graph").asText()).isEqualTo("graph.json");
        assertThat(index.get("summary").get("edges").asInt()).isEqualTo(4);

        assertThat(summary).isEqualTo(new GraphWriter.Summary(3, 4, 2, 2, 1, 1));
    }

    @Test
    void testOverwritesPreviousOutput() throws Exception {
        // Given
        Path outDir = tempDir.resolve("out");
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve(GraphWriter.GRAPH_FILE), "x".repeat(10_000));

        // When
        new GraphWriter(outDir).writeAll(new Graph(), "now");

        // Then
        assertThat(Files.readString(outDir.resolve(GraphWriter.GRAPH_FILE)))
                .isEqualTo(new GraphSerializer().toJson(new Graph()) + "\n");
    }

    private static Graph sampleGraph() {
        Graph graph = new Graph();
        graph.addNode(Node.of("a"));
        graph.addNode(Node.of("b"));
        graph.addNode(Node.of("c"));
        graph.addEdge("a", new StaticEdge("b"));
        graph.addEdge("a", new RoutingEdge("route", null));
        graph.addEdge("b", new StaticEdge("c"));
        graph.addEdge("b", new CommandEdge(List.of("a", "c")));
        return graph;
    }
}
