package ai.flowir.graph;

import org.junit.jupiter.api.Test;

import ai.flowir.model.Node;
import ai.flowir.model.StaticEdge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTest {

    @Test
    void testEmptyGraph() {
        Graph graph = new Graph();

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.stateSchemaDescription()).isNull();
    }

    @Test
    void testAddNode() {
        Graph graph = new Graph();
        Node node = Node.of("test");

        graph.addNode(node);

        assertThat(graph.nodes()).containsEntry("test", node);
    }

    @Test
    void testDuplicateNodeReplacedInPlace() {
        Graph graph = new Graph();
        graph.addNode(Node.of("a"));
        graph.addNode(Node.of("b"));

        graph.addNode(new Node("a", "second.py:2", null));

        assertThat(graph.nodes().keySet()).containsExactly("a", "b");
        assertThat(graph.nodes().get("a").definedAt()).isEqualTo("second.py:2");
    }

    @Test
    void testEdgesKeepInsertionOrder() {
        Graph graph = new Graph();

        graph.addEdge("b", new StaticEdge("c"));
        graph.addEdge("a", new StaticEdge("b"));
        graph.addEdge("b", new StaticEdge("d"));

        assertThat(graph.edges().keySet()).containsExactly("b", "a");
        assertThat(graph.edgesFrom("b")).containsExactly(new StaticEdge("c"), new StaticEdge("d"));
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void testUntouchedSourceHasNoKey() {
        Graph graph = new Graph();
        graph.addNode(Node.of("a"));

        assertThat(graph.edges()).doesNotContainKey("a");
        assertThat(graph.edgesFrom("a")).isEmpty();
    }

    @Test
    void testViewsAreReadOnly() {
        Graph graph = new Graph();
        graph.addEdge("a", new StaticEdge("b"));

        assertThatThrownBy(() -> graph.nodes().put("x", Node.of("x")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> graph.edges().get("a").add(new StaticEdge("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
