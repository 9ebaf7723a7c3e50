package com.raditha.lazygraph.staticgraph;

import com.raditha.lazygraph.Node;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StaticGraphWrapperTest {

    private StaticGraphWrapper wrapper;

    /**
     * a(0) -- b(1), a(0) -- 2, b(1) -- d(3); vertex 2 is unnamed.
     */
    @BeforeEach
    void setUp() {
        StaticGraph graph = StaticGraph.builder()
                .addVertex("a")
                .addVertex("b")
                .addVertex()
                .addVertex("d", "D1")
                .addEdge(0, 1)
                .addEdge(0, 2)
                .addEdge(1, 3)
                .build();
        wrapper = new StaticGraphWrapper(graph);
    }

    @AfterEach
    void tearDown() {
        wrapper.close();
    }

    private static List<String> names(List<Node> nodes) {
        return nodes.stream().map(Node::name).toList();
    }

    @ParameterizedTest
    @CsvSource({
            "a, a",
            "d, d",
            "1, b",
            "2, 2",
            "' 3 ', d"
    })
    void testAuthenticNames(String candidate, String expected) {
        assertEquals(Optional.of(expected), wrapper.getAuthenticNodeName(candidate));
        assertTrue(wrapper.nodeExists(candidate));
    }

    @ParameterizedTest
    @ValueSource(strings = {"zz", "9", "-1", "A"})
    void testUnknownNames(String candidate) {
        assertEquals(Optional.empty(), wrapper.getAuthenticNodeName(candidate));
        assertFalse(wrapper.nodeExists(candidate));
    }

    @Test
    void testNeighborsComeFromWrappedGraph() {
        Node a = wrapper.nodes().getNodeByName("a", true, null).orElseThrow();

        assertEquals(List.of("b", "2"), names(a.neighbors()));

        Node b = wrapper.nodes().getNodeByName("b").orElseThrow();
        assertFalse(b.areNeighborsLoadedLocally());
        assertEquals(List.of("a", "d"), names(b.neighbors()));

        Node d = wrapper.nodes().getNodeByName("d").orElseThrow();
        assertEquals(Optional.of("D1"), d.externalId());
        assertEquals(4, wrapper.nodes().size());
        assertEquals(3, wrapper.edges().size());
    }

    @Test
    void testIndexLookupResolvesToVertexName() {
        Node b = wrapper.nodes().getNodeByName("1", true, null).orElseThrow();

        assertEquals("b", b.name());
        assertEquals(1, ((StaticGraphNode) b).vertex().index());
    }

    @Test
    void testUnknownVertexCannotBeAdded() {
        assertThrows(IllegalArgumentException.class, () -> wrapper.addNode("zz"));
        assertThrows(IllegalArgumentException.class, () -> wrapper.addNode("1"));
        assertEquals(0, wrapper.nodes().size());
    }

    @Test
    void testBuilderValidatesEdges() {
        StaticGraph.Builder builder = StaticGraph.builder().addVertex("x").addVertex("y");

        assertThrows(IllegalArgumentException.class, () -> builder.addEdge(0, 2));

        StaticGraph graph = builder.addEdge(0, 0).addEdge(0, 1).addEdge(1, 0).build();
        assertEquals(1, graph.neighbors(0).size());
        assertEquals("x", graph.neighbors(1).get(0).name());
    }
}
