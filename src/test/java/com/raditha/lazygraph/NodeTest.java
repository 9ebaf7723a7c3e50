package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.CachedNode;
import com.raditha.lazygraph.cache.GraphCacheException;
import com.raditha.lazygraph.cache.JdbcGraphCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeTest {

    private JdbcGraphCache cache;
    private RecordingNeighborSource source;
    private Graph graph;

    @BeforeEach
    void setUp() {
        cache = JdbcGraphCache.inMemory();
        source = new RecordingNeighborSource()
                .with("X", "Y", "Z")
                .with("Y", "X", "W");
        graph = new OpenGraph(cache, source);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private static List<String> names(List<Node> nodes) {
        return nodes.stream().map(Node::name).toList();
    }

    @Test
    void testNeighborsAreFetchedOnFirstRead() {
        Node x = graph.addNode("X");
        assertFalse(x.areNeighborsCachedInStore());
        assertEquals(0, source.totalCalls());

        assertEquals(List.of("Y", "Z"), names(x.neighbors()));

        assertEquals(1, source.calls("X"));
        assertTrue(x.areNeighborsCachedInStore());
        assertTrue(x.areNeighborsLoadedLocally());
        assertTrue(cache.findNodeByName("X").orElseThrow().neighborsCached());
        assertEquals(List.of("Y", "Z"), cache.neighborNamesOf("X"));
        assertEquals("id-Y", cache.findNodeByName("Y").orElseThrow().externalId());
    }

    @Test
    void testSourceIsCalledAtMostOncePerNode() {
        Node x = graph.addNode("X");

        x.neighbors();
        x.degree();
        x.neighborEdges();
        x.resolveNeighbors();

        assertEquals(1, source.calls("X"));
    }

    @Test
    void testHydrationIsOneHopOnly() {
        Node x = graph.addNode("X");
        x.neighbors();

        Node y = graph.nodes().getNodeByName("Y").orElseThrow();
        assertFalse(y.areNeighborsCachedInStore());
        assertFalse(y.areNeighborsLoadedLocally());
        assertEquals(0, source.calls("Y"));
        assertEquals(0, source.calls("Z"));

        assertEquals(List.of("X", "W"), names(y.neighbors()));
        assertEquals(1, source.calls("Y"));
        assertEquals(0, source.calls("W"));
        assertEquals(4, graph.nodes().size());
    }

    @Test
    void testHydratedEdgesUseDefaultWeight() {
        Node x = graph.addNode("X");
        x.neighbors();

        for (Edge edge : x.neighborEdges()) {
            assertEquals(Edge.DEFAULT_WEIGHT, edge.weight());
        }
    }

    @Test
    void testExistingEdgeKeepsWeightWhenSourceListsIt() {
        graph.addNode("X");
        graph.addNode("Y");
        graph.addEdge("X", "Y", 2.5);

        Node x = graph.nodes().getNodeByName("X").orElseThrow();
        assertEquals(List.of("Y", "Z"), names(x.neighbors()));

        assertEquals(2.5, cache.findEdgeByNames("X", "Y").orElseThrow().weight());
        assertEquals(1.0, cache.findEdgeByNames("X", "Z").orElseThrow().weight());
    }

    @Test
    void testNoSourceCallsAfterReopeningPopulatedCache(@TempDir Path dir) {
        String url = "jdbc:h2:" + dir.resolve("graph").toAbsolutePath();
        try (JdbcGraphCache first = JdbcGraphCache.open(url, "sa", "")) {
            Graph graph1 = new OpenGraph(first, source);
            graph1.addNode("X").neighbors();
        }
        assertEquals(1, source.calls("X"));

        RecordingNeighborSource fresh = new RecordingNeighborSource().with("X", "Q");
        try (JdbcGraphCache second = JdbcGraphCache.open(url, "sa", "")) {
            Graph graph2 = new OpenGraph(second, fresh);
            Node x = graph2.nodes().getNodeByName("X").orElseThrow();

            assertTrue(x.areNeighborsCachedInStore());
            assertFalse(x.areNeighborsLoadedLocally());
            assertEquals(List.of("Y", "Z"), names(x.neighbors()));
            assertEquals(0, fresh.totalCalls());
        }
    }

    @Test
    void testFailedFetchIsRetried() {
        source.with("Q", "R");
        source.failFor("Q");
        Node q = graph.addNode("Q");

        assertThrows(NeighborSourceException.class, q::neighbors);
        assertFalse(q.areNeighborsCachedInStore());
        assertFalse(q.areNeighborsLoadedLocally());
        assertFalse(cache.findNodeByName("Q").orElseThrow().neighborsCached());
        assertTrue(cache.findNodeByName("R").isEmpty());

        source.recover("Q");
        assertEquals(List.of("R"), names(q.neighbors()));
        assertEquals(2, source.calls("Q"));
        assertTrue(cache.findNodeByName("Q").orElseThrow().neighborsCached());
    }

    @Test
    void testUnknownNeighborNamesAreSkipped() {
        Graph strict = new Graph(cache, NodeFactory.DEFAULT, source);
        Node x = strict.addNode("X");
        strict.addNode("Z");

        assertEquals(List.of("Z"), names(x.neighbors()));
        assertTrue(cache.findNodeByName("Y").isEmpty());
        assertTrue(x.areNeighborsCachedInStore());
    }

    @Test
    void testSelfReferenceFromSourceIsIgnored() {
        source.with("S", "S", "T");
        Node s = graph.addNode("S");

        assertEquals(List.of("T"), names(s.neighbors()));
    }

    @Test
    void testFailedCacheWriteLeavesNoNeighborsInMemory() {
        FailingGraphCache failing = new FailingGraphCache(cache).failEdgeUpsert("Z", 1);
        Graph flaky = new OpenGraph(failing, source);
        Node x = flaky.addNode("X");

        assertThrows(GraphCacheException.class, x::neighbors);
        assertFalse(x.areNeighborsCachedInStore());
        assertFalse(cache.findNodeByName("X").orElseThrow().neighborsCached());
        assertTrue(cache.findNodeByName("Y").isEmpty());
        assertEquals(List.of("X"), names(flaky.nodes().nodes()));
        assertEquals(0, flaky.edges().size());

        Node y = flaky.addNode("Y");
        flaky.addNode("W");
        assertTrue(cache.findNodeByName("Y").isPresent());
        assertTrue(flaky.addEdge("Y", "W", 2.0).isPresent());
        assertEquals(2.0, cache.findEdgeByNames("W", "Y").orElseThrow().weight());
        assertTrue(flaky.edges().getEdge(y, flaky.nodes().getNodeByName("W").orElseThrow()).isPresent());

        assertEquals(List.of("Y", "Z"), names(x.neighbors()));
        assertEquals(List.of("Y", "Z"), cache.neighborNamesOf("X"));
        assertEquals(2, source.calls("X"));
    }

    @Test
    void testFailedNameValidationWritesNothing() {
        AtomicInteger failures = new AtomicInteger(1);
        Graph picky = new OpenGraph(cache, source) {
            @Override
            public Optional<String> getAuthenticNodeName(String name) {
                if ("Z".equals(name) && failures.getAndDecrement() > 0) {
                    throw new NeighborSourceException("Lookup failed for " + name);
                }
                return super.getAuthenticNodeName(name);
            }
        };
        Node x = picky.addNode("X");

        assertThrows(NeighborSourceException.class, x::neighbors);
        assertFalse(x.areNeighborsCachedInStore());
        assertTrue(cache.findNodeByName("Y").isEmpty());
        assertEquals(1, picky.nodes().size());

        assertEquals(List.of("Y", "Z"), names(x.neighbors()));
        assertEquals(3, picky.nodes().size());
    }

    @Test
    void testFailedHydrationIsCompletedFromCache() {
        AtomicInteger failures = new AtomicInteger(1);
        graph.addNeighborListener((node, neighbor) -> {
            if (failures.getAndDecrement() > 0) {
                throw new IllegalStateException("listener failed");
            }
        });
        Node x = graph.addNode("X");

        assertThrows(IllegalStateException.class, x::neighbors);
        assertTrue(x.areNeighborsCachedInStore());
        assertFalse(x.areNeighborsLoadedLocally());
        assertEquals(List.of("Y", "Z"), cache.neighborNamesOf("X"));

        assertEquals(List.of("Y", "Z"), names(x.neighbors()));
        assertEquals(1, source.calls("X"));
        List<CachedNode> cached = cache.neighborsOf("X");
        assertEquals("id-Z", cached.get(1).externalId());
    }

    @Test
    void testFreshNeighborsKeepSourceOrder() {
        source.with("M", "Q", "B");
        Node m = graph.addNode("M");

        assertEquals(List.of("Q", "B"), names(m.neighbors()));
        assertEquals(List.of("B", "Q"), cache.neighborNamesOf("M"));
    }

    @Test
    void testConcurrentReadersShareOneFetch() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch inFetch = new CountDownLatch(1);
        NeighborSource slow = node -> {
            calls.incrementAndGet();
            inFetch.countDown();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(NeighborRef.of("B"), NeighborRef.of("C"));
        };
        Graph concurrent = new OpenGraph(cache, slow);
        Node a = concurrent.addNode("A");

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> readers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                readers.add(a::degree);
            }
            for (Future<Integer> degree : pool.invokeAll(readers)) {
                assertEquals(2, degree.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(0, inFetch.getCount());
        assertEquals(1, calls.get());
    }

    @Test
    void testConcurrentNodeCreationKeepsIndicesGapless() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> writers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                writers.add(() -> {
                    for (int i = 0; i < 25; i++) {
                        graph.addNode("n" + (i % 20) + "-" + (thread % 4));
                    }
                    return null;
                });
            }
            for (Future<Void> result : pool.invokeAll(writers)) {
                result.get();
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        List<Node> nodes = graph.nodes().nodes();
        assertEquals(80, nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(i, nodes.get(i).index());
        }
        assertEquals(80, nodes.stream().map(Node::name).distinct().count());
    }
}
