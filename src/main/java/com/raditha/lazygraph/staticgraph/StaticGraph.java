package com.raditha.lazygraph.staticgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, fully known undirected graph.
 * <p>
 * Vertices are identified by their position and may carry a name and an external ID. Unnamed
 * vertices are known by their index as a string. Instances are created with {@link #builder()}.
 */
public final class StaticGraph {

    /**
     * A vertex of a static graph.
     *
     * @param index the vertex position
     * @param name the vertex name, may be null
     * @param externalId the vertex external ID, may be null
     */
    public record Vertex(int index, String name, String externalId) {

        /**
         * The name of the vertex, or its index for unnamed vertices.
         */
        public String displayName() {
            return name != null ? name : String.valueOf(index);
        }
    }

    private final List<Vertex> vertices;
    private final List<Set<Integer>> adjacency;
    private final Map<String, Vertex> verticesByName;

    private StaticGraph(List<Vertex> vertices, List<Set<Integer>> adjacency) {
        this.vertices = List.copyOf(vertices);
        List<Set<Integer>> copy = new ArrayList<>();
        for (Set<Integer> neighbors : adjacency) {
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(neighbors)));
        }
        this.adjacency = Collections.unmodifiableList(copy);
        Map<String, Vertex> byName = new HashMap<>();
        for (Vertex vertex : this.vertices) {
            if (vertex.name() != null) {
                byName.putIfAbsent(vertex.name(), vertex);
            }
        }
        this.verticesByName = Collections.unmodifiableMap(byName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int vertexCount() {
        return vertices.size();
    }

    public List<Vertex> vertices() {
        return vertices;
    }

    public Optional<Vertex> vertex(int index) {
        return index >= 0 && index < vertices.size() ? Optional.of(vertices.get(index)) : Optional.empty();
    }

    /**
     * Returns the first vertex with the given exact name.
     */
    public Optional<Vertex> findByName(String name) {
        return Optional.ofNullable(verticesByName.get(name));
    }

    /**
     * Find the vertex denoted by the given name: a vertex with that exact name, or failing that the
     * vertex whose index the name spells.
     */
    public Optional<Vertex> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Optional<Vertex> named = findByName(name);
        if (named.isPresent()) {
            return named;
        }
        try {
            return vertex(Integer.parseInt(name.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * The vertices adjacent to the vertex with the given index, in the order the edges were added.
     *
     * @throws IndexOutOfBoundsException if there is no such vertex
     */
    public List<Vertex> neighbors(int index) {
        List<Vertex> result = new ArrayList<>();
        for (int neighbor : adjacency.get(index)) {
            result.add(vertices.get(neighbor));
        }
        return result;
    }

    public static final class Builder {
        private final List<Vertex> vertices = new ArrayList<>();
        private final List<Set<Integer>> adjacency = new ArrayList<>();

        private Builder() {
        }

        /**
         * Add an unnamed vertex.
         */
        public Builder addVertex() {
            return addVertex(null, null);
        }

        public Builder addVertex(String name) {
            return addVertex(name, null);
        }

        public Builder addVertex(String name, String externalId) {
            vertices.add(new Vertex(vertices.size(), name, externalId));
            adjacency.add(new LinkedHashSet<>());
            return this;
        }

        /**
         * Connect two existing vertices. Loops and repeated edges are ignored.
         *
         * @throws IllegalArgumentException if either index does not denote a vertex
         */
        public Builder addEdge(int a, int b) {
            if (a < 0 || a >= vertices.size() || b < 0 || b >= vertices.size()) {
                throw new IllegalArgumentException("Invalid edge " + a + " -- " + b
                        + " for " + vertices.size() + " vertices");
            }
            if (a != b) {
                adjacency.get(a).add(b);
                adjacency.get(b).add(a);
            }
            return this;
        }

        public StaticGraph build() {
            return new StaticGraph(vertices, adjacency);
        }
    }
}
