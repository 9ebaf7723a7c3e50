package com.raditha.lazygraph;

import java.util.Objects;

/**
 * Undirected, weighted graph edge.
 * <p>
 * An edge is immutable once constructed. Construction registers the edge with both endpoints, so
 * edges should only be created through {@link EdgeList#addEdge(Node, Node, double, boolean)}.
 */
public final class Edge {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final Node source;
    private final Node target;
    private final double weight;

    Edge(Node source, Node target, double weight) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        validateWeight(weight);
        if (source.graph() != target.graph()) {
            throw new IllegalArgumentException("Edge endpoints belong to different graphs: "
                    + source.name() + ", " + target.name());
        }
        if (source.index() == target.index()) {
            throw new IllegalArgumentException("Creating a loop edge is not allowed: " + source.name());
        }
        this.source = source;
        this.target = target;
        this.weight = weight;

        source.addNeighborEdge(this);
        target.addNeighborEdge(this);
    }

    /**
     * Rejects weights that are not finite positive numbers.
     */
    static void validateWeight(double weight) {
        if (!Double.isFinite(weight) || weight <= 0) {
            throw new IllegalArgumentException("Invalid edge weight: " + weight);
        }
    }

    public EdgeKey key() {
        return EdgeKey.of(source.index(), target.index());
    }

    public Node source() {
        return source;
    }

    public Node target() {
        return target;
    }

    public double weight() {
        return weight;
    }

    /**
     * Returns the endpoint opposite to the given one.
     *
     * @throws IllegalArgumentException if the node is not an endpoint of this edge
     */
    public Node other(Node node) {
        if (node == source) {
            return target;
        }
        if (node == target) {
            return source;
        }
        throw new IllegalArgumentException("Node " + node.name() + " is not an endpoint of " + this);
    }

    public boolean touches(Node node) {
        return node == source || node == target;
    }

    @Override
    public String toString() {
        return source.name() + " -- " + target.name() + " (" + weight + ")";
    }
}
