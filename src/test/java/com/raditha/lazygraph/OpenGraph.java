package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.GraphCache;

import java.util.Optional;

/**
 * Graph that accepts every non-blank name as authentic.
 */
class OpenGraph extends Graph {

    OpenGraph(GraphCache cache, NeighborSource neighborSource) {
        super(cache, NodeFactory.DEFAULT, neighborSource);
    }

    @Override
    public Optional<String> getAuthenticNodeName(String name) {
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name.trim());
    }
}
