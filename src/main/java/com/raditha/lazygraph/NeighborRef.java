package com.raditha.lazygraph;

import java.util.Objects;

/**
 * Identity of a neighbor as reported by a {@link NeighborSource}.
 *
 * @param name the neighbor's name in the external source
 * @param externalId optional source specific identifier, may be null
 */
public record NeighborRef(String name, String externalId) {

    public NeighborRef {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static NeighborRef of(String name) {
        return new NeighborRef(name, null);
    }
}
