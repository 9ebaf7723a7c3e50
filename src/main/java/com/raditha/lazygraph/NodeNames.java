package com.raditha.lazygraph;

/**
 * Name normalization shared by the registries.
 */
final class NodeNames {

    private NodeNames() {
        // Utility class
    }

    /**
     * @return the trimmed name
     * @throws IllegalArgumentException if the name is null or blank
     */
    static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Node name must not be null");
        }
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Node name must not be empty");
        }
        return trimmed;
    }

    /**
     * @return the trimmed external ID, or null when none or a blank one was given
     */
    static String normalizeExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return null;
        }
        return externalId.trim();
    }
}
