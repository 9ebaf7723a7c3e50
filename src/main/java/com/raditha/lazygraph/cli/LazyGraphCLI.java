package com.raditha.lazygraph.cli;

import com.raditha.lazygraph.Graph;
import com.raditha.lazygraph.Node;
import com.raditha.lazygraph.config.GraphSettings;
import com.raditha.lazygraph.spotify.SpotifyArtistGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command line explorer for the Spotify artist graph.
 * <p>
 * Usage:
 * java com.raditha.lazygraph.cli.LazyGraphCLI [--config=&lt;path-to-graph.yml&gt;] &lt;artist&gt;...
 * <p>
 * Each artist name is resolved through Spotify and printed with its Spotify ID and its related
 * artists. Results are kept in the configured cache, so repeated runs do not hit Spotify again.
 */
@SuppressWarnings("java:S106")
public class LazyGraphCLI {

    private static final Logger logger = LoggerFactory.getLogger(LazyGraphCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String DEFAULT_CONFIG_PATH = "src/main/resources/graph.yml";
    private static final String CONFIG_OPTION = "--config=";

    public static void main(String[] args) {
        System.exit(new LazyGraphCLI().run(args, System.out));
    }

    int run(String[] args, PrintStream out) {
        CliOptions options;
        try {
            options = parseArgs(args);
            GraphSettings.loadConfigMap(new File(options.configPath()));
        } catch (IllegalArgumentException | IOException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            out.println("Usage: LazyGraphCLI [--config=<path-to-graph.yml>] <artist>...");
            return EXIT_USAGE;
        }

        try (SpotifyArtistGraph graph = SpotifyArtistGraph.fromSettings()) {
            printArtists(graph, options.artists(), out);
            return EXIT_OK;
        } catch (RuntimeException e) {
            logger.error("Exploring the artist graph failed", e);
            return EXIT_FAILURE;
        }
    }

    static CliOptions parseArgs(String[] args) throws IOException {
        List<String> artists = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .filter(arg -> !arg.isBlank())
                .toList();
        if (artists.isEmpty()) {
            throw new IllegalArgumentException("At least one artist name is required");
        }

        String configPath = findOptionValue(args, CONFIG_OPTION).orElse(DEFAULT_CONFIG_PATH);
        if (!new File(configPath).exists()) {
            throw new IOException("Configuration file not found: " + configPath);
        }
        return new CliOptions(configPath, artists);
    }

    private static Optional<String> findOptionValue(String[] args, String prefix) {
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .filter(value -> !value.isBlank())
                .findFirst();
    }

    /**
     * Print each artist that the graph can resolve, followed by its neighbors.
     *
     * @return the number of names that could not be resolved
     */
    static int printArtists(Graph graph, List<String> names, PrintStream out) {
        int unresolved = 0;
        for (String name : names) {
            Optional<Node> node = graph.nodes().getNodeByName(name, true, null);
            if (node.isEmpty()) {
                out.println(name + ": not found");
                unresolved++;
                continue;
            }
            Node artist = node.get();
            out.println(artist.name() + " [" + artist.externalId().orElse("-") + "]");
            for (Node neighbor : artist.neighbors()) {
                out.println("  " + neighbor.name() + " [" + neighbor.externalId().orElse("-") + "]");
            }
        }
        return unresolved;
    }

    record CliOptions(String configPath, List<String> artists) {
    }
}
