package com.raditha.lazygraph.cli;

import com.raditha.lazygraph.config.GraphSettings;
import com.raditha.lazygraph.staticgraph.StaticGraph;
import com.raditha.lazygraph.staticgraph.StaticGraphWrapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(SystemStubsExtension.class)
class LazyGraphCLITest {

    @SystemStub
    private EnvironmentVariables environmentVariables;

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        GraphSettings.reset();
    }

    private Path writeConfig(String yaml) throws IOException {
        Path config = dir.resolve("graph.yml");
        Files.writeString(config, yaml);
        return config;
    }

    @Test
    void testParseArgs() throws IOException {
        Path config = writeConfig("cache: {}\n");

        LazyGraphCLI.CliOptions options = LazyGraphCLI.parseArgs(
                new String[] {"--config=" + config, "Daft Punk", "Air"});

        assertEquals(config.toString(), options.configPath());
        assertEquals(List.of("Daft Punk", "Air"), options.artists());
    }

    @Test
    void testParseArgsRequiresArtist() throws IOException {
        Path config = writeConfig("cache: {}\n");

        assertThrows(IllegalArgumentException.class,
                () -> LazyGraphCLI.parseArgs(new String[] {"--config=" + config}));
    }

    @Test
    void testParseArgsRequiresExistingConfig() {
        assertThrows(IOException.class,
                () -> LazyGraphCLI.parseArgs(new String[] {"--config=" + dir.resolve("missing.yml"), "Air"}));
    }

    @Test
    void testUsageErrorExitCode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int code = new LazyGraphCLI().run(new String[0], new PrintStream(out, true, StandardCharsets.UTF_8));

        assertEquals(LazyGraphCLI.EXIT_USAGE, code);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void testMissingCredentialsExitCode() throws IOException {
        environmentVariables.remove("SPOTIFY_CLIENT_ID");
        environmentVariables.remove("SPOTIFY_CLIENT_SECRET");
        Path config = writeConfig("""
                cache:
                  jdbc:
                    url: jdbc:h2:mem:cli-test
                spotify:
                  neighbor_count: 3
                """);

        int code = new LazyGraphCLI().run(new String[] {"--config=" + config, "Air"}, System.out);

        assertEquals(LazyGraphCLI.EXIT_FAILURE, code);
    }

    @Test
    void testPrintArtists() {
        StaticGraph graph = StaticGraph.builder()
                .addVertex("Air", "a")
                .addVertex("Justice", "j")
                .addVertex("Cassius")
                .addEdge(0, 1)
                .addEdge(0, 2)
                .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        try (StaticGraphWrapper wrapper = new StaticGraphWrapper(graph)) {
            int unresolved = LazyGraphCLI.printArtists(wrapper, List.of("Air", "Nobody"),
                    new PrintStream(out, true, StandardCharsets.UTF_8));

            assertEquals(1, unresolved);
        }

        List<String> lines = out.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(List.of("Air [a]", "  Justice [j]", "  Cassius [-]", "Nobody: not found"), lines);
    }
}
