package com.dynop.stargen.cli;

import com.dynop.stargen.StargenServerApplication;
import com.dynop.stargen.StargenServerConfiguration;
import com.dynop.stargen.config.StargenSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.core.setup.Bootstrap;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ComputeCommandTest {

    @TempDir
    Path tempDir;

    private final ComputeCommand command = new ComputeCommand();
    private ArgumentParser parser;
    private StargenServerConfiguration configuration;

    @BeforeEach
    void setUp() throws Exception {
        parser = ArgumentParsers.newFor("stargen").build();
        Subparser subparser = parser.addSubparsers().addParser(command.getName());
        command.configure(subparser);

        Path samples = tempDir.resolve("samples.tsv");
        Files.writeString(samples, """
                ID\tLatitude\tLongitude\tAge
                A\t48.1\t11.6\t4200
                B\t52.5\t13.4\t4100
                C\t41.9\t12.5\t1500
                D\t40.4\t-3.7\t1400
                """, StandardCharsets.UTF_8);
        Path matrix = tempDir.resolve("distances.tsv");
        Files.writeString(matrix, """
                \tA\tB\tC\tD
                A\t0\t0.1\t0.3\t0.4
                B\t0.1\t0\t0.2\t0.3
                C\t0.3\t0.2\t0\t0.15
                D\t0.4\t0.3\t0.15\t0
                """, StandardCharsets.UTF_8);

        StargenSettings settings = new StargenSettings();
        settings.setSamplesFile(samples.toString());
        settings.setDistanceMatrixFile(matrix.toString());
        settings.setExecutorPoolSize(2);
        configuration = new StargenServerConfiguration();
        configuration.setStargen(settings);
    }

    @Test
    void writesResultForRequestedParameters() throws Exception {
        Path output = tempDir.resolve("barriers.json");
        Namespace namespace = parser.parseArgs(new String[]{
                "compute", "--bins", "2", "--resolution", "4", "--output", output.toString()});
        Bootstrap<StargenServerConfiguration> bootstrap = new Bootstrap<>(new StargenServerApplication());

        command.run(bootstrap, namespace, configuration);

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertEquals(2, json.at("/parameters/bin_count").asInt());
        assertEquals(4, json.at("/parameters/hex_resolution").asInt());
        assertEquals(2, json.get("bins").size());
        assertEquals(1, json.at("/bins/0/edges").size());
        assertEquals(1, json.at("/bins/1/edges").size());
    }

    @Test
    void outputIsRequired() {
        assertThrows(ArgumentParserException.class,
                () -> parser.parseArgs(new String[]{"compute", "--bins", "2"}));
    }

    @Test
    void omittedOptionsFallBackToConfiguredDefaults() throws Exception {
        Path output = tempDir.resolve("defaults.json");
        Namespace namespace = parser.parseArgs(new String[]{"compute", "--output", output.toString()});

        command.run(new Bootstrap<>(new StargenServerApplication()), namespace, configuration);

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertEquals(14, json.at("/parameters/bin_count").asInt());
        assertEquals(3, json.at("/parameters/hex_resolution").asInt());
        assertEquals(14, json.get("bins").size());
    }
}
