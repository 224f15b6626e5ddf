package com.dynop.stargen.config;

import com.dynop.stargen.grid.BinningMode;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.dropwizard.jackson.Jackson;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class StargenSettingsTest {

    private final ObjectMapper mapper = Jackson.newObjectMapper(new YAMLFactory());

    @Test
    void builtInDefaultsFormAValidRequest() {
        PipelineRequest defaults = new StargenSettings().getDefaults().toPipelineRequest();

        assertEquals(new PipelineRequest(14, 3, 0.66, 1.5, 0.5, BinningMode.EQUAL_WIDTH, 3, 0), defaults);
    }

    @Test
    void yamlOverridesOnlyConfiguredDefaults() throws IOException {
        StargenSettings settings = mapper.readValue("""
                samples_file: data/samples.tsv
                distance_matrix_file: data/distances.tsv
                executor_pool_size: 6
                defaults:
                  bin_count: 8
                  binning: equal_count
                """, StargenSettings.class);

        assertEquals("data/samples.tsv", settings.getSamplesFile());
        assertEquals("data/distances.tsv", settings.getDistanceMatrixFile());
        assertEquals(6, settings.getExecutorPoolSize());
        PipelineRequest defaults = settings.getDefaults().toPipelineRequest();
        assertEquals(8, defaults.getBinCount());
        assertEquals(BinningMode.EQUAL_COUNT, defaults.getBinningMode());
        assertEquals(3, defaults.getHexResolution());
        assertEquals(0.66, defaults.getLowessBandwidth());
    }

    @Test
    void invalidConfiguredDefaultIsRejected() throws IOException {
        StargenSettings settings = mapper.readValue("""
                defaults:
                  corridor_threshold: 1.2
                """, StargenSettings.class);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> settings.getDefaults().toPipelineRequest());
        assertTrue(ex.getMessage().startsWith("corridor_threshold"));
    }

    @Test
    void nullDefaultsSectionFallsBackToBuiltIns() {
        StargenSettings settings = new StargenSettings();
        settings.setDefaults(null);

        assertEquals(14, settings.getDefaults().toPipelineRequest().getBinCount());
    }
}
