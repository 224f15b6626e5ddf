package com.dynop.stargen.config;

import com.codahale.metrics.MetricRegistry;
import com.dynop.stargen.api.BarrierResource;
import com.dynop.stargen.sample.SampleStore;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.jersey.setup.JerseyEnvironment;
import io.dropwizard.lifecycle.Managed;
import io.dropwizard.lifecycle.setup.LifecycleEnvironment;
import org.glassfish.hk2.utilities.binding.AbstractBinder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BarrierBundleTest {

    @TempDir
    Path tempDir;

    private StargenSettings settingsWithFiles() throws IOException {
        Path samples = tempDir.resolve("samples.tsv");
        Files.writeString(samples, """
                ID\tLatitude\tLongitude\tAge
                A\t48.1\t11.6\t4200
                B\t52.5\t13.4\t3100
                C\t41.9\t12.5\t2500
                """, StandardCharsets.UTF_8);
        Path matrix = tempDir.resolve("distances.tsv");
        Files.writeString(matrix, """
                \tA\tB\tC
                A\t0\t0.2\t0.3
                B\t0.2\t0\t0.25
                C\t0.3\t0.25\t0
                """, StandardCharsets.UTF_8);

        StargenSettings settings = new StargenSettings();
        settings.setSamplesFile(samples.toString());
        settings.setDistanceMatrixFile(matrix.toString());
        settings.setExecutorPoolSize(2);
        return settings;
    }

    @Test
    void loadsConfiguredSampleArtifacts() throws IOException {
        SampleStore store = BarrierBundle.loadSampleStore(settingsWithFiles());

        assertEquals(3, store.size());
        assertEquals(0.25, store.distance(1, 2));
        assertEquals(2500, store.minAge());
    }

    @Test
    void missingPathsFailStartup() {
        StargenSettings settings = new StargenSettings();
        settings.setSamplesFile("samples.tsv");

        assertThrows(IllegalStateException.class, () -> BarrierBundle.loadSampleStore(settings));
    }

    @Test
    void unreadableFilesFailStartup() {
        StargenSettings settings = new StargenSettings();
        settings.setSamplesFile(tempDir.resolve("absent.tsv").toString());
        settings.setDistanceMatrixFile(tempDir.resolve("absent-matrix.tsv").toString());

        assertThrows(UncheckedIOException.class, () -> BarrierBundle.loadSampleStore(settings));
    }

    @Test
    void poolSizeFallsBackToProcessorCount() {
        StargenSettings settings = new StargenSettings();
        assertEquals(Runtime.getRuntime().availableProcessors(), BarrierBundle.resolvePoolSize(settings));

        settings.setExecutorPoolSize(3);
        assertEquals(3, BarrierBundle.resolvePoolSize(settings));
    }

    @Test
    void workerThreadsAreNamedDaemons() throws Exception {
        ExecutorService executor = BarrierBundle.createExecutor(1);
        try {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

            assertEquals("barrier-worker-1", worker.getName());
            assertTrue(worker.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void managedExecutorShutsDownPoolOnStop() throws Exception {
        ExecutorService executor = BarrierBundle.createExecutor(2);
        BarrierBundle.ManagedExecutor managed = new BarrierBundle.ManagedExecutor(executor, 2);

        managed.start();
        managed.stop();

        assertTrue(executor.isShutdown());
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void runRegistersResourceBindingsAndManagedPool() throws Exception {
        StargenSettings settings = settingsWithFiles();
        Environment environment = mock(Environment.class);
        JerseyEnvironment jersey = mock(JerseyEnvironment.class);
        LifecycleEnvironment lifecycle = mock(LifecycleEnvironment.class);
        when(environment.jersey()).thenReturn(jersey);
        when(environment.lifecycle()).thenReturn(lifecycle);
        when(environment.metrics()).thenReturn(new MetricRegistry());

        new BarrierBundle().run(() -> settings, environment);

        verify(jersey).register(any(AbstractBinder.class));
        verify(jersey).register(BarrierResource.class);
        ArgumentCaptor<Managed> managed = ArgumentCaptor.forClass(Managed.class);
        verify(lifecycle).manage(managed.capture());
        managed.getValue().stop();
    }
}
