package com.dynop.stargen.config;

import com.codahale.metrics.MetricRegistry;
import com.dynop.stargen.api.BarrierResource;
import com.dynop.stargen.api.BarrierResource.BarrierResourceBindings;
import com.dynop.stargen.grid.HexIndexer;
import com.dynop.stargen.pipeline.BarrierComputationService;
import com.dynop.stargen.pipeline.BarrierPipeline;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.dynop.stargen.sample.SampleStore;
import com.uber.h3core.H3Core;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import org.glassfish.hk2.utilities.binding.AbstractBinder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Dropwizard bundle that loads the sample artifacts and wires the barrier pipeline and its resource.
 * 
 * <p>This bundle:
 * <ul>
 *   <li>Loads the sample table and distance matrix once; they stay read-only afterwards</li>
 *   <li>Creates and manages the per-bin worker pool</li>
 *   <li>Registers the pipeline components with HK2 for injection into {@link BarrierResource}</li>
 * </ul>
 */
public class BarrierBundle implements ConfiguredBundle<StargenBundleConfiguration> {

    private static final Logger LOGGER = Logger.getLogger(BarrierBundle.class.getName());

    @Override
    public void initialize(Bootstrap<?> bootstrap) {
        // no-op
    }

    @Override
    public void run(StargenBundleConfiguration configuration, Environment environment) {
        StargenSettings settings = configuration.getStargen();
        PipelineRequest defaults = settings.getDefaults().toPipelineRequest();
        SampleStore store = loadSampleStore(settings);
        HexIndexer indexer = new HexIndexer(createH3());

        int poolSize = resolvePoolSize(settings);
        ExecutorService executorService = createExecutor(poolSize);
        environment.lifecycle().manage(new ManagedExecutor(executorService, poolSize));
        MetricRegistry metrics = environment.metrics();

        BarrierComputationService computationService =
                new BarrierComputationService(new BarrierPipeline(store, indexer, executorService));

        environment.jersey().register(new AbstractBinder() {
            @Override
            protected void configure() {
                bind(computationService).to(BarrierComputationService.class);
                bind(store).to(SampleStore.class);
                bind(indexer).to(HexIndexer.class);
                bind(defaults)
                        .to(PipelineRequest.class)
                        .named(BarrierResourceBindings.DEFAULTS_BINDING);
                bind(metrics).to(MetricRegistry.class);
            }
        });

        environment.jersey().register(BarrierResource.class);

        LOGGER.info(() -> String.format("BarrierBundle initialized: samples=%d, poolSize=%d, defaults=%s",
                store.size(), poolSize, defaults));
    }

    public static SampleStore loadSampleStore(StargenSettings settings) {
        if (settings.getSamplesFile() == null || settings.getDistanceMatrixFile() == null) {
            throw new IllegalStateException("stargen.samples_file and stargen.distance_matrix_file must be configured");
        }
        Path samples = Path.of(settings.getSamplesFile());
        Path matrix = Path.of(settings.getDistanceMatrixFile());
        try {
            return SampleStore.load(samples, matrix);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load samples from " + samples + " and " + matrix, e);
        }
    }

    public static H3Core createH3() {
        try {
            return H3Core.newInstance();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load the H3 native library", e);
        }
    }

    public static int resolvePoolSize(StargenSettings settings) {
        int poolSize = settings.getExecutorPoolSize();
        return poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
    }

    public static ExecutorService createExecutor(int poolSize) {
        AtomicInteger threadCounter = new AtomicInteger(1);
        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread thread = new Thread(r, "barrier-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    static final class ManagedExecutor implements Managed {
        private final ExecutorService delegate;
        private final int poolSize;

        ManagedExecutor(ExecutorService delegate, int poolSize) {
            this.delegate = delegate;
            this.poolSize = poolSize;
        }

        @Override
        public void start() {
            LOGGER.info(() -> "Barrier executor started with " + poolSize + " workers");
        }

        @Override
        public void stop() {
            delegate.shutdown();
            try {
                if (!delegate.awaitTermination(30, TimeUnit.SECONDS)) {
                    delegate.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                delegate.shutdownNow();
            }
            LOGGER.info("Barrier executor stopped");
        }
    }
}
