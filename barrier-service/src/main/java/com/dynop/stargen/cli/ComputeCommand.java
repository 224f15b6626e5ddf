package com.dynop.stargen.cli;

import com.dynop.stargen.StargenServerConfiguration;
import com.dynop.stargen.api.BarrierRequest;
import com.dynop.stargen.api.BarrierResponse;
import com.dynop.stargen.config.BarrierBundle;
import com.dynop.stargen.config.StargenSettings;
import com.dynop.stargen.grid.HexIndexer;
import com.dynop.stargen.pipeline.BarrierPipeline;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.dynop.stargen.pipeline.PipelineResult;
import com.dynop.stargen.sample.SampleStore;
import io.dropwizard.core.cli.ConfiguredCommand;
import io.dropwizard.core.setup.Bootstrap;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/**
 * One-shot computation without starting the server.
 * 
 * <pre>
 * java -jar barrier-service.jar compute config.yml --bins 10 --resolution 4 --output barriers.json
 * </pre>
 */
public class ComputeCommand extends ConfiguredCommand<StargenServerConfiguration> {

    private static final Logger LOGGER = Logger.getLogger(ComputeCommand.class.getName());

    public ComputeCommand() {
        super("compute", "computes barriers with the configured samples and writes them as JSON");
    }

    @Override
    public void configure(Subparser subparser) {
        super.configure(subparser);
        subparser.addArgument("--bins")
                .dest("bins")
                .type(Integer.class)
                .help("number of time bins, defaults to stargen.defaults.bin_count");
        subparser.addArgument("--resolution")
                .dest("resolution")
                .type(Integer.class)
                .help("H3 resolution, defaults to stargen.defaults.hex_resolution");
        subparser.addArgument("--output")
                .dest("output")
                .required(true)
                .help("file the JSON result is written to");
    }

    @Override
    protected void run(Bootstrap<StargenServerConfiguration> bootstrap, Namespace namespace,
                       StargenServerConfiguration configuration) throws Exception {
        StargenSettings settings = configuration.getStargen();
        PipelineRequest request = new BarrierRequest(namespace.getInt("bins"), namespace.getInt("resolution"))
                .toPipelineRequest(settings.getDefaults().toPipelineRequest());
        SampleStore store = BarrierBundle.loadSampleStore(settings);

        ExecutorService executorService = BarrierBundle.createExecutor(BarrierBundle.resolvePoolSize(settings));
        try {
            BarrierPipeline pipeline = new BarrierPipeline(store, new HexIndexer(BarrierBundle.createH3()), executorService);
            PipelineResult result = pipeline.run(request);
            BarrierResponse response = BarrierResponse.from(result, store);

            Path output = Path.of(namespace.getString("output"));
            bootstrap.getObjectMapper().writerWithDefaultPrettyPrinter().writeValue(output.toFile(), response);
            LOGGER.info(() -> String.format("Wrote %d bins with %d edges to %s", response.getBins().size(),
                    response.edgeCount(), output));
        } finally {
            executorService.shutdownNow();
        }
    }
}
