package com.dynop.stargen.api;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.stargen.grid.HexIndexer;
import com.dynop.stargen.pipeline.BarrierComputationService;
import com.dynop.stargen.pipeline.ComputationSupersededException;
import com.dynop.stargen.pipeline.PipelineRequest;
import com.dynop.stargen.pipeline.PipelineResult;
import com.dynop.stargen.sample.InputInconsistencyException;
import com.dynop.stargen.sample.SampleStore;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JAX-RS resource computing genetic barriers and corridors for the rendering layer.
 */
@Path("/stargen")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BarrierResource {

    private static final Logger LOGGER = Logger.getLogger(BarrierResource.class.getName());

    private final BarrierComputationService computationService;
    private final SampleStore store;
    private final HexIndexer indexer;
    private final PipelineRequest defaults;
    private final Timer requestLatency;
    private final Meter edgesClassified;

    @Inject
    public BarrierResource(BarrierComputationService computationService,
                           SampleStore store,
                           HexIndexer indexer,
                           @Named(BarrierResourceBindings.DEFAULTS_BINDING) PipelineRequest defaults,
                           MetricRegistry metrics) {
        this.computationService = Objects.requireNonNull(computationService, "computationService");
        this.store = Objects.requireNonNull(store, "store");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        Objects.requireNonNull(metrics, "metrics");
        this.requestLatency = metrics.timer("barriers.requests.latency");
        this.edgesClassified = metrics.meter("barriers.edges.classified");
    }

    /**
     * Simple holder for binding names shared with HK2.
     */
    public static final class BarrierResourceBindings {
        public static final String DEFAULTS_BINDING = "barrier-defaults";

        private BarrierResourceBindings() {
        }
    }

    /**
     * Compute barriers for the given parameters and publish the result as the current one.
     * An absent body uses the configured defaults.
     */
    @POST
    @Path("/barriers")
    public Response compute(BarrierRequest request) {
        PipelineRequest pipelineRequest;
        try {
            pipelineRequest = request == null ? defaults : request.toPipelineRequest(defaults);
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }

        Timer.Context timerContext = requestLatency.time();
        try {
            PipelineResult result = computationService.compute(pipelineRequest);
            BarrierResponse response = BarrierResponse.from(result, store);
            edgesClassified.mark(response.edgeCount());
            return Response.ok(response).build();
        } catch (InputInconsistencyException e) {
            LOGGER.log(Level.WARNING, "Barrier computation rejected inconsistent input: " + e.getMessage());
            throw new WebApplicationException(inconsistencyResponse(e));
        } catch (ComputationSupersededException e) {
            throw new WebApplicationException(errorResponse(Response.Status.CONFLICT, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebApplicationException(errorResponse(Response.Status.INTERNAL_SERVER_ERROR, "Barrier computation interrupted"));
        } catch (IllegalStateException e) {
            throw new WebApplicationException(errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                    "Barrier computation failed: " + e.getMessage()));
        } finally {
            timerContext.stop();
        }
    }

    @GET
    @Path("/barriers/current")
    public Response current() {
        Optional<PipelineResult> current = computationService.current();
        if (current.isEmpty()) {
            throw new WebApplicationException(errorResponse(Response.Status.NOT_FOUND, "No barrier result has been computed yet"));
        }
        return Response.ok(BarrierResponse.from(current.get(), store)).build();
    }

    @GET
    @Path("/resolutions")
    public List<ResolutionInfo> resolutions() {
        List<ResolutionInfo> table = new ArrayList<>(HexIndexer.MAX_RESOLUTION - HexIndexer.MIN_RESOLUTION + 1);
        for (int r = HexIndexer.MIN_RESOLUTION; r <= HexIndexer.MAX_RESOLUTION; r++) {
            table.add(ResolutionInfo.from(indexer.describe(r)));
        }
        return table;
    }

    private static Response inconsistencyResponse(InputInconsistencyException e) {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("message", e.getMessage());
        entity.put("errorCode", e.getErrorCode());
        entity.put("indices", e.getIndices());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(entity)
                .build();
    }

    private static Response errorResponse(Response.Status status, String message) {
        return Response.status(status)
                .entity(Collections.singletonMap("message", message))
                .build();
    }

    private WebApplicationException badRequest(String message) {
        return new WebApplicationException(errorResponse(Response.Status.BAD_REQUEST, message));
    }
}
