package com.ringcache.api;

import com.ringcache.core.CacheEngine;
import com.ringcache.core.ConsistencyReport;
import com.ringcache.index.EntryMetadata;
import com.ringcache.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;
import java.util.Optional;

/**
 * Yerel motorun yönetim uç noktaları. Buradaki yanıtlar yalnızca bu düğümün
 * diskini yansıtır; istekler sahibine yönlendirilmez.
 */
@Path("/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AdminResource
{
    private final CacheEngine engine;
    private final MetricsRegistry metrics;

    @Inject
    public AdminResource(CacheEngine engine, MetricsRegistry metrics)
    {
        this.engine = engine;
        this.metrics = metrics;
    }

    @GET
    @Path("verify")
    public ConsistencyReport verify()
    {
        return engine.verify();
    }

    @GET
    @Path("metadata/{key}")
    public Response metadata(@PathParam("key") String key)
    {
        Optional<EntryMetadata> metadata = engine.metadata(key);
        if (metadata.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ApiExceptionMappers.ErrorResponse("Key not found", null, null))
                    .build();
        }
        return Response.ok(metadata.get()).build();
    }

    @GET
    @Path("stats")
    public StatsView stats()
    {
        return new StatsView(engine.size(), engine.pendingReclaimCount(), metrics.counterValues());
    }

    public record StatsView(int entries, int pendingReclaims, Map<String, Long> counters) {}
}
