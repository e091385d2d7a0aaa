package com.ringcache.api;

import com.ringcache.cluster.RequestCoordinator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * İstemcilerin önbelleği HTTP üzerinden okuması ve güncellemesi için REST
 * kaynağı. İstekler {@link RequestCoordinator} üzerinden anahtarın sahibine
 * gider; sahip başka bir düğümse yanıt oradan aktarılır.
 */
@Path("/")
@ApplicationScoped
public class CacheResource
{
    private final RequestCoordinator coordinator;

    @Inject
    public CacheResource(RequestCoordinator coordinator)
    {
        this.coordinator = coordinator;
    }

    @GET
    @Path("get/{key}")
    @Produces(MediaType.TEXT_PLAIN)
    public Response get(@PathParam("key") String key)
    {
        Optional<byte[]> value = coordinator.get(key);
        if (value.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .type(MediaType.TEXT_PLAIN)
                    .entity("Key not found")
                    .build();
        }
        return Response.ok(value.get(), MediaType.TEXT_PLAIN).build();
    }

    @POST
    @Path("set/{key}/{value}")
    public Response setFromPath(@PathParam("key") String key, @PathParam("value") String value)
    {
        coordinator.set(key, value.getBytes(StandardCharsets.UTF_8));
        return Response.ok().build();
    }

    @POST
    @Path("set/{key}")
    @Consumes(MediaType.WILDCARD)
    public Response setFromBody(@PathParam("key") String key, byte[] body)
    {
        coordinator.set(key, body != null ? body : new byte[0]);
        return Response.ok().build();
    }

    @DELETE
    @Path("delete/{key}")
    public Response delete(@PathParam("key") String key)
    {
        if (!coordinator.delete(key)) {
            return Response.status(Response.Status.NOT_FOUND)
                    .type(MediaType.TEXT_PLAIN)
                    .entity("Key not found")
                    .build();
        }
        return Response.noContent().build();
    }
}
