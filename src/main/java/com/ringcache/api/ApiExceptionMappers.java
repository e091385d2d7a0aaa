package com.ringcache.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ringcache.cluster.MisroutedException;
import com.ringcache.cluster.RemoteRequestException;
import com.ringcache.cluster.RemoteTimeoutException;
import com.ringcache.storage.StorageIOException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Uygulama istisnalarını HTTP durum kodlarına çevirir. Gövde her zaman JSON
 * bir {@link ErrorResponse} nesnesidir.
 */
public class ApiExceptionMappers
{
    private static final Logger LOG = Logger.getLogger(ApiExceptionMappers.class);

    @ServerExceptionMapper
    public Response storageFailure(StorageIOException e)
    {
        LOG.warn("Storage failure while serving request", e);
        return error(Response.Status.INTERNAL_SERVER_ERROR, new ErrorResponse(e.getMessage(), null, null));
    }

    @ServerExceptionMapper
    public Response remoteTimeout(RemoteTimeoutException e)
    {
        LOG.warnf("Owner %s did not answer in time: %s", e.nodeId(), e.getMessage());
        return error(Response.Status.GATEWAY_TIMEOUT, new ErrorResponse(e.getMessage(), e.nodeId(), null));
    }

    @ServerExceptionMapper
    public Response remoteFailure(RemoteRequestException e)
    {
        LOG.warnf("Forwarding to %s failed: %s", e.nodeId(), e.getMessage());
        return error(Response.Status.BAD_GATEWAY, new ErrorResponse(e.getMessage(), e.nodeId(), null));
    }

    @ServerExceptionMapper
    public Response misrouted(MisroutedException e)
    {
        LOG.infof("Request for key %s was rejected; owner reports %s", e.key(), e.reportedOwnerId());
        return error(Response.Status.SERVICE_UNAVAILABLE,
                new ErrorResponse(e.getMessage(), e.reportedOwnerId(), e.reportedOwnerApi()));
    }

    @ServerExceptionMapper
    public Response invalidRequest(IllegalArgumentException e)
    {
        return error(Response.Status.BAD_REQUEST, new ErrorResponse(e.getMessage(), null, null));
    }

    private static Response error(Response.Status status, ErrorResponse body)
    {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String message, String ownerId, String ownerApiAddress) {}
}
