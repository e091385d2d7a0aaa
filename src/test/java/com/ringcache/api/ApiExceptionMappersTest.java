package com.ringcache.api;

import com.ringcache.cluster.MisroutedException;
import com.ringcache.cluster.RemoteRequestException;
import com.ringcache.cluster.RemoteTimeoutException;
import com.ringcache.storage.StorageIOException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;

@QuarkusTest
class ApiExceptionMappersTest
{
    private final ApiExceptionMappers mappers = new ApiExceptionMappers();

    // Bu test depolama hatasının 500'e çevrildiğini doğrular.
    @Test
    void storageFailureMapsTo500()
    {
        Response response = mappers.storageFailure(new StorageIOException("disk full", new IOException("ENOSPC")));
        assertEquals(500, response.getStatus());
    }

    // Bu test uzak zaman aşımının 504, diğer uzak hataların 502 olduğunu gösterir.
    @Test
    void remoteFailuresMapToGatewayErrors()
    {
        assertEquals(504, mappers.remoteTimeout(new RemoteTimeoutException("n2", "timed out", null)).getStatus());
        assertEquals(502, mappers.remoteFailure(new RemoteRequestException("n2", "refused")).getStatus());
    }

    // Bu test sahiplik reddinin 503 ve sahip bilgisiyle döndüğünü doğrular.
    @Test
    void misroutedMapsTo503WithOwner()
    {
        Response response = mappers.misrouted(new MisroutedException("k", "n3", "10.0.0.3:3031"));
        assertEquals(503, response.getStatus());
        ApiExceptionMappers.ErrorResponse body = (ApiExceptionMappers.ErrorResponse) response.getEntity();
        assertEquals("n3", body.ownerId());
        assertEquals("10.0.0.3:3031", body.ownerApiAddress());
    }

    // Bu test geçersiz girdinin 400'e çevrildiğini gösterir.
    @Test
    void invalidInputMapsTo400()
    {
        assertEquals(400, mappers.invalidRequest(new IllegalArgumentException("key must not be empty")).getStatus());
    }
}
