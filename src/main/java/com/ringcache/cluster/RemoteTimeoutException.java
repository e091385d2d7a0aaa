package com.ringcache.cluster;

/**
 * Uzak isteğin ayrılan süre içinde yanıtlanmadığını bildirir.
 */
public class RemoteTimeoutException extends RemoteRequestException
{
    public RemoteTimeoutException(String nodeId, String message, Throwable cause)
    {
        super(nodeId, message, cause);
    }
}
