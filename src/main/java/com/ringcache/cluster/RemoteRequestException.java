package com.ringcache.cluster;

/**
 * Uzak bir üyeye gönderilen yoklama ya da yönlendirilmiş isteğin ağ veya
 * uzak taraf hatası nedeniyle tamamlanamadığını bildirir.
 */
public class RemoteRequestException extends RuntimeException
{
    private final String nodeId;

    public RemoteRequestException(String nodeId, String message, Throwable cause)
    {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public RemoteRequestException(String nodeId, String message)
    {
        super(message);
        this.nodeId = nodeId;
    }

    public String nodeId()
    {
        return nodeId;
    }
}
