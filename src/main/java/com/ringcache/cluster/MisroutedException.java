package com.ringcache.cluster;

/**
 * İsteğin iletildiği düğüm anahtarın sahibi olmadığını bildirdiğinde
 * fırlatılır. İki düğümün halka görünümleri henüz yakınsamamıştır; istek
 * başka bir düğüme aktarılmaz ve yerelde de cevaplanmaz.
 */
public class MisroutedException extends RuntimeException
{
    private final String key;
    private final String reportedOwnerId;
    private final String reportedOwnerApi;

    public MisroutedException(String key, String reportedOwnerId, String reportedOwnerApi)
    {
        super("Key " + key + " is owned by " + reportedOwnerId + " according to the receiving node");
        this.key = key;
        this.reportedOwnerId = reportedOwnerId;
        this.reportedOwnerApi = reportedOwnerApi;
    }

    public String key()
    {
        return key;
    }

    public String reportedOwnerId()
    {
        return reportedOwnerId;
    }

    /** Sahibin {@code host:apiPort} adresi. */
    public String reportedOwnerApi()
    {
        return reportedOwnerApi;
    }
}
