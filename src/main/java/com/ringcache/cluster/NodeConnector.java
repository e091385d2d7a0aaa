package com.ringcache.cluster;

/**
 * Uzak bir üye için istek iletmekte kullanılacak {@link CacheNode} vekilini sağlar.
 */
@FunctionalInterface
public interface NodeConnector
{
    CacheNode connect(NodeInfo node);
}
