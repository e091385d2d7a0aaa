package com.ringcache.cluster;

import java.util.Optional;

/**
 * Bir anahtarın sahibine uygulanabilecek önbellek işlemleri. Yerel düğüm
 * motoru doğrudan çağırır; uzak düğüm aynı işlemleri küme portu üzerinden
 * iletir.
 */
public interface CacheNode
{
    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    boolean delete(String key);

    String id();
}
