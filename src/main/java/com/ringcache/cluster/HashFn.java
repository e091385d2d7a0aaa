package com.ringcache.cluster;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Anahtar ve sanal düğüm baytlarını halka üzerindeki işaretsiz 64 bitlik bir
 * konuma dönüştüren hash sözleşmesidir.
 */
@FunctionalInterface
public interface HashFn
{
    long hash(byte[] bytes);

    /**
     * MD5 özetinin ilk 8 baytını big-endian olarak kullanır. Süreçler ve
     * yeniden başlatmalar arasında kararlıdır.
     */
    static HashFn md5()
    {
        return bytes -> {
            try {
                byte[] digest = MessageDigest.getInstance("MD5").digest(bytes);
                return ByteBuffer.wrap(digest, 0, 8).getLong();
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("MD5 not available", e);
            }
        };
    }
}
