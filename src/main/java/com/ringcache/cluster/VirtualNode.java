package com.ringcache.cluster;

/**
 * Halka üzerindeki tek bir konum. {@code hash} işaretsiz 64 bit olarak yorumlanır.
 */
public record VirtualNode(long hash, String owner)
{
    @Override
    public String toString()
    {
        return Long.toUnsignedString(hash) + "->" + owner;
    }
}
