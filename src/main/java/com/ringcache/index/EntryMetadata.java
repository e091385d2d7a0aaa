package com.ringcache.index;

/**
 * Bir kaydın oluşturulma ve güncellenme zamanları (UTC epoch milisaniye) ile
 * değer boyutunu taşır.
 */
public record EntryMetadata(long createdAt, long updatedAt, long sizeBytes)
{
    public EntryMetadata
    {
        if (updatedAt < createdAt) {
            throw new IllegalArgumentException("updatedAt must not precede createdAt");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }
}
