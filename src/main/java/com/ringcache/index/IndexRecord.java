package com.ringcache.index;

import java.util.Objects;

/**
 * İndeksteki tek bir girdi: anahtarın diskteki kayıt konumu ve meta verisi.
 */
public record IndexRecord(String key, String location, EntryMetadata metadata)
{
    public IndexRecord
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(metadata, "metadata");
    }
}
