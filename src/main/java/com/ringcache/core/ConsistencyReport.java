package com.ringcache.core;

import java.util.List;

/**
 * Doğrulama geçişinin sonucu. İndekste olup diskte okunamayan kayıtlar
 * {@code missingBacking}, diskte olup hiçbir indeks girdisinin göstermediği
 * kayıtlar {@code orphans} olarak sayılır. Rapor yalnızca durum bildirir,
 * hiçbir şeyi onarmaz.
 */
public record ConsistencyReport(
        int indexedEntries,
        int missingBacking,
        int orphans,
        List<String> missingKeys,
        List<String> orphanLocations)
{
    public ConsistencyReport
    {
        missingKeys = List.copyOf(missingKeys);
        orphanLocations = List.copyOf(orphanLocations);
    }

    public boolean consistent()
    {
        return missingBacking == 0 && orphans == 0;
    }
}
