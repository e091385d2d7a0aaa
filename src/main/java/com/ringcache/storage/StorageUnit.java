package com.ringcache.storage;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Tek bir anahtar-değer kaydını diske yazan, okuyan ve silen kalıcılık birimidir.
 * Her yazma yeni bir konum üretir; var olan bir konum asla yerinde
 * değiştirilmez. Böylece önbellek motoru eski kaydı yenisi indekse
 * yerleştirildikten sonra geri kazanabilir.
 */
public interface StorageUnit
{
    /**
     * Kaydı tamamen yazıp diske zorladıktan sonra yeni konumunu döndürür.
     */
    String write(String key, byte[] value);

    /**
     * Konumdaki kaydı okur. Dosya yoksa {@link java.nio.file.NoSuchFileException},
     * içerik bozuksa {@link CorruptRecordException} fırlatılır.
     */
    byte[] read(String location, String expectedKey) throws IOException;

    boolean delete(String location);

    List<String> list();

    /**
     * Verilen konumların hiçbiri sonraki yazmalarda yeniden üretilmez. Diskte
     * artık bulunmayan ama indeksin hâlâ gösterdiği konumlar için kullanılır.
     */
    void reserve(Collection<String> locations);
}
