package com.ringcache.storage;

import java.io.IOException;

/**
 * Kayıt dosyası mevcut olduğu halde içeriği doğrulanamadığında (sihirli sayı,
 * uzunluk, anahtar ya da CRC uyuşmazlığı) fırlatılır.
 */
public class CorruptRecordException extends IOException
{
    public CorruptRecordException(String message)
    {
        super(message);
    }
}
