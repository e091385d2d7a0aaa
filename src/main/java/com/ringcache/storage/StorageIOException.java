package com.ringcache.storage;

/**
 * Disk üzerindeki bir yazma veya okuma işleminin başarısız olduğunu bildiren
 * hata tipidir. Çağıran tarafa her zaman iletilir; istemci yazmasının kalıcı
 * olarak kabul edilip edilmediğini bu hata üzerinden öğrenir.
 */
public class StorageIOException extends RuntimeException
{
    public StorageIOException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public StorageIOException(String message)
    {
        super(message);
    }
}
