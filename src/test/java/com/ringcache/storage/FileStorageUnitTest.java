package com.ringcache.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileStorageUnitTest
{
    @TempDir
    Path dir;

    private FileStorageUnit storage;

    @BeforeEach
    void setup()
    {
        storage = FileStorageUnit.open(dir, false);
    }

    private static byte[] utf8(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    class WriteAndRead
    {
        // Bu test yazılan kaydın aynı anahtarla geri okunabildiğini doğrular.
        @Test
        void written_record_reads_back() throws IOException
        {
            String location = storage.write("alpha", utf8("one"));
            assertArrayEquals(utf8("one"), storage.read(location, "alpha"));
            assertTrue(Files.exists(dir.resolve(location)));
        }

        // Bu test aynı anahtarın her yazımda yeni bir konum aldığını gösterir.
        @Test
        void each_write_gets_new_location()
        {
            String first = storage.write("alpha", utf8("one"));
            String second = storage.write("alpha", utf8("two"));
            assertNotEquals(first, second);
            assertEquals(2, storage.list().size());
        }

        // Bu test boş değerlerin de saklanabildiğini doğrular.
        @Test
        void empty_value_is_stored() throws IOException
        {
            String location = storage.write("empty", new byte[0]);
            assertArrayEquals(new byte[0], storage.read(location, "empty"));
        }

        // Bu test çok uzun anahtarlar için dosya adının özet biçimine geçtiğini doğrular.
        @Test
        void long_key_uses_digest_name() throws IOException
        {
            String key = "k".repeat(500);
            String location = storage.write(key, utf8("v"));
            assertTrue(location.startsWith("h-"));
            assertArrayEquals(utf8("v"), storage.read(location, key));
        }
    }

    @Nested
    class CorruptRecords
    {
        // Bu test sağlama toplamı bozulan kaydın okunamadığını doğrular.
        @Test
        void bad_crc_is_rejected() throws IOException
        {
            String location = storage.write("alpha", utf8("payload"));
            Path file = dir.resolve(location);
            byte[] bytes = Files.readAllBytes(file);
            bytes[bytes.length - 6] ^= 0x5A;
            Files.write(file, bytes);
            assertThrows(CorruptRecordException.class, () -> storage.read(location, "alpha"));
        }

        // Bu test başka bir anahtara ait kaydın reddedildiğini gösterir.
        @Test
        void record_of_other_key_is_rejected()
        {
            String location = storage.write("alpha", utf8("payload"));
            assertThrows(CorruptRecordException.class, () -> storage.read(location, "beta"));
        }

        // Bu test yarıda kesilmiş kaydın bozuk sayıldığını doğrular.
        @Test
        void truncated_record_counts_as_corrupt() throws IOException
        {
            String location = storage.write("alpha", utf8("payload"));
            Path file = dir.resolve(location);
            byte[] bytes = Files.readAllBytes(file);
            Files.write(file, java.util.Arrays.copyOf(bytes, 6));
            assertThrows(CorruptRecordException.class, () -> storage.read(location, "alpha"));
        }

        // Bu test silinmiş kaydın okunmasının dosya bulunamadı hatası verdiğini gösterir.
        @Test
        void deleted_record_is_not_found()
        {
            String location = storage.write("alpha", utf8("payload"));
            assertTrue(storage.delete(location));
            assertFalse(storage.delete(location));
            assertThrows(NoSuchFileException.class, () -> storage.read(location, "alpha"));
        }

        // Bu test dizin dışına çıkan konumların kabul edilmediğini doğrular.
        @Test
        void invalid_location_is_rejected()
        {
            assertThrows(IllegalArgumentException.class, () -> storage.read("../escape.rec", "alpha"));
            assertThrows(IllegalArgumentException.class, () -> storage.delete("cache_index.log"));
        }
    }

    @Nested
    class Opening
    {
        // Bu test yeniden açılışta geçici dosyaların temizlendiğini ve neslin devam ettiğini doğrular.
        @Test
        void reopen_sweeps_temp_files() throws IOException
        {
            String first = storage.write("alpha", utf8("one"));
            Files.write(dir.resolve("YWxwaGE.99.rec.tmp"), utf8("partial"));

            FileStorageUnit reopened = FileStorageUnit.open(dir, false);
            List<String> records = reopened.list();
            assertEquals(List.of(first), records);
            assertFalse(Files.exists(dir.resolve("YWxwaGE.99.rec.tmp")));

            String second = reopened.write("alpha", utf8("two"));
            assertNotEquals(first, second);
        }

        // Bu test ayrılan konumların nesillerinin yeni yazmalarda tekrar üretilmediğini doğrular.
        @Test
        void reserved_generations_are_never_reused()
        {
            storage.reserve(List.of("YWxwaGE.7.rec", "h-abc.3.rec"));
            assertEquals("YWxwaGE.8.rec", storage.write("alpha", utf8("one")));

            storage.reserve(List.of("YWxwaGE.2.rec"));
            assertEquals("YWxwaGE.9.rec", storage.write("alpha", utf8("two")));
        }

        // Bu test indeks dosyalarının kayıt listesine karışmadığını gösterir.
        @Test
        void list_contains_only_records() throws IOException
        {
            storage.write("alpha", utf8("one"));
            Files.write(dir.resolve("cache_index.log"), utf8("S x y 1 1 1\n"));
            assertEquals(1, storage.list().size());
        }
    }
}
