package com.ringcache.storage;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.CRC32C;

/**
 * Her kaydı kendi dosyasında tutan depolama birimidir. Dosya adı
 * {@code <base64url(anahtar)>.<nesil>.rec} biçimindedir ve her yazma yeni bir
 * nesil numarası alır. Kayıt önce geçici dosyaya yazılır, diske zorlanır ve
 * ardından atomik olarak son adına taşınır; bu sayede yarım yazılmış bir kayıt
 * hiçbir zaman son adıyla görünmez.
 *
 * <p>Kayıt düzeni: {@code MAGIC(4) KEY_LEN(4) KEY VALUE_LEN(4) VALUE CRC32C(4)}.
 */
public final class FileStorageUnit implements StorageUnit
{
    private static final Logger LOG = Logger.getLogger(FileStorageUnit.class);

    static final int MAGIC = 0x52435231; // "RCR1"
    static final String RECORD_SUFFIX = ".rec";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int MAX_ENCODED_NAME = 120;
    private static final int HEADER_BYTES = 4 + 4;

    private final Path directory;
    private final boolean fsync;
    private final AtomicLong generation;

    private FileStorageUnit(Path directory, boolean fsync, long lastGeneration)
    {
        this.directory = directory;
        this.fsync = fsync;
        this.generation = new AtomicLong(lastGeneration);
    }

    /**
     * Depolama dizinini açar; dizin yoksa oluşturur. Önceki bir çökmeden kalan
     * geçici dosyalar silinir ve nesil sayacı diskteki en büyük değerden devam eder.
     *
     * @throws IllegalStateException dizin oluşturulamıyor veya okunamıyorsa
     */
    public static FileStorageUnit open(Path directory, boolean fsync)
    {
        Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage directory " + directory, e);
        }

        long maxGeneration = 0L;
        int sweptTemps = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    Files.deleteIfExists(file);
                    sweptTemps++;
                } else if (name.endsWith(RECORD_SUFFIX)) {
                    maxGeneration = Math.max(maxGeneration, generationOf(name));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot scan storage directory " + directory, e);
        }

        if (sweptTemps > 0) {
            LOG.infof("Removed %d incomplete temp records from %s", sweptTemps, directory);
        }
        LOG.debugf("Storage unit opened at %s (last generation %d)", directory, maxGeneration);
        return new FileStorageUnit(directory, fsync, maxGeneration);
    }

    @Override
    public String write(String key, byte[] value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        String location = fileNameFor(key) + "." + generation.incrementAndGet() + RECORD_SUFFIX;
        Path target = resolve(location);
        Path temp = directory.resolve(location + TEMP_SUFFIX);
        ByteBuffer buffer = encode(key, value);

        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (fsync) {
                    channel.force(true);
                }
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
            if (fsync) {
                syncDirectory();
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageIOException("Failed to write record " + location, e);
        }
        return location;
    }

    @Override
    public byte[] read(String location, String expectedKey) throws IOException
    {
        byte[] all = Files.readAllBytes(resolve(location));
        if (all.length < HEADER_BYTES + 4 + 4) {
            throw new CorruptRecordException("Record " + location + " is truncated");
        }
        ByteBuffer buf = ByteBuffer.wrap(all);
        if (buf.getInt() != MAGIC) {
            throw new CorruptRecordException("Record " + location + " has a bad magic number");
        }
        int keyLen = buf.getInt();
        if (keyLen < 0 || keyLen > buf.remaining() - 8) {
            throw new CorruptRecordException("Record " + location + " has an invalid key length " + keyLen);
        }
        byte[] keyBytes = new byte[keyLen];
        buf.get(keyBytes);
        int valueLen = buf.getInt();
        if (valueLen < 0 || valueLen != buf.remaining() - 4) {
            throw new CorruptRecordException("Record " + location + " has an invalid value length " + valueLen);
        }
        byte[] value = new byte[valueLen];
        buf.get(value);
        int expectedCrc = buf.getInt();

        CRC32C crc = new CRC32C();
        crc.update(all, 0, all.length - 4);
        if ((int) crc.getValue() != expectedCrc) {
            throw new CorruptRecordException("Record " + location + " failed its checksum");
        }
        if (expectedKey != null && !expectedKey.equals(new String(keyBytes, StandardCharsets.UTF_8))) {
            throw new CorruptRecordException("Record " + location + " belongs to another key");
        }
        return value;
    }

    @Override
    public boolean delete(String location)
    {
        try {
            return Files.deleteIfExists(resolve(location));
        } catch (IOException e) {
            throw new StorageIOException("Failed to delete record " + location, e);
        }
    }

    @Override
    public List<String> list()
    {
        List<String> locations = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                locations.add(file.getFileName().toString());
            }
        } catch (IOException e) {
            throw new StorageIOException("Failed to list records in " + directory, e);
        }
        return locations;
    }

    private Path resolve(String location)
    {
        if (location.isEmpty() || location.indexOf('/') >= 0 || location.indexOf('\\') >= 0
                || !location.endsWith(RECORD_SUFFIX)) {
            throw new IllegalArgumentException("Invalid record location: " + location);
        }
        return directory.resolve(location);
    }

    private static ByteBuffer encode(String key, byte[] value)
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + keyBytes.length + 4 + value.length + 4);
        buf.putInt(MAGIC);
        buf.putInt(keyBytes.length);
        buf.put(keyBytes);
        buf.putInt(value.length);
        buf.put(value);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        buf.flip();
        return buf;
    }

    static String fileNameFor(String key)
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(keyBytes);
        if (encoded.length() <= MAX_ENCODED_NAME) {
            return encoded;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "h-" + HexFormat.of().formatHex(digest.digest(keyBytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public void reserve(Collection<String> locations)
    {
        long highest = 0L;
        for (String location : locations) {
            if (location.endsWith(RECORD_SUFFIX)) {
                highest = Math.max(highest, generationOf(location));
            }
        }
        long before = generation.getAndAccumulate(highest, Math::max);
        if (highest > before) {
            LOG.debugf("Generation counter advanced from %d to %d for indexed locations", before, highest);
        }
    }

    private static long generationOf(String fileName)
    {
        String stem = fileName.substring(0, fileName.length() - RECORD_SUFFIX.length());
        int dot = stem.lastIndexOf('.');
        if (dot < 0) {
            return 0L;
        }
        try {
            return Long.parseLong(stem.substring(dot + 1));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private void syncDirectory()
    {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // bazı dosya sistemleri dizin fsync desteklemez
            LOG.debugf("Directory fsync not supported for %s: %s", directory, e.getMessage());
        }
    }
}
