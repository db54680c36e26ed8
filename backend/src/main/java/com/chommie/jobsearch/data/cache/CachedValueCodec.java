package com.chommie.jobsearch.data.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON serialization for cached values, gzip-compressed once the serialized form passes a
 * size threshold. The decision looks only at byte size.
 */
public class CachedValueCodec {
    private final ObjectMapper objectMapper;
    private final int compressionThresholdBytes;

    public CachedValueCodec(ObjectMapper objectMapper, int compressionThresholdBytes) {
        this.objectMapper = objectMapper;
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    public Encoded encode(Object value) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to serialize cache value", e);
        }
        if (json.length > compressionThresholdBytes) {
            return new Encoded(gzip(json), true);
        }
        return new Encoded(json, false);
    }

    public <T> T decode(CacheEntry entry, JavaType type) {
        byte[] json = entry.compressed() ? gunzip(entry.payload()) : entry.payload();
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to deserialize cache value", e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private byte[] gzip(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to compress cache value", e);
        }
        return out.toByteArray();
    }

    private byte[] gunzip(byte[] compressed) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to decompress cache value", e);
        }
    }

    public record Encoded(byte[] payload, boolean compressed) {
    }
}
