package com.williamcallahan.baptismdesk.storage;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link ObjectStorage} for development and tests, selected with
 * {@code app.storage.type=memory}. Contents vanish on restart. Presigned URLs use a
 * {@code memory:} scheme and cannot be fetched over HTTP.
 */
public class InMemoryObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStorage.class);

    private final ConcurrentHashMap<String, StoredObject> objects = new ConcurrentHashMap<>();

    public InMemoryObjectStorage() {
        log.info("Using in-memory object storage (contents are not durable)");
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        objects.put(key, new StoredObject(content.clone(), contentType));
    }

    @Override
    public void putFile(String key, Path source, String contentType) {
        try {
            put(key, Files.readAllBytes(source), contentType);
        } catch (IOException exception) {
            throw new ObjectStorageException("Failed to read " + source + " for key " + key, exception);
        }
    }

    @Override
    public byte[] get(String key) {
        StoredObject stored = objects.get(key);
        if (stored == null) {
            throw new ObjectNotFoundException(key);
        }
        return stored.content().clone();
    }

    @Override
    public void download(String key, Path target) {
        byte[] content = get(key);
        try {
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            Files.write(partial, content);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException exception) {
            throw new ObjectStorageException("Failed to write " + key + " to " + target, exception);
        }
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public URI presignedGetUrl(String key, Duration ttl, DownloadDisposition disposition) {
        if (!objects.containsKey(key)) {
            throw new ObjectNotFoundException(key);
        }
        StringBuilder uri = new StringBuilder("memory:/").append(key).append("?ttl=").append(ttl.toSeconds());
        if (disposition != null) {
            uri.append("&disposition=").append(URLEncoder.encode(disposition.headerValue(), StandardCharsets.UTF_8));
        }
        return URI.create(uri.toString());
    }

    @Override
    public String describe() {
        return "memory (" + objects.size() + " objects)";
    }

    /**
     * Returns the content type recorded for a key, or null when absent.
     */
    public String contentType(String key) {
        StoredObject stored = objects.get(key);
        return stored == null ? null : stored.contentType();
    }

    /**
     * Sorted snapshot of stored keys.
     */
    public Set<String> keys() {
        return new TreeSet<>(objects.keySet());
    }

    private record StoredObject(byte[] content, String contentType) {}
}
