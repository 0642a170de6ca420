package com.williamcallahan.baptismdesk.storage;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Durable keyed object store holding images, certificates, the template and the state snapshot.
 *
 * <p>Every operation may block on the network; callers run them inside pipeline jobs or on the
 * snapshot writer, never on the profile manager thread. Failures surface as
 * {@link ObjectStorageException}; a missing key on read surfaces as {@link ObjectNotFoundException}.</p>
 */
public interface ObjectStorage {

    void put(String key, byte[] content, String contentType);

    void putFile(String key, Path source, String contentType);

    byte[] get(String key);

    /**
     * Streams an object into {@code target}, replacing any existing file.
     */
    void download(String key, Path target);

    /**
     * Deletes an object. Deleting a missing key is not an error.
     */
    void delete(String key);

    boolean exists(String key);

    /**
     * Creates a time-limited read URL.
     *
     * @param key object key
     * @param ttl how long the URL stays valid
     * @param disposition optional Content-Disposition override, may be null
     * @return presigned URL
     */
    URI presignedGetUrl(String key, Duration ttl, DownloadDisposition disposition);

    /**
     * Short description for health reporting (bucket name, backend kind).
     */
    String describe();
}
