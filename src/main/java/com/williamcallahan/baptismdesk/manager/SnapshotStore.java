package com.williamcallahan.baptismdesk.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.baptismdesk.domain.ManagerState;
import com.williamcallahan.baptismdesk.storage.ObjectNotFoundException;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Persists the profile manager's state as one JSON object in the store.
 *
 * <p>Bytes are captured by the caller (the manager thread) so each write reflects the state at
 * the moment of the mutation. Writes run on a single background thread in submission order, so
 * the newest snapshot always lands last. Write failures are logged and never retried; the next
 * mutation writes a fresh snapshot anyway.</p>
 */
public class SnapshotStore {
    private static final Logger SNAPSHOT_LOG = LoggerFactory.getLogger("SNAPSHOT");
    private static final String CORRUPT_SNAPSHOT_PREFIX = "manager_state.corrupt.";
    private static final DateTimeFormatter CORRUPT_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectStorage storage;
    private final ObjectMapper snapshotMapper;
    private final Clock clock;
    private final ExecutorService writer =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("snapshot-writer-"));

    /**
     * Creates a store writing through the given object storage.
     *
     * @param storage destination for {@value StorageKeys#MANAGER_STATE}
     * @param objectMapper base mapper, copied and configured for snake_case ISO-date output
     * @param clock timestamps quarantined corrupt snapshots
     */
    public SnapshotStore(ObjectStorage storage, ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.clock = clock;
        this.snapshotMapper = objectMapper
                .copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes the state. Called on the manager thread.
     *
     * @throws IllegalStateException if the state cannot be serialized
     */
    public byte[] serialize(ManagerState state) {
        try {
            return snapshotMapper.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manager state", e);
        }
    }

    public ManagerState deserialize(byte[] snapshot) throws IOException {
        ManagerState state = snapshotMapper.readValue(snapshot, ManagerState.class);
        return state == null ? ManagerState.empty() : state;
    }

    /**
     * Serializes now and writes in the background.
     */
    public void save(ManagerState state) {
        byte[] snapshot;
        try {
            snapshot = serialize(state);
        } catch (IllegalStateException e) {
            SNAPSHOT_LOG.error("Snapshot not written: {}", e.getMessage(), e);
            return;
        }
        int profileCount = state.profiles().size();
        writer.execute(() -> write(snapshot, profileCount));
    }

    /**
     * Loads the last written snapshot. A missing snapshot means a fresh install; an unreadable
     * one is copied aside for inspection and the manager starts empty.
     */
    public ManagerState load() {
        byte[] snapshot;
        try {
            snapshot = storage.get(StorageKeys.MANAGER_STATE);
        } catch (ObjectNotFoundException e) {
            SNAPSHOT_LOG.info("No snapshot found, starting with an empty profile collection");
            return ManagerState.empty();
        }
        try {
            ManagerState state = deserialize(snapshot);
            SNAPSHOT_LOG.info("Loaded snapshot with {} profiles", state.profiles().size());
            return state;
        } catch (IOException e) {
            quarantine(snapshot, e);
            return ManagerState.empty();
        }
    }

    /**
     * Blocks until every write submitted so far has finished.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(long timeout, TimeUnit unit) {
        try {
            writer.submit(() -> { }).get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            SNAPSHOT_LOG.warn("Snapshot flush failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Lets queued writes finish, then stops the writer thread.
     */
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                SNAPSHOT_LOG.warn("Snapshot writer did not finish within 10s; pending writes dropped");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    private void write(byte[] snapshot, int profileCount) {
        try {
            storage.put(StorageKeys.MANAGER_STATE, snapshot, StorageKeys.CONTENT_TYPE_JSON);
            SNAPSHOT_LOG.debug("Wrote snapshot with {} profiles ({} bytes)", profileCount, snapshot.length);
        } catch (ObjectStorageException e) {
            SNAPSHOT_LOG.error("Failed to write snapshot with {} profiles: {}", profileCount, e.getMessage(), e);
        }
    }

    private void quarantine(byte[] snapshot, IOException parseFailure) {
        String corruptKey = CORRUPT_SNAPSHOT_PREFIX + LocalDateTime.now(clock).format(CORRUPT_TIMESTAMP_FORMAT) + ".json";
        SNAPSHOT_LOG.error("Snapshot is unreadable, moving it to {} and starting empty: {}",
                corruptKey, parseFailure.getMessage());
        try {
            storage.put(corruptKey, snapshot, StorageKeys.CONTENT_TYPE_JSON);
        } catch (ObjectStorageException e) {
            SNAPSHOT_LOG.error("Failed to keep a copy of the unreadable snapshot: {}", e.getMessage());
        }
    }
}
