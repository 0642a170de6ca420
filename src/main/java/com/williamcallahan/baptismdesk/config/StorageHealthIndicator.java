package com.williamcallahan.baptismdesk.config;

import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import com.williamcallahan.baptismdesk.storage.StorageKeys;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the object store.
 *
 * <p>Probes the snapshot key with an existence check, which exercises credentials and bucket
 * access without transferring data.
 */
@Component
public class StorageHealthIndicator implements HealthIndicator {

    /** Health detail key for the store description. */
    private static final String DETAIL_KEY_BACKEND = "backend";
    /** Health detail key for whether a snapshot has been written yet. */
    private static final String DETAIL_KEY_SNAPSHOT = "snapshotPresent";
    private static final String DETAIL_KEY_ERROR = "error";

    private final ObjectStorage objectStorage;

    public StorageHealthIndicator(ObjectStorage objectStorage) {
        this.objectStorage = objectStorage;
    }

    @Override
    public Health health() {
        try {
            boolean snapshotPresent = objectStorage.exists(StorageKeys.MANAGER_STATE);
            return Health.up()
                    .withDetail(DETAIL_KEY_BACKEND, objectStorage.describe())
                    .withDetail(DETAIL_KEY_SNAPSHOT, snapshotPresent)
                    .build();
        } catch (ObjectStorageException e) {
            return Health.down()
                    .withDetail(DETAIL_KEY_BACKEND, objectStorage.describe())
                    .withDetail(DETAIL_KEY_ERROR, e.getMessage())
                    .build();
        }
    }
}
