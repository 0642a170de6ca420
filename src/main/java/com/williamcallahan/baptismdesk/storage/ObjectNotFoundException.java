package com.williamcallahan.baptismdesk.storage;

/**
 * Signals that a requested object key does not exist in the store.
 */
public class ObjectNotFoundException extends ObjectStorageException {

    private final String key;

    public ObjectNotFoundException(String key) {
        super("Object not found: " + key);
        this.key = key;
    }

    public ObjectNotFoundException(String key, Throwable cause) {
        super("Object not found: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
