package com.williamcallahan.baptismdesk.storage;

/**
 * Signals that the durable object store could not complete a read, write or delete.
 */
public class ObjectStorageException extends RuntimeException {

    public ObjectStorageException(String message) {
        super(message);
    }

    public ObjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
