package com.dcruver.notesindex.storage;

/** Thrown when the index database cannot complete an operation. */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
