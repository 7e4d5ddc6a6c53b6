package com.daniel.feedarr.cache;

// Cache rows or feed artifacts could not be read or written.
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
