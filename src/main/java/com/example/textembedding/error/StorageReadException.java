package com.example.textembedding.error;

public class StorageReadException extends StorageException {

    public StorageReadException(String message) {
        super(ErrorKind.STORAGE_READ, message, false, false, null);
    }

    public StorageReadException(String message, boolean collectionMissing) {
        super(ErrorKind.STORAGE_READ, message, false, collectionMissing, null);
    }

    public StorageReadException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_READ, message, true, false, cause);
    }
}
