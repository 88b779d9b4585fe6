package com.example.textembedding.error;

public class StorageWriteException extends StorageException {

    public StorageWriteException(String message) {
        super(ErrorKind.STORAGE_WRITE, message, false, false, null);
    }

    public StorageWriteException(String message, boolean collectionMissing) {
        super(ErrorKind.STORAGE_WRITE, message, false, collectionMissing, null);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_WRITE, message, true, false, cause);
    }
}
