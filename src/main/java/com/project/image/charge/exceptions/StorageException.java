package com.project.image.charge.exceptions;

/** Upload directory or stored file could not be written. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
