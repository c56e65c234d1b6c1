package com.myorg.esf.contracts.core.exception;

public class StorageException extends EsfRetryableException {
    public StorageException(String msg, Throwable cause) { super(msg, cause); }
}
