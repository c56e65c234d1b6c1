package com.myorg.esf.contracts.core.exception;

/**
 * Failure the caller may resolve by reloading and retrying under its own policy.
 */
public class EsfRetryableException extends RuntimeException {
    public EsfRetryableException(String msg) { super(msg); }
    public EsfRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
