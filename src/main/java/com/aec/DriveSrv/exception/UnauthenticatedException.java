package com.aec.DriveSrv.exception;

/**
 * The caller has no usable session, or Google no longer honours the stored
 * grant. The user has to log in again; nothing retries this automatically.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
