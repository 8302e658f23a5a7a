package com.aec.DriveSrv.exception;

import lombok.Getter;

/**
 * Non-2xx, malformed or interrupted response from the Drive API.
 * {@link #getStatusCode()} is {@link #NO_STATUS} when no HTTP status was received.
 */
@Getter
public class DriveProviderException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public DriveProviderException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
