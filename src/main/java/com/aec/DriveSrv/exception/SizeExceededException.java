package com.aec.DriveSrv.exception;

import lombok.Getter;

@Getter
public class SizeExceededException extends RuntimeException {

    private final long limitBytes;
    private final long bytesReached;

    public SizeExceededException(long limitBytes, long bytesReached) {
        super("File exceeds max size (" + limitBytes + " bytes); aborted at " + bytesReached + " bytes");
        this.limitBytes = limitBytes;
        this.bytesReached = bytesReached;
    }
}
