package com.routeclip.common;

/**
 * Raised when an upload could not be stored or recorded. When thrown, no video record,
 * job or stored file is left behind for the upload.
 */
public class IngestException extends BusinessException {

    public static final String CODE = "INGEST_FAILED";

    public IngestException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
