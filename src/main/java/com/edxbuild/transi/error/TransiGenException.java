package com.edxbuild.transi.error;

/**
 * Base type for every failure raised by the merge pipeline.
 * Structural errors extending this type abort a run before any artifact is written.
 */
public class TransiGenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransiGenException(String message) {
        super(message);
    }

    public TransiGenException(String message, Throwable cause) {
        super(message, cause);
    }
}
