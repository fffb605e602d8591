package com.edxbuild.transi.error;

import java.io.IOException;

/**
 * Reading or writing a table file failed at the I/O level.
 */
public class TableIoException extends TransiGenException {

    private static final long serialVersionUID = 1L;

    public TableIoException(String message, IOException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
