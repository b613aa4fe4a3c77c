package com.streamfirst.sheetgrid.domain;

/** Base type of every error the table engine surfaces to its callers. */
public abstract class SheetGridException extends RuntimeException {

    protected SheetGridException(String message) {
        super(message);
    }

    protected SheetGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
