package com.streamfirst.sheetgrid.domain;

import lombok.Getter;

/**
 * A bulk update never produced a structured response. Every optimistic change of the batch was
 * rolled back and the edits remain pending for a retry.
 */
@Getter
public class TransportException extends SheetGridException {

    private final int updateCount;

    public TransportException(int updateCount, Throwable cause) {
        super(
                "Bulk update of " + updateCount + " field(s) did not reach the store: " + cause.getMessage(),
                cause);
        this.updateCount = updateCount;
    }
}
