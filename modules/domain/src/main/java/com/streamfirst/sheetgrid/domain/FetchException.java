package com.streamfirst.sheetgrid.domain;

import lombok.Getter;

/** Loading a view snapshot failed. Nothing was changed locally, so there is nothing to roll back. */
@Getter
public class FetchException extends SheetGridException {

    private final ViewId viewId;

    public FetchException(ViewId viewId, String message, Throwable cause) {
        super("Failed to fetch view '" + viewId + "': " + message, cause);
        this.viewId = viewId;
    }
}
