package com.streamfirst.sheetgrid.domain;

/** How a cell should be presented relative to the remote store. */
public enum CellStatus {
    /** Value matches the last confirmed state */
    COMMITTED,
    /** Carries a local edit that is unsaved or in flight */
    PENDING,
    /** The last attempt to save this cell was rejected */
    FAILED
}
