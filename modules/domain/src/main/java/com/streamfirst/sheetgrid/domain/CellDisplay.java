package com.streamfirst.sheetgrid.domain;

import java.util.Objects;

/**
 * What the UI renders for one cell.
 *
 * @param value value to show: the pending value if one exists, else the committed value
 * @param status presentation status
 * @param errorMessage reason of the last failure, only set for {@link CellStatus#FAILED}
 */
public record CellDisplay(Object value, CellStatus status, String errorMessage) {
    public CellDisplay {
        Objects.requireNonNull(status, "Status cannot be null");
    }

    public static CellDisplay committed(Object value) {
        return new CellDisplay(value, CellStatus.COMMITTED, null);
    }
}
