package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.CellKey;
import com.streamfirst.sheetgrid.domain.Result;

/** Local check of an edit before it is accepted as pending. */
@FunctionalInterface
public interface CellValidator {

    /** Accepts everything. */
    CellValidator NONE = (cell, newValue) -> Result.ok();

    /**
     * @param cell the edited cell
     * @param newValue the entered value, may be null to clear the cell
     * @return success, or a failure carrying the reason the value is rejected
     */
    Result<Void> validate(CellKey cell, String newValue);
}
