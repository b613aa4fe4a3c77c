package com.streamfirst.sheetgrid.domain;

import lombok.Getter;

/** A local edit failed a format check and was never sent to the store. */
@Getter
public class ValidationException extends SheetGridException {

    private final CellKey cell;

    public ValidationException(CellKey cell, String reason) {
        super("Invalid value for " + cell + ": " + reason);
        this.cell = cell;
    }
}
