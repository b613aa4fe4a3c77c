package com.streamfirst.sheetgrid.domain;

/** Direction of a column sort. */
public enum SortDirection {
    ASC,
    DESC;

    public SortDirection toggle() {
        return this == ASC ? DESC : ASC;
    }
}
