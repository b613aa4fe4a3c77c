package com.streamfirst.sheetgrid.domain;

import lombok.Getter;

import java.util.List;

/**
 * The store answered a bulk update but rejected some items. The rejected cells were reverted
 * locally and stay flagged as failed.
 */
@Getter
public class PartialUpdateException extends SheetGridException {

    private final List<ItemResult> failures;
    private final int totalUpdates;

    public PartialUpdateException(List<ItemResult> failures, int totalUpdates) {
        super(failures.size() + " of " + totalUpdates + " field update(s) were rejected");
        this.failures = List.copyOf(failures);
        this.totalUpdates = totalUpdates;
    }
}
