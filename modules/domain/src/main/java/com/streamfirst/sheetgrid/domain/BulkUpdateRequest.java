package com.streamfirst.sheetgrid.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered batch of field updates sent to the remote store in a single call. The store mutates at
 * field granularity, so a request carries at most one update per (record, field).
 */
@Value
public class BulkUpdateRequest {
    /** Sheet the updates target */
    @NonNull ViewId viewId;

    @NonNull List<BulkUpdateItem> updates;

    private BulkUpdateRequest(ViewId viewId, List<BulkUpdateItem> updates) {
        this.viewId = viewId;
        this.updates = List.copyOf(updates);
    }

    /**
     * Builds a request from edits in submission order. Repeated edits of the same cell collapse into
     * one entry that keeps the position of the first edit and the value of the last.
     */
    public static BulkUpdateRequest coalesce(@NonNull ViewId viewId, Collection<PendingEdit> edits) {
        Map<CellKey, BulkUpdateItem> byCell = new LinkedHashMap<>();
        for (PendingEdit edit : edits) {
            BulkUpdateItem item = new BulkUpdateItem(edit.getRecordId(), edit.getFieldName(), edit.getNewValue());
            byCell.merge(edit.cellKey(), item, (first, latest) -> latest);
        }
        return new BulkUpdateRequest(viewId, new ArrayList<>(byCell.values()));
    }

    public static BulkUpdateRequest of(@NonNull ViewId viewId, List<BulkUpdateItem> items) {
        return new BulkUpdateRequest(viewId, items);
    }

    public int size() {
        return updates.size();
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    @Override
    public String toString() {
        return "BulkUpdateRequest{" + "viewId=" + viewId + ", updateCount=" + updates.size() + '}';
    }
}
