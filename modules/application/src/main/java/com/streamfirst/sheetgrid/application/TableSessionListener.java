package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.SheetGridException;
import com.streamfirst.sheetgrid.domain.ViewId;

/**
 * Receives notifications from a {@link TableSession}. Renderers subscribe here and pull fresh
 * derived state from the session on {@link #onStateChanged()}.
 */
public interface TableSessionListener {

    /** Rows, filters, sort, pagination or pending edits changed. */
    void onStateChanged();

    /** A fetch or a submission failed; the exception carries the affected view or cells. */
    default void onSyncFailed(SheetGridException error) {}

    /**
     * The active view was reloaded because too many updates of a submission were rejected. Local
     * edits were discarded.
     *
     * @param notice message to show to the user
     */
    default void onViewRefreshed(ViewId viewId, String notice) {}
}
