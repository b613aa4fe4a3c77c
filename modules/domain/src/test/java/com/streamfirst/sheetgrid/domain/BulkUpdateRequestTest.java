package com.streamfirst.sheetgrid.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BulkUpdateRequestTest {

    private static final ViewId VIEW = ViewId.of("Master");
    private static final RecordId P1 = RecordId.of("P1");
    private static final RecordId P2 = RecordId.of("P2");

    @Test
    void testRepeatedEditsOfACellKeepFirstPositionAndLastValue() {
        List<PendingEdit> edits =
                List.of(
                        PendingEdit.create(P1, "amt", "110", "100"),
                        PendingEdit.create(P2, "amt", "55", "50"),
                        PendingEdit.create(P1, "amt", "120", "100"));

        BulkUpdateRequest request = BulkUpdateRequest.coalesce(VIEW, edits);

        assertThat(request.getUpdates())
                .containsExactly(new BulkUpdateItem(P1, "amt", "120"), new BulkUpdateItem(P2, "amt", "55"));
    }

    @Test
    void testDifferentFieldsOfOneRecordStaySeparate() {
        BulkUpdateRequest request =
                BulkUpdateRequest.coalesce(
                        VIEW,
                        List.of(PendingEdit.create(P1, "amt", "1", null), PendingEdit.create(P1, "agent", "A", null)));

        assertThat(request.size()).isEqualTo(2);
    }

    @Test
    void testResultCountersAndFailureRateFollowItemResults() {
        BulkUpdateItem ok = new BulkUpdateItem(P1, "amt", "1");
        BulkUpdateItem bad = new BulkUpdateItem(P2, "amt", "2");

        BulkUpdateResult result =
                BulkUpdateResult.of(
                        List.of(ItemResult.succeeded(ok, "0"), ItemResult.failed(bad, "nope")), Duration.ofMillis(5));

        assertThat(result.getTotalUpdates()).isEqualTo(2);
        assertThat(result.getSuccessfulUpdates()).isEqualTo(1);
        assertThat(result.getFailedUpdates()).isEqualTo(1);
        assertThat(result.failureRate()).isEqualTo(0.5);
        assertThat(result.failures()).extracting(ItemResult::recordId).containsExactly(P2);
        assertThat(BulkUpdateResult.empty().failureRate()).isZero();
    }
}
