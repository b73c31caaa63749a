package com.mainforce.auction.data;

import com.mainforce.auction.model.SnapshotBatch;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Collected call-auction snapshots by trade date.
 */
public interface SnapshotRepository {
    /**
     * Never null: a date without any collection comes back as {@link SnapshotBatch#notCollected}.
     */
    SnapshotBatch findBatch(LocalDate tradeDate);

    Optional<LocalDate> latestTradeDate();
}
