package com.mainforce.auction.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Snapshots of one trade date together with the collection status of that date.
 */
public final class SnapshotBatch {
    public final LocalDate tradeDate;
    public final boolean collected;
    public final List<AuctionSnapshot> snapshots;

    public SnapshotBatch(LocalDate tradeDate, boolean collected, List<AuctionSnapshot> snapshots) {
        this.tradeDate = tradeDate;
        this.snapshots = snapshots == null ? List.of() : copyNonNull(snapshots);
        this.collected = collected || !this.snapshots.isEmpty();
    }

    public static SnapshotBatch notCollected(LocalDate tradeDate) {
        return new SnapshotBatch(tradeDate, false, List.of());
    }

    public DataSource dataSource() {
        return collected ? DataSource.AUCTION_SNAPSHOT : DataSource.NONE;
    }

    private static List<AuctionSnapshot> copyNonNull(List<AuctionSnapshot> in) {
        return Collections.unmodifiableList(in.stream().filter(Objects::nonNull).collect(Collectors.toList()));
    }
}
