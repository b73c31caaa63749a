package com.mainforce.auction.strategy;

import com.mainforce.auction.model.AuctionSnapshot;
import com.mainforce.auction.model.SkipReason;

/**
 * Rejects rows that cannot be scored: blank code, unusable price or previous close.
 */
public final class SnapshotValidator {

    /**
     * @return the reason the row cannot be scored, or {@code null} when it is usable
     */
    public SkipReason check(AuctionSnapshot snapshot) {
        if (snapshot == null || snapshot.code == null || snapshot.code.trim().isEmpty()) {
            return SkipReason.MISSING_CODE;
        }
        if (!positive(snapshot.price)) {
            return SkipReason.MISSING_PRICE;
        }
        if (!positive(snapshot.preClose)) {
            return SkipReason.MISSING_PRE_CLOSE;
        }
        return null;
    }

    private static boolean positive(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }
}
