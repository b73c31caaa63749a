package com.mainforce.auction.model;

import java.time.LocalDate;
import java.util.List;

public final class RankedResultSet {
    public final LocalDate tradeDate;
    public final DataSource dataSource;
    public final List<CandidateResult> items;
    public final RankSummary summary;
    public final RankDiagnostics diagnostics;

    public RankedResultSet(
            LocalDate tradeDate,
            DataSource dataSource,
            List<CandidateResult> items,
            RankSummary summary,
            RankDiagnostics diagnostics
    ) {
        this.tradeDate = tradeDate;
        this.dataSource = dataSource == null ? DataSource.NONE : dataSource;
        this.items = items == null ? List.of() : List.copyOf(items);
        this.summary = summary;
        this.diagnostics = diagnostics;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
