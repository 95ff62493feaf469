package com.predictionmarket.domain;

import java.util.List;

/**
 * Four-sided market view rebuilt from the two canonical queues.
 */
public record MarketSnapshot(List<BookEntry> yesBids, List<BookEntry> yesAsks,
                             List<BookEntry> noBids, List<BookEntry> noAsks) {

    public MarketSnapshot {
        yesBids = List.copyOf(yesBids);
        yesAsks = List.copyOf(yesAsks);
        noBids = List.copyOf(noBids);
        noAsks = List.copyOf(noAsks);
    }
}
