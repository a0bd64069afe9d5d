package com.limitbook.engine.core.model;

import java.util.List;

/**
 * Bid and ask levels of a published snapshot. The lists are read-only views into the snapshot.
 * Snapshots only carry the configured number of levels per side; {@code bidLevelCount} and
 * {@code askLevelCount} give the full number of levels in the book, so a caller can tell when a
 * side was cut short.
 */
public record BookDepth(String symbol, long version, List<DepthLevel> bids, List<DepthLevel> asks,
                        int bidLevelCount, int askLevelCount) {

    public static BookDepth empty(String symbol) {
        return new BookDepth(symbol, 0, List.of(), List.of(), 0, 0);
    }

    public boolean isTruncated() {
        return bids.size() < bidLevelCount || asks.size() < askLevelCount;
    }
}
