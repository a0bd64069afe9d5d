package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned view of one book. Built by the writer inside the shard's critical
 * section and then shared with any number of readers.
 */
@Value
@Builder
public class BookSnapshot {
    String symbol;
    long version;
    BigDecimal bestBid;
    BigDecimal bestAsk;
    List<DepthLevel> bids;
    List<DepthLevel> asks;
    int bidLevelCount;
    int askLevelCount;
    long ordersProcessed;
    long tradeCount;
    long tradedVolume;
    Instant timestamp;

    public static BookSnapshot empty(String symbol) {
        return BookSnapshot.builder()
                .symbol(symbol)
                .version(0)
                .bids(List.of())
                .asks(List.of())
                .timestamp(Instant.now())
                .build();
    }

    public static BookSnapshot of(OrderBook book, int depth) {
        return BookSnapshot.builder()
                .symbol(book.getSymbol())
                .version(book.getVersion())
                .bestBid(book.bestPrice(OrderSide.BUY).orElse(null))
                .bestAsk(book.bestPrice(OrderSide.SELL).orElse(null))
                .bids(List.copyOf(book.depth(OrderSide.BUY, depth)))
                .asks(List.copyOf(book.depth(OrderSide.SELL, depth)))
                .bidLevelCount(book.getBids().getLevelCount())
                .askLevelCount(book.getAsks().getLevelCount())
                .ordersProcessed(book.getOrdersProcessed())
                .tradeCount(book.getTradeCount())
                .tradedVolume(book.getTradedVolume())
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Present only when both sides have a price.
     */
    public Optional<TopOfBook> topOfBook() {
        if (bestBid == null || bestAsk == null) {
            return Optional.empty();
        }
        return Optional.of(new TopOfBook(bestBid, bestAsk));
    }

    /**
     * Up to {@code levels} levels per side, as views over this snapshot's lists. Never more than the
     * snapshot holds, which is capped by {@code engine.snapshot.depth}.
     */
    public BookDepth depth(int levels) {
        int n = Math.max(levels, 0);
        return new BookDepth(symbol, version,
                bids.subList(0, Math.min(n, bids.size())),
                asks.subList(0, Math.min(n, asks.size())),
                bidLevelCount, askLevelCount);
    }
}
