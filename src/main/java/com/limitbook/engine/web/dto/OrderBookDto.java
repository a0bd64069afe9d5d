package com.limitbook.engine.web.dto;

import com.limitbook.engine.core.model.BookSnapshot;
import com.limitbook.engine.core.model.DepthLevel;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class OrderBookDto {
    private String symbol;
    private long version;
    private int depth;
    private BigDecimal bestBid;
    private BigDecimal bestAsk;
    private List<PriceLevelDto> bids;
    private List<PriceLevelDto> asks;
    private int bidLevelCount;
    private int askLevelCount;
    private long ordersProcessed;
    private long tradeCount;
    private long tradedVolume;
    private Instant timestamp;

    @Data
    @Builder
    public static class PriceLevelDto {
        private BigDecimal price;
        private long quantity;
        private int ordersCount;
    }

    public static OrderBookDto from(BookSnapshot snapshot, int depth) {
        var view = snapshot.depth(depth);
        return OrderBookDto.builder()
                .symbol(snapshot.getSymbol())
                .version(snapshot.getVersion())
                .depth(depth)
                .bestBid(snapshot.getBestBid())
                .bestAsk(snapshot.getBestAsk())
                .bids(toLevels(view.bids()))
                .asks(toLevels(view.asks()))
                .bidLevelCount(view.bidLevelCount())
                .askLevelCount(view.askLevelCount())
                .ordersProcessed(snapshot.getOrdersProcessed())
                .tradeCount(snapshot.getTradeCount())
                .tradedVolume(snapshot.getTradedVolume())
                .timestamp(snapshot.getTimestamp())
                .build();
    }

    private static List<PriceLevelDto> toLevels(List<DepthLevel> levels) {
        return levels.stream()
                .map(level -> PriceLevelDto.builder()
                        .price(level.price())
                        .quantity(level.quantity())
                        .ordersCount(level.orderCount())
                        .build())
                .collect(Collectors.toList());
    }
}
