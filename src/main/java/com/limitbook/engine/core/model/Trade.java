package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class Trade {
    private final UUID id;
    private final String symbol;
    private final long takerOrderId;
    private final long makerOrderId;
    private final String takerAccountId;
    private final String makerAccountId;
    private final OrderSide takerSide;
    private final BigDecimal price; // Always the maker's price
    private final long quantity;
    @Builder.Default
    private final Instant timestamp = Instant.now();

    public String getBuyerAccountId() {
        return takerSide == OrderSide.BUY ? takerAccountId : makerAccountId;
    }

    public String getSellerAccountId() {
        return takerSide == OrderSide.SELL ? takerAccountId : makerAccountId;
    }
}
