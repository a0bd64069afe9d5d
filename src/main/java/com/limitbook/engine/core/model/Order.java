package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@ToString
public class Order {
    private final long id;
    private final String symbol;
    private final String accountId;
    private final OrderSide side;
    private final BigDecimal price;
    private final long quantity; // Initial quantity
    @Builder.Default
    private long filledQuantity = 0;
    @Builder.Default
    private OrderStatus status = OrderStatus.NEW;
    @Builder.Default
    private final Instant createdAt = Instant.now();

    public long getRemainingQuantity() {
        return quantity - filledQuantity;
    }

    public void fill(long amount) {
        if (amount <= 0 || amount > getRemainingQuantity()) {
            throw new IllegalArgumentException("Fill of " + amount + " exceeds remaining "
                    + getRemainingQuantity() + " of order " + id);
        }
        this.filledQuantity += amount;
        this.status = filledQuantity == quantity ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
    }

    public void cancel() {
        this.status = OrderStatus.CANCELLED;
    }

    public boolean isFullyFilled() {
        return filledQuantity >= quantity;
    }

    /**
     * Detached copy for readers and event subscribers; later fills do not show through it.
     */
    public Order copy() {
        return toBuilder().build();
    }
}
