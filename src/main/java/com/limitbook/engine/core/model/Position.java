package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable position of one account in one symbol. Quantity is signed: + long, - short.
 * {@code averagePrice} is zero and meaningless while the position is flat.
 */
@Value
@Builder(toBuilder = true)
public class Position {
    private static final int PRICE_SCALE = 9;

    String accountId;
    String symbol;
    long quantity;
    BigDecimal averagePrice;
    BigDecimal realizedPnl;

    public static Position flat(String accountId, String symbol) {
        return Position.builder()
                .accountId(accountId)
                .symbol(symbol)
                .quantity(0)
                .averagePrice(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    /**
     * Position after a fill of {@code quantityDelta} (signed) at {@code executionPrice}.
     */
    public Position applyFill(long quantityDelta, BigDecimal executionPrice) {
        if (quantityDelta == 0) {
            return this;
        }
        long newQuantity = this.quantity + quantityDelta;
        boolean increasing = this.quantity == 0 || Long.signum(this.quantity) == Long.signum(quantityDelta);

        if (increasing) {
            // Adding to the position: weighted average cost
            BigDecimal newAverage;
            if (this.quantity == 0) {
                newAverage = executionPrice;
            } else {
                BigDecimal oldValue = averagePrice.multiply(BigDecimal.valueOf(Math.abs(this.quantity)));
                BigDecimal newValue = executionPrice.multiply(BigDecimal.valueOf(Math.abs(quantityDelta)));
                newAverage = oldValue.add(newValue)
                        .divide(BigDecimal.valueOf(Math.abs(newQuantity)), PRICE_SCALE, RoundingMode.HALF_UP);
            }
            return toBuilder().quantity(newQuantity).averagePrice(newAverage).build();
        }

        long closed = Math.min(Math.abs(quantityDelta), Math.abs(this.quantity));
        BigDecimal perUnit = this.quantity > 0
                ? executionPrice.subtract(averagePrice)
                : averagePrice.subtract(executionPrice);
        BigDecimal newRealized = realizedPnl.add(perUnit.multiply(BigDecimal.valueOf(closed)));

        BigDecimal newAverage;
        if (newQuantity == 0) {
            newAverage = BigDecimal.ZERO;
        } else if (Long.signum(newQuantity) != Long.signum(this.quantity)) {
            // Flipped through zero: the remainder opens at the fill price
            newAverage = executionPrice;
        } else {
            // Partial close keeps the cost basis
            newAverage = averagePrice;
        }
        return toBuilder()
                .quantity(newQuantity)
                .averagePrice(newAverage)
                .realizedPnl(newRealized)
                .build();
    }

    public BigDecimal unrealizedPnl(BigDecimal markPrice) {
        if (quantity == 0) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(averagePrice).multiply(BigDecimal.valueOf(quantity));
    }
}
