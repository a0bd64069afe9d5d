package com.limitbook.engine.core.error;

import lombok.Getter;

/**
 * The order is not resting: it was filled, already cancelled or never existed.
 * Losing a cancel race to a fill ends here too.
 */
@Getter
public class OrderNotFoundException extends EngineException {
    private final String symbol;
    private final long orderId;

    public OrderNotFoundException(String symbol, long orderId) {
        super("Order " + orderId + " is not resting in " + symbol + " book");
        this.symbol = symbol;
        this.orderId = orderId;
    }
}
