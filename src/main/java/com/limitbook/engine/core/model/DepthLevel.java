package com.limitbook.engine.core.model;

import java.math.BigDecimal;

/**
 * Aggregated view of one price level: price, total remaining quantity and number of orders.
 */
public record DepthLevel(BigDecimal price, long quantity, int orderCount) {

    static DepthLevel of(PriceLevel level) {
        return new DepthLevel(level.getPrice(), level.getTotalQuantity(), level.getOrderCount());
    }
}
