package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One leg of a basket submission. A {@code null} account means the default account.
 */
@Value
@Builder
public class OrderRequest {
    String accountId;
    String symbol;
    OrderSide side;
    BigDecimal price;
    long quantity;
}
