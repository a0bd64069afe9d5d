package com.limitbook.engine.web.dto;

import com.limitbook.engine.core.model.OrderRequest;
import com.limitbook.engine.core.model.OrderSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    private String accountId; // Optional, defaults to engine.default-account
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private long quantity;

    public OrderRequest toOrderRequest() {
        return OrderRequest.builder()
                .accountId(accountId)
                .symbol(symbol)
                .side(side)
                .price(price)
                .quantity(quantity)
                .build();
    }
}
