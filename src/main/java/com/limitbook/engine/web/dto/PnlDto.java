package com.limitbook.engine.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class PnlDto {
    private String accountId;
    private String symbol;
    private long quantity;
    private BigDecimal markPrice;
    private BigDecimal unrealizedPnl;
    private BigDecimal realizedPnl;
}
