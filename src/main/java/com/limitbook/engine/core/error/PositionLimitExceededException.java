package com.limitbook.engine.core.error;

import lombok.Getter;

@Getter
public class PositionLimitExceededException extends EngineException {
    private final String accountId;
    private final String symbol;
    private final long projectedQuantity;
    private final long limit;

    public PositionLimitExceededException(String accountId, String symbol, long projectedQuantity, long limit) {
        super("Position of " + accountId + " in " + symbol + " would reach " + projectedQuantity
                + ", limit is " + limit);
        this.accountId = accountId;
        this.symbol = symbol;
        this.projectedQuantity = projectedQuantity;
        this.limit = limit;
    }
}
