package com.limitbook.engine.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubmitResult {
    String symbol;
    long orderId;
    OrderStatus status;
    long filledQuantity;
    long remainingQuantity;
    List<Trade> trades;
    /** Book version right after this submission. */
    long version;
}
