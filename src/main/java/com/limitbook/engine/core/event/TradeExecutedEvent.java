package com.limitbook.engine.core.event;

import com.limitbook.engine.core.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class TradeExecutedEvent extends ApplicationEvent {
    private final Trade trade;

    public TradeExecutedEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }
}
