package com.limitbook.engine.core.event;

import com.limitbook.engine.core.model.Position;
import com.limitbook.engine.core.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class PositionChangedEvent extends ApplicationEvent {
    private final Position position;
    private final Trade trade;

    public PositionChangedEvent(Object source, Position position, Trade trade) {
        super(source);
        this.position = position;
        this.trade = trade;
    }
}
