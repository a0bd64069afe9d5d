package com.limitbook.engine.core.event;

import com.limitbook.engine.core.model.Order;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Carries a detached copy of the order as it was right after the change.
 */
@Getter
public class OrderStateChangedEvent extends ApplicationEvent {
    private final Order order;

    public OrderStateChangedEvent(Object source, Order order) {
        super(source);
        this.order = order;
    }
}
