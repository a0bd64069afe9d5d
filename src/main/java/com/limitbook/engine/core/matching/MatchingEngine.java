package com.limitbook.engine.core.matching;

import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.error.OrderNotFoundException;
import com.limitbook.engine.core.event.OrderStateChangedEvent;
import com.limitbook.engine.core.event.TradeExecutedEvent;
import com.limitbook.engine.core.model.Order;
import com.limitbook.engine.core.model.OrderBook;
import com.limitbook.engine.core.model.OrderBookSide;
import com.limitbook.engine.core.model.OrderSide;
import com.limitbook.engine.core.model.PriceLevel;
import com.limitbook.engine.core.model.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Price-time priority matching. Callers must hold the write lock of the book's shard.
 */
@Slf4j
@Service
public class MatchingEngine {

    /**
     * Rejects an order that must not touch the book. Throws before anything is mutated.
     */
    public void validate(OrderBook book, String symbol, OrderSide side, BigDecimal price, long quantity) {
        if (!book.getSymbol().equals(symbol)) {
            throw new InvalidOrderException("Order for " + symbol + " routed to " + book.getSymbol() + " book");
        }
        if (side == null) {
            throw new InvalidOrderException("Side is required");
        }
        if (quantity <= 0) {
            throw new InvalidOrderException("Quantity must be positive: " + quantity);
        }
        book.validatePrice(price);
        checkLevelCapacity(book, side, price, quantity);
    }

    /**
     * Rejects {@code quantity} when resting it at {@code price} would overflow the level total.
     */
    public void checkLevelCapacity(OrderBook book, OrderSide side, BigDecimal price, long quantity) {
        PriceLevel level = book.side(side).getLevel(price);
        if (level != null && !level.canAccept(quantity)) {
            throw new InvalidOrderException("Quantity " + quantity + " would overflow the " + side + " level "
                    + price + " of " + book.getSymbol() + " holding " + level.getTotalQuantity());
        }
    }

    public List<Trade> submit(OrderBook book, Order taker, ApplicationEventPublisher events) {
        validate(book, taker.getSymbol(), taker.getSide(), taker.getPrice(), taker.getQuantity());

        log.info("MATCHING: Starting execution of order {} [{}] {} @ {} qty={}",
                taker.getId(), taker.getAccountId(), taker.getSide(), taker.getPrice(), taker.getQuantity());

        book.recordOrderProcessed();
        List<Trade> trades = new ArrayList<>();
        OrderBookSide opposite = book.oppositeSide(taker.getSide());

        while (taker.getRemainingQuantity() > 0) {
            PriceLevel level = opposite.bestLevel().orElse(null);
            if (level == null) {
                log.debug("MATCHING: Opposite side is empty, stopping");
                break;
            }
            if (!opposite.isMarketable(level.getPrice(), taker.getPrice())) {
                log.debug("MATCHING: {} limit {} does not reach best level {}, stopping",
                        taker.getSide(), taker.getPrice(), level.getPrice());
                break;
            }
            matchLevel(book, level, taker, trades, events);
        }

        if (taker.getRemainingQuantity() > 0) {
            log.debug("MATCHING: Resting remainder {} of order {} at {}",
                    taker.getRemainingQuantity(), taker.getId(), taker.getPrice());
            book.addRestingOrder(taker);
        }
        book.checkNotCrossed();
        book.incrementVersion();
        events.publishEvent(new OrderStateChangedEvent(this, taker.copy()));

        log.info("MATCHING: Order {} execution completed: {} trades, remaining qty={}, status={}",
                taker.getId(), trades.size(), taker.getRemainingQuantity(), taker.getStatus());
        return trades;
    }

    /**
     * Consumes makers at one level oldest first until the taker or the level runs out.
     */
    private void matchLevel(OrderBook book, PriceLevel level, Order taker, List<Trade> trades,
                            ApplicationEventPublisher events) {
        while (taker.getRemainingQuantity() > 0 && !level.isEmpty()) {
            Order maker = level.peekFirst();
            long quantity = Math.min(taker.getRemainingQuantity(), maker.getRemainingQuantity());

            Trade trade = Trade.builder()
                    .id(UUID.randomUUID())
                    .symbol(book.getSymbol())
                    .takerOrderId(taker.getId())
                    .makerOrderId(maker.getId())
                    .takerAccountId(taker.getAccountId())
                    .makerAccountId(maker.getAccountId())
                    .takerSide(taker.getSide())
                    .price(maker.getPrice())
                    .quantity(quantity)
                    .build();

            book.fillRestingOrder(maker, quantity);
            taker.fill(quantity);
            book.recordTrade(quantity);
            trades.add(trade);

            log.info("TRADE: {} | taker={} [{}] vs maker={} [{}] | {} {} @ {} | qty={}",
                    trade.getId(),
                    taker.getId(), taker.getAccountId(),
                    maker.getId(), maker.getAccountId(),
                    book.getSymbol(), taker.getSide(), trade.getPrice(), quantity);

            events.publishEvent(new TradeExecutedEvent(this, trade));
            events.publishEvent(new OrderStateChangedEvent(this, maker.copy()));
        }
    }

    /**
     * Removes a resting order. A second cancel, or a cancel that lost the race to a fill,
     * gets {@link OrderNotFoundException} and changes nothing.
     */
    public Order cancel(OrderBook book, long orderId, ApplicationEventPublisher events) {
        Order order = book.removeOrder(orderId)
                .orElseThrow(() -> new OrderNotFoundException(book.getSymbol(), orderId));
        order.cancel();
        book.incrementVersion();
        log.info("CANCEL: Order {} {} {} @ {} cancelled with {} unfilled",
                orderId, book.getSymbol(), order.getSide(), order.getPrice(), order.getRemainingQuantity());
        Order copy = order.copy();
        events.publishEvent(new OrderStateChangedEvent(this, copy));
        return copy;
    }
}
