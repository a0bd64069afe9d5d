package com.limitbook.engine.core.model;

import com.limitbook.engine.core.error.InternalInvariantViolationException;
import com.limitbook.engine.core.error.InvalidOrderException;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All order state of one symbol. Not thread-safe: the owning shard serialises every access.
 */
public class OrderBook {
    @Getter
    private final String symbol;
    @Getter
    private final BigDecimal tickSize;
    @Getter
    private final OrderBookSide bids = new OrderBookSide(OrderSide.BUY);
    @Getter
    private final OrderBookSide asks = new OrderBookSide(OrderSide.SELL);
    private final Map<Long, Order> orderIndex = new HashMap<>();

    private long lastOrderId;
    @Getter
    private long version;
    @Getter
    private long ordersProcessed;
    @Getter
    private long tradeCount;
    @Getter
    private long tradedVolume;

    public OrderBook(String symbol, BigDecimal tickSize) {
        if (tickSize == null || tickSize.signum() <= 0) {
            throw new IllegalArgumentException("Tick size of " + symbol + " must be positive: " + tickSize);
        }
        this.symbol = symbol;
        this.tickSize = tickSize;
    }

    public long nextOrderId() {
        return ++lastOrderId;
    }

    public long incrementVersion() {
        return ++version;
    }

    public void recordOrderProcessed() {
        ordersProcessed++;
    }

    public void recordTrade(long quantity) {
        tradeCount++;
        tradedVolume += quantity;
    }

    public void validatePrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new InvalidOrderException("Price must be positive: " + price);
        }
        if (price.remainder(tickSize).signum() != 0) {
            throw new InvalidOrderException("Price " + price + " is not a multiple of tick " + tickSize
                    + " for " + symbol);
        }
    }

    public void addRestingOrder(Order order) {
        validatePrice(order.getPrice());
        if (order.getRemainingQuantity() <= 0) {
            throw new InvalidOrderException("Order " + order.getId() + " has nothing left to rest");
        }
        if (orderIndex.containsKey(order.getId())) {
            throw new InvalidOrderException("Order " + order.getId() + " already rests in " + symbol + " book");
        }
        OrderBookSide opposite = oppositeSide(order.getSide());
        Optional<BigDecimal> oppositeBest = opposite.bestPrice();
        if (oppositeBest.isPresent() && opposite.isMarketable(oppositeBest.get(), order.getPrice())) {
            throw new InternalInvariantViolationException(symbol, "resting " + order.getSide() + " @ "
                    + order.getPrice() + " would cross opposite best " + oppositeBest.get());
        }
        side(order.getSide()).addOrder(order);
        orderIndex.put(order.getId(), order);
    }

    public Optional<Order> removeOrder(long orderId) {
        Order order = orderIndex.remove(orderId);
        if (order == null) {
            return Optional.empty();
        }
        return side(order.getSide()).removeOrder(order);
    }

    /**
     * Applies a fill to a resting maker. A maker with nothing left leaves the index and its level,
     * and the level leaves the side once empty.
     */
    public void fillRestingOrder(Order maker, long quantity) {
        OrderBookSide bookSide = side(maker.getSide());
        PriceLevel level = bookSide.getLevel(maker.getPrice());
        if (level == null) {
            throw new InternalInvariantViolationException(symbol, "no level at " + maker.getPrice()
                    + " for resting order " + maker.getId());
        }
        level.fill(maker, quantity);
        if (maker.isFullyFilled()) {
            orderIndex.remove(maker.getId());
        }
        bookSide.pruneIfEmpty(level);
    }

    public Optional<Order> findOrder(long orderId) {
        return Optional.ofNullable(orderIndex.get(orderId));
    }

    public Optional<BigDecimal> bestPrice(OrderSide side) {
        return side(side).bestPrice();
    }

    public List<DepthLevel> depth(OrderSide side, int levels) {
        return side(side).depth(levels);
    }

    public OrderBookSide side(OrderSide side) {
        return side == OrderSide.BUY ? bids : asks;
    }

    public OrderBookSide oppositeSide(OrderSide side) {
        return side(side.opposite());
    }

    public int getOrderCount() {
        return orderIndex.size();
    }

    public List<Order> openOrders() {
        List<Order> result = new ArrayList<>(orderIndex.size());
        orderIndex.values().forEach(order -> result.add(order.copy()));
        result.sort((a, b) -> Long.compare(a.getId(), b.getId()));
        return result;
    }

    public void checkNotCrossed() {
        Optional<BigDecimal> bestBid = bids.bestPrice();
        Optional<BigDecimal> bestAsk = asks.bestPrice();
        if (bestBid.isPresent() && bestAsk.isPresent() && bestBid.get().compareTo(bestAsk.get()) >= 0) {
            throw new InternalInvariantViolationException(symbol,
                    "crossed book: bid " + bestBid.get() + " >= ask " + bestAsk.get());
        }
    }

    /**
     * Full consistency check: never crossed, no empty level, every cached level total
     * matches its orders, and the index holds exactly the resting orders.
     */
    public void verifyInvariants() {
        checkNotCrossed();
        int resting = 0;
        for (OrderBookSide bookSide : List.of(bids, asks)) {
            for (PriceLevel level : bookSide.getLevels()) {
                if (level.isEmpty()) {
                    throw new InternalInvariantViolationException(symbol, "empty level at " + level.getPrice());
                }
                if (level.getTotalQuantity() != level.computeTotalQuantity()) {
                    throw new InternalInvariantViolationException(symbol, "level " + level.getPrice()
                            + " caches " + level.getTotalQuantity() + " but holds " + level.computeTotalQuantity());
                }
                resting += level.getOrderCount();
            }
        }
        if (resting != orderIndex.size()) {
            throw new InternalInvariantViolationException(symbol, "index holds " + orderIndex.size()
                    + " orders, levels hold " + resting);
        }
    }

    public void clear() {
        bids.clear();
        asks.clear();
        orderIndex.clear();
        incrementVersion();
    }
}
