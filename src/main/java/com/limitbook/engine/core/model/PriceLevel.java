package com.limitbook.engine.core.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resting orders at one price. Iteration order of the backing map is insertion order,
 * which is the time priority of the level.
 */
public class PriceLevel {
    private final BigDecimal price;
    private final Map<Long, Order> orders = new LinkedHashMap<>();
    private long totalQuantity;

    public PriceLevel(BigDecimal price) {
        this.price = price;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public long getTotalQuantity() {
        return totalQuantity;
    }

    public int getOrderCount() {
        return orders.size();
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public void addOrder(Order order) {
        if (order.getPrice().compareTo(price) != 0) {
            throw new IllegalArgumentException("Order " + order.getId() + " price " + order.getPrice()
                    + " does not belong to level " + price);
        }
        if (orders.containsKey(order.getId())) {
            return;
        }
        long newTotal = Math.addExact(totalQuantity, order.getRemainingQuantity());
        orders.put(order.getId(), order);
        totalQuantity = newTotal;
    }

    /**
     * Whether {@code quantity} more can rest here without the level total overflowing.
     */
    public boolean canAccept(long quantity) {
        return quantity <= Long.MAX_VALUE - totalQuantity;
    }

    public Optional<Order> removeOrder(long orderId) {
        Order removed = orders.remove(orderId);
        if (removed != null) {
            totalQuantity -= removed.getRemainingQuantity();
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Oldest order on the level, or {@code null} when the level is empty.
     */
    public Order peekFirst() {
        return orders.isEmpty() ? null : orders.values().iterator().next();
    }

    /**
     * Fills a resting order and evicts it from the level once it has nothing left.
     */
    public void fill(Order order, long quantity) {
        if (!orders.containsKey(order.getId())) {
            throw new IllegalArgumentException("Order " + order.getId() + " is not resting at " + price);
        }
        order.fill(quantity);
        totalQuantity -= quantity;
        if (order.isFullyFilled()) {
            orders.remove(order.getId());
        }
    }

    public List<Order> getOrdersSortedByTime() {
        return List.copyOf(orders.values());
    }

    /**
     * Sum of remaining quantities recomputed from the orders, for checking the cached total.
     */
    public long computeTotalQuantity() {
        return orders.values().stream()
                .mapToLong(Order::getRemainingQuantity)
                .sum();
    }
}
