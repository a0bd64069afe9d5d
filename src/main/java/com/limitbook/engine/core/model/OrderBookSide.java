package com.limitbook.engine.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Price levels of one side of a book, best price first.
 * Bids: High to Low (Descending). Asks: Low to High (Ascending).
 */
public class OrderBookSide {
    private final OrderSide side;
    private final NavigableMap<BigDecimal, PriceLevel> levels;

    public OrderBookSide(OrderSide side) {
        this.side = side;
        this.levels = side == OrderSide.BUY
                ? new TreeMap<>(Comparator.reverseOrder())
                : new TreeMap<>();
    }

    public OrderSide getSide() {
        return side;
    }

    public void addOrder(Order order) {
        levels.computeIfAbsent(order.getPrice(), PriceLevel::new).addOrder(order);
    }

    /**
     * Removes a resting order, dropping its level when that was the last order on it.
     */
    public Optional<Order> removeOrder(Order order) {
        PriceLevel level = levels.get(order.getPrice());
        if (level == null) {
            return Optional.empty();
        }
        Optional<Order> removed = level.removeOrder(order.getId());
        pruneIfEmpty(level);
        return removed;
    }

    public void pruneIfEmpty(PriceLevel level) {
        if (level.isEmpty()) {
            levels.remove(level.getPrice());
        }
    }

    public Optional<PriceLevel> bestLevel() {
        Map.Entry<BigDecimal, PriceLevel> best = levels.firstEntry();
        return best == null ? Optional.empty() : Optional.of(best.getValue());
    }

    public Optional<BigDecimal> bestPrice() {
        return levels.isEmpty() ? Optional.empty() : Optional.of(levels.firstKey());
    }

    /**
     * Whether a resting level at {@code levelPrice} on this side can trade with an incoming
     * order limited at {@code limitPrice} from the other side.
     */
    public boolean isMarketable(BigDecimal levelPrice, BigDecimal limitPrice) {
        int cmp = levelPrice.compareTo(limitPrice);
        return side == OrderSide.SELL ? cmp <= 0 : cmp >= 0;
    }

    public PriceLevel getLevel(BigDecimal price) {
        return levels.get(price);
    }

    public List<DepthLevel> depth(int maxLevels) {
        List<DepthLevel> result = new ArrayList<>(Math.min(Math.max(maxLevels, 0), levels.size()));
        for (PriceLevel level : levels.values()) {
            if (result.size() >= maxLevels) {
                break;
            }
            result.add(DepthLevel.of(level));
        }
        return result;
    }

    public Collection<PriceLevel> getLevels() {
        return Collections.unmodifiableCollection(levels.values());
    }

    public int getLevelCount() {
        return levels.size();
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    void clear() {
        levels.clear();
    }
}
