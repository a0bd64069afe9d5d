package com.limitbook.engine.core.service;

import com.limitbook.engine.config.EngineProperties;
import com.limitbook.engine.core.concurrency.ShardedConcurrencyController;
import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.event.BookSnapshotPublishedEvent;
import com.limitbook.engine.core.event.DeferredEventPublisher;
import com.limitbook.engine.core.event.OrderedEventDispatcher;
import com.limitbook.engine.core.event.PositionChangedEvent;
import com.limitbook.engine.core.matching.MatchingEngine;
import com.limitbook.engine.core.model.BookDepth;
import com.limitbook.engine.core.model.BookSnapshot;
import com.limitbook.engine.core.model.Order;
import com.limitbook.engine.core.model.OrderBook;
import com.limitbook.engine.core.model.OrderRequest;
import com.limitbook.engine.core.model.OrderSide;
import com.limitbook.engine.core.model.Position;
import com.limitbook.engine.core.model.SubmitResult;
import com.limitbook.engine.core.model.TopOfBook;
import com.limitbook.engine.core.model.Trade;
import com.limitbook.engine.core.risk.PositionLimitChecker;
import com.limitbook.engine.core.snapshot.SnapshotCache;
import com.limitbook.engine.core.state.PositionLedger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Synchronous entry point used by transports and other collaborators.
 * <p>
 * Writes run inside the symbol's shard: risk check, matching, ledger update and snapshot
 * publication happen in one critical section. Events raised meanwhile are queued before the lock
 * is released and delivered after it, in the order the writes happened. Reads go to the snapshot cache and the ledger and never take a writer lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingService {
    private final ShardedConcurrencyController concurrencyController;
    private final MatchingEngine matchingEngine;
    private final PositionLedger positionLedger;
    private final PositionLimitChecker positionLimitChecker;
    private final SnapshotCache snapshotCache;
    private final ApplicationEventPublisher eventPublisher;
    private final EngineProperties properties;
    private final OrderedEventDispatcher dispatcher = new OrderedEventDispatcher();

    @PostConstruct
    public void init() {
        concurrencyController.symbols().forEach(snapshotCache::register);
        log.info("Trading service ready: symbols={}, defaultAccount={}, snapshotDepth={}",
                concurrencyController.symbols(), properties.getDefaultAccount(), properties.getSnapshot().getDepth());
    }

    public boolean registerSymbol(String symbol, BigDecimal tickSize) {
        boolean added = concurrencyController.registerSymbol(symbol, tickSize);
        snapshotCache.register(symbol);
        return added;
    }

    public SubmitResult submitOrder(String symbol, OrderSide side, BigDecimal price, long quantity) {
        return submitOrder(null, symbol, side, price, quantity);
    }

    public SubmitResult submitOrder(String accountId, String symbol, OrderSide side, BigDecimal price, long quantity) {
        String account = resolveAccount(accountId);
        DeferredEventPublisher events = new DeferredEventPublisher();
        SubmitResult result = concurrencyController.executeInShard(symbol, book -> {
            matchingEngine.validate(book, symbol, side, price, quantity);
            positionLimitChecker.check(account, symbol, side.sign() * quantity);
            SubmitResult submitted = execute(book, account, side, price, quantity, events);
            dispatcher.enqueue(events);
            return submitted;
        });
        dispatcher.dispatchTo(eventPublisher);
        return result;
    }

    /**
     * Submits orders across several symbols as one unit. Every leg is validated and risk-checked
     * before the first one touches a book, so a rejected basket leaves no trace.
     */
    public List<SubmitResult> submitBasket(List<OrderRequest> legs) {
        if (legs == null || legs.isEmpty()) {
            throw new InvalidOrderException("Basket has no orders");
        }
        if (legs.stream().anyMatch(Objects::isNull)) {
            throw new InvalidOrderException("Basket contains an empty order");
        }
        if (legs.stream().anyMatch(leg -> leg.getSymbol() == null)) {
            throw new InvalidOrderException("Every basket order needs a symbol");
        }
        List<String> symbols = legs.stream().map(OrderRequest::getSymbol).collect(Collectors.toList());
        DeferredEventPublisher events = new DeferredEventPublisher();

        List<SubmitResult> results = concurrencyController.executeInTransaction(symbols, tx -> {
            Map<String, Map<String, Long>> deltas = new LinkedHashMap<>();
            Map<String, Long> restingByLevel = new HashMap<>();
            for (OrderRequest leg : legs) {
                OrderBook book = tx.book(leg.getSymbol());
                matchingEngine.validate(book, leg.getSymbol(), leg.getSide(), leg.getPrice(), leg.getQuantity());
                long levelQuantity = restingByLevel.merge(
                        leg.getSymbol() + "|" + leg.getSide() + "|" + leg.getPrice().stripTrailingZeros().toPlainString(),
                        leg.getQuantity(), TradingService::addWithoutOverflow);
                matchingEngine.checkLevelCapacity(book, leg.getSide(), leg.getPrice(), levelQuantity);
                deltas.computeIfAbsent(resolveAccount(leg.getAccountId()), a -> new LinkedHashMap<>())
                        .merge(leg.getSymbol(), leg.getSide().sign() * leg.getQuantity(),
                                TradingService::addWithoutOverflow);
            }
            deltas.forEach((account, bySymbol) ->
                    bySymbol.forEach((symbol, delta) -> positionLimitChecker.check(account, symbol, delta)));

            List<SubmitResult> submitted = new ArrayList<>(legs.size());
            for (OrderRequest leg : legs) {
                submitted.add(execute(tx.book(leg.getSymbol()), resolveAccount(leg.getAccountId()),
                        leg.getSide(), leg.getPrice(), leg.getQuantity(), events));
            }
            dispatcher.enqueue(events);
            return submitted;
        });
        dispatcher.dispatchTo(eventPublisher);
        log.info("BASKET: {} legs over {} executed", legs.size(), symbols);
        return results;
    }

    /**
     * @throws com.limitbook.engine.core.error.OrderNotFoundException when the order is no longer resting
     */
    public void cancelOrder(String symbol, long orderId) {
        DeferredEventPublisher events = new DeferredEventPublisher();
        concurrencyController.executeInShard(symbol, book -> {
            matchingEngine.cancel(book, orderId, events);
            publishSnapshot(book, events);
            dispatcher.enqueue(events);
            return null;
        });
        dispatcher.dispatchTo(eventPublisher);
    }

    /**
     * Drops every resting order of a symbol. Positions are kept.
     */
    public void clearBook(String symbol) {
        DeferredEventPublisher events = new DeferredEventPublisher();
        concurrencyController.executeInShard(symbol, book -> {
            book.clear();
            publishSnapshot(book, events);
            dispatcher.enqueue(events);
            return null;
        });
        dispatcher.dispatchTo(eventPublisher);
        log.info("Book {} cleared", symbol);
    }

    public Optional<TopOfBook> bestBidAsk(String symbol) {
        return snapshotCache.get(symbol).flatMap(BookSnapshot::topOfBook);
    }

    /**
     * At most {@code engine.snapshot.depth} levels per side are returned whatever {@code levels} asks
     * for; {@link BookDepth#isTruncated()} tells whether the book holds more.
     */
    public BookDepth depth(String symbol, int levels) {
        return snapshotCache.get(symbol)
                .map(snapshot -> snapshot.depth(levels))
                .orElseGet(() -> BookDepth.empty(symbol));
    }

    public Optional<BookSnapshot> snapshot(String symbol) {
        return snapshotCache.get(symbol);
    }

    public Optional<Position> position(String symbol) {
        return position(null, symbol);
    }

    public Optional<Position> position(String accountId, String symbol) {
        return positionLedger.position(resolveAccount(accountId), symbol);
    }

    public List<Position> positions(String accountId) {
        return positionLedger.positions(resolveAccount(accountId));
    }

    public BigDecimal unrealizedPnl(String symbol, BigDecimal markPrice) {
        return unrealizedPnl(null, symbol, markPrice);
    }

    public BigDecimal unrealizedPnl(String accountId, String symbol, BigDecimal markPrice) {
        if (markPrice == null || markPrice.signum() <= 0) {
            throw new IllegalArgumentException("Mark price must be positive: " + markPrice);
        }
        return positionLedger.unrealizedPnl(resolveAccount(accountId), symbol, markPrice);
    }

    /**
     * Copies of the resting orders, read under the shard read lock.
     */
    public List<Order> openOrders(String symbol) {
        return concurrencyController.readInShard(symbol, OrderBook::openOrders);
    }

    private SubmitResult execute(OrderBook book, String accountId, OrderSide side, BigDecimal price,
                                 long quantity, DeferredEventPublisher events) {
        Order order = Order.builder()
                .id(book.nextOrderId())
                .symbol(book.getSymbol())
                .accountId(accountId)
                .side(side)
                .price(price)
                .quantity(quantity)
                .build();

        List<Trade> trades = matchingEngine.submit(book, order, events);
        for (Trade trade : trades) {
            for (Position position : positionLedger.apply(trade)) {
                events.publishEvent(new PositionChangedEvent(this, position, trade));
            }
        }
        BookSnapshot snapshot = publishSnapshot(book, events);

        return SubmitResult.builder()
                .symbol(book.getSymbol())
                .orderId(order.getId())
                .status(order.getStatus())
                .filledQuantity(order.getFilledQuantity())
                .remainingQuantity(order.getRemainingQuantity())
                .trades(List.copyOf(trades))
                .version(snapshot.getVersion())
                .build();
    }

    private BookSnapshot publishSnapshot(OrderBook book, DeferredEventPublisher events) {
        BookSnapshot snapshot = BookSnapshot.of(book, properties.getSnapshot().getDepth());
        snapshotCache.publish(snapshot);
        events.publishEvent(new BookSnapshotPublishedEvent(this, snapshot));
        return snapshot;
    }

    private static Long addWithoutOverflow(Long a, Long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidOrderException("Basket quantities overflow: " + a + " + " + b);
        }
    }

    /**
     * The account an operation acts on: {@code accountId}, or the default account when it is null or blank.
     */
    public String resolveAccount(String accountId) {
        return accountId == null || accountId.isBlank() ? properties.getDefaultAccount() : accountId;
    }
}
