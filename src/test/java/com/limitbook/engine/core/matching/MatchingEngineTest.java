package com.limitbook.engine.core.matching;

import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.error.OrderNotFoundException;
import com.limitbook.engine.core.event.OrderStateChangedEvent;
import com.limitbook.engine.core.event.TradeExecutedEvent;
import com.limitbook.engine.core.model.Order;
import com.limitbook.engine.core.model.OrderBook;
import com.limitbook.engine.core.model.OrderSide;
import com.limitbook.engine.core.model.OrderStatus;
import com.limitbook.engine.core.model.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

class MatchingEngineTest {

    private OrderBook book;
    private MatchingEngine matchingEngine;
    private final String SYMBOL = "TEST";
    private final ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);

    @BeforeEach
    void setUp() {
        book = new OrderBook(SYMBOL, new BigDecimal("0.01"));
        matchingEngine = new MatchingEngine();
    }

    private Order createOrder(String account, OrderSide side, String price, long quantity) {
        return Order.builder()
                .id(book.nextOrderId())
                .symbol(SYMBOL)
                .accountId(account)
                .side(side)
                .price(new BigDecimal(price))
                .quantity(quantity)
                .build();
    }

    private List<Trade> submit(Order order) {
        List<Trade> trades = matchingEngine.submit(book, order, eventPublisher);
        book.verifyInvariants();
        return trades;
    }

    @Test
    void testPartialFillLeavesRestingRemainder() {
        Order buy = createOrder("maker", OrderSide.BUY, "100", 10);
        submit(buy);

        Order sell = createOrder("taker", OrderSide.SELL, "100", 4);
        List<Trade> trades = submit(sell);

        assertEquals(1, trades.size());
        assertEquals(0, new BigDecimal("100").compareTo(trades.get(0).getPrice()));
        assertEquals(4, trades.get(0).getQuantity());
        assertEquals(buy.getId(), trades.get(0).getMakerOrderId());
        assertEquals(sell.getId(), trades.get(0).getTakerOrderId());

        assertEquals(6, book.getBids().getLevel(new BigDecimal("100")).getTotalQuantity());
        assertEquals(OrderStatus.PARTIALLY_FILLED, buy.getStatus());
        assertEquals(OrderStatus.FILLED, sell.getStatus());
        assertTrue(book.findOrder(sell.getId()).isEmpty());
    }

    @Test
    void testTradeExecutesAtMakerPrice() {
        submit(createOrder("maker", OrderSide.SELL, "101", 5));

        Order buy = createOrder("taker", OrderSide.BUY, "102", 5);
        List<Trade> trades = submit(buy);

        assertEquals(1, trades.size());
        assertEquals(0, new BigDecimal("101").compareTo(trades.get(0).getPrice()));
        assertEquals(5, trades.get(0).getQuantity());
        assertTrue(book.getAsks().isEmpty());
        assertTrue(book.getBids().isEmpty());
    }

    @Test
    void testFifoAtSamePrice() {
        Order a = createOrder("a", OrderSide.SELL, "50", 3);
        Order b = createOrder("b", OrderSide.SELL, "50", 3);
        submit(a);
        submit(b);

        List<Trade> trades = submit(createOrder("taker", OrderSide.BUY, "50", 4));

        assertEquals(2, trades.size());
        assertEquals(a.getId(), trades.get(0).getMakerOrderId());
        assertEquals(3, trades.get(0).getQuantity());
        assertEquals(b.getId(), trades.get(1).getMakerOrderId());
        assertEquals(1, trades.get(1).getQuantity());
        assertEquals(OrderStatus.FILLED, a.getStatus());
        assertEquals(2, b.getRemainingQuantity());
    }

    @Test
    void testCancelledOrderLosesPriority() {
        Order a = createOrder("a", OrderSide.BUY, "50", 3);
        Order b = createOrder("b", OrderSide.BUY, "50", 3);
        submit(a);
        submit(b);
        matchingEngine.cancel(book, a.getId(), eventPublisher);

        List<Trade> trades = submit(createOrder("taker", OrderSide.SELL, "50", 3));

        assertEquals(1, trades.size());
        assertEquals(b.getId(), trades.get(0).getMakerOrderId());
    }

    @Test
    void testMultipleLevelExecution() {
        Order a = createOrder("a", OrderSide.SELL, "7.70", 50);
        Order b = createOrder("b", OrderSide.SELL, "7.70", 30);
        Order c = createOrder("c", OrderSide.SELL, "7.71", 100);
        submit(a);
        submit(b);
        submit(c);

        Order taker = createOrder("taker", OrderSide.BUY, "7.71", 150);
        List<Trade> trades = submit(taker);

        assertEquals(3, trades.size());
        assertTrue(a.isFullyFilled());
        assertTrue(b.isFullyFilled());
        assertEquals(70, c.getFilledQuantity());
        assertEquals(150, taker.getFilledQuantity());

        // L1 should be gone, L2 remains with C
        assertNull(book.getAsks().getLevel(new BigDecimal("7.70")));
        assertEquals(30, book.getAsks().getLevel(new BigDecimal("7.71")).getTotalQuantity());
    }

    @Test
    void testSweepStopsAtLimitAndRestsRemainder() {
        submit(createOrder("a", OrderSide.SELL, "100", 5));
        submit(createOrder("b", OrderSide.SELL, "101", 5));
        submit(createOrder("c", OrderSide.SELL, "103", 5));

        Order taker = createOrder("taker", OrderSide.BUY, "101", 20);
        List<Trade> trades = submit(taker);

        assertEquals(2, trades.size());
        assertEquals(10, taker.getFilledQuantity());
        assertEquals(OrderStatus.PARTIALLY_FILLED, taker.getStatus());
        assertEquals(new BigDecimal("101"), book.bestPrice(OrderSide.BUY).orElseThrow());
        assertEquals(new BigDecimal("103"), book.bestPrice(OrderSide.SELL).orElseThrow());
        assertEquals(10, book.getBids().getLevel(new BigDecimal("101")).getTotalQuantity());
    }

    @Test
    void testLimitOrderDoesNotExecuteWorsePrice() {
        Order sell = createOrder("a", OrderSide.SELL, "100", 10);
        submit(sell);

        Order buyLimit = createOrder("b", OrderSide.BUY, "99", 10);
        List<Trade> trades = submit(buyLimit);

        assertTrue(trades.isEmpty());
        assertEquals(0, sell.getFilledQuantity());
        assertEquals(OrderStatus.NEW, buyLimit.getStatus());
        assertEquals(new BigDecimal("99"), book.bestPrice(OrderSide.BUY).orElseThrow());
    }

    @Test
    void testSellSweepsBidsHighestFirst() {
        submit(createOrder("a", OrderSide.BUY, "98", 5));
        submit(createOrder("b", OrderSide.BUY, "99", 5));

        List<Trade> trades = submit(createOrder("taker", OrderSide.SELL, "98", 7));

        assertEquals(2, trades.size());
        assertEquals(0, new BigDecimal("99").compareTo(trades.get(0).getPrice()));
        assertEquals(5, trades.get(0).getQuantity());
        assertEquals(0, new BigDecimal("98").compareTo(trades.get(1).getPrice()));
        assertEquals(2, trades.get(1).getQuantity());
    }

    @Test
    void testInvalidOrdersRejectedWithoutMutation() {
        submit(createOrder("a", OrderSide.SELL, "100", 5));
        long version = book.getVersion();

        assertThrows(InvalidOrderException.class, () -> matchingEngine.submit(book,
                createOrder("b", OrderSide.BUY, "100", 0), eventPublisher));
        assertThrows(InvalidOrderException.class, () -> matchingEngine.submit(book,
                createOrder("b", OrderSide.BUY, "-1", 5), eventPublisher));
        assertThrows(InvalidOrderException.class, () -> matchingEngine.submit(book,
                createOrder("b", OrderSide.BUY, "100.001", 5), eventPublisher));
        Order otherSymbol = Order.builder().id(99).symbol("OTHER").accountId("b").side(OrderSide.BUY)
                .price(new BigDecimal("100")).quantity(5).build();
        assertThrows(InvalidOrderException.class, () -> matchingEngine.submit(book, otherSymbol, eventPublisher));

        assertEquals(version, book.getVersion());
        assertEquals(5, book.getAsks().getLevel(new BigDecimal("100")).getTotalQuantity());
    }

    @Test
    void testCancelTwiceIsOrderNotFound() {
        Order resting = createOrder("a", OrderSide.BUY, "10", 1);
        submit(resting);

        Order cancelled = matchingEngine.cancel(book, resting.getId(), eventPublisher);
        assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
        long version = book.getVersion();

        OrderNotFoundException e = assertThrows(OrderNotFoundException.class,
                () -> matchingEngine.cancel(book, resting.getId(), eventPublisher));
        assertEquals(resting.getId(), e.getOrderId());
        assertEquals(version, book.getVersion());
    }

    @Test
    void testCancelFilledOrderIsOrderNotFound() {
        Order resting = createOrder("a", OrderSide.BUY, "10", 2);
        submit(resting);
        submit(createOrder("b", OrderSide.SELL, "10", 2));

        assertThrows(OrderNotFoundException.class,
                () -> matchingEngine.cancel(book, resting.getId(), eventPublisher));
    }

    @Test
    void testPublishesTradeAndOrderEvents() {
        ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
        matchingEngine.submit(book, createOrder("a", OrderSide.SELL, "10", 2), events);
        matchingEngine.submit(book, createOrder("b", OrderSide.BUY, "10", 2), events);

        verify(events, times(1)).publishEvent(isA(TradeExecutedEvent.class));
        // resting sell, then maker fill, then taker completion
        verify(events, times(3)).publishEvent(isA(OrderStateChangedEvent.class));
    }

    @Test
    void testStatisticsAndVersion() {
        submit(createOrder("a", OrderSide.SELL, "10", 2));
        submit(createOrder("b", OrderSide.SELL, "11", 3));
        submit(createOrder("c", OrderSide.BUY, "11", 4));

        assertEquals(3, book.getOrdersProcessed());
        assertEquals(2, book.getTradeCount());
        assertEquals(4, book.getTradedVolume());
        assertEquals(3, book.getVersion());
    }
}
