package com.limitbook.engine.core.model;

import com.limitbook.engine.core.error.InternalInvariantViolationException;
import com.limitbook.engine.core.error.InvalidOrderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrderBookTest {

    private OrderBook book;
    private final String SYMBOL = "TEST";

    @BeforeEach
    void setUp() {
        book = new OrderBook(SYMBOL, new BigDecimal("0.01"));
    }

    private Order createOrder(OrderSide side, String price, long quantity) {
        return Order.builder()
                .id(book.nextOrderId())
                .symbol(SYMBOL)
                .accountId("test-account")
                .side(side)
                .price(new BigDecimal(price))
                .quantity(quantity)
                .build();
    }

    @Test
    void testAddAndRemoveOrder() {
        Order order = createOrder(OrderSide.BUY, "100", 10);
        book.addRestingOrder(order);

        assertEquals(order, book.findOrder(order.getId()).orElseThrow());
        assertEquals(new BigDecimal("100"), book.bestPrice(OrderSide.BUY).orElseThrow());

        Optional<Order> removed = book.removeOrder(order.getId());
        assertTrue(removed.isPresent());
        assertTrue(book.findOrder(order.getId()).isEmpty());
        assertTrue(book.bestPrice(OrderSide.BUY).isEmpty());
        assertEquals(0, book.getBids().getLevelCount());
    }

    @Test
    void testRemoveAbsentOrderReturnsEmpty() {
        assertTrue(book.removeOrder(42).isEmpty());

        Order order = createOrder(OrderSide.SELL, "101", 5);
        book.addRestingOrder(order);
        assertTrue(book.removeOrder(order.getId()).isPresent());
        assertTrue(book.removeOrder(order.getId()).isEmpty());
    }

    @Test
    void testBestBidAsk() {
        book.addRestingOrder(createOrder(OrderSide.BUY, "100", 10));
        book.addRestingOrder(createOrder(OrderSide.BUY, "101", 10)); // Best bid

        book.addRestingOrder(createOrder(OrderSide.SELL, "105", 10)); // Best ask
        book.addRestingOrder(createOrder(OrderSide.SELL, "106", 10));

        assertEquals(new BigDecimal("101"), book.bestPrice(OrderSide.BUY).orElseThrow());
        assertEquals(new BigDecimal("105"), book.bestPrice(OrderSide.SELL).orElseThrow());
    }

    @Test
    void testDepthAggregatesLevelsBestFirst() {
        for (int i = 0; i < 15; i++) {
            book.addRestingOrder(createOrder(OrderSide.BUY, String.valueOf(100 - i), 10));
        }
        book.addRestingOrder(createOrder(OrderSide.BUY, "100", 5));

        List<DepthLevel> depth = book.depth(OrderSide.BUY, 10);
        assertEquals(10, depth.size());
        assertEquals(new BigDecimal("100"), depth.get(0).price());
        assertEquals(15, depth.get(0).quantity());
        assertEquals(2, depth.get(0).orderCount());
        assertEquals(new BigDecimal("91"), depth.get(9).price());

        assertEquals(15, book.depth(OrderSide.BUY, 20).size());
        assertTrue(book.depth(OrderSide.SELL, 5).isEmpty());
    }

    @Test
    void testAsksAscending() {
        book.addRestingOrder(createOrder(OrderSide.SELL, "103", 1));
        book.addRestingOrder(createOrder(OrderSide.SELL, "101", 1));
        book.addRestingOrder(createOrder(OrderSide.SELL, "102", 1));

        List<DepthLevel> depth = book.depth(OrderSide.SELL, 3);
        assertEquals(new BigDecimal("101"), depth.get(0).price());
        assertEquals(new BigDecimal("102"), depth.get(1).price());
        assertEquals(new BigDecimal("103"), depth.get(2).price());
    }

    @Test
    void testRejectsNonPositiveOrMisalignedPrice() {
        assertThrows(InvalidOrderException.class, () -> book.addRestingOrder(createOrder(OrderSide.BUY, "0", 1)));
        assertThrows(InvalidOrderException.class, () -> book.addRestingOrder(createOrder(OrderSide.BUY, "-5", 1)));
        assertThrows(InvalidOrderException.class, () -> book.addRestingOrder(createOrder(OrderSide.BUY, "100.005", 1)));
        assertEquals(0, book.getOrderCount());
    }

    @Test
    void testTickAlignmentIgnoresScale() {
        OrderBook halfTick = new OrderBook("HALF", new BigDecimal("0.5"));
        Order aligned = Order.builder().id(1).symbol("HALF").accountId("a").side(OrderSide.BUY)
                .price(new BigDecimal("100.50")).quantity(1).build();
        Order misaligned = Order.builder().id(2).symbol("HALF").accountId("a").side(OrderSide.BUY)
                .price(new BigDecimal("100.25")).quantity(1).build();

        halfTick.addRestingOrder(aligned);
        assertThrows(InvalidOrderException.class, () -> halfTick.addRestingOrder(misaligned));
    }

    @Test
    void testRestingACrossingOrderIsAnInvariantViolation() {
        book.addRestingOrder(createOrder(OrderSide.SELL, "100", 10));

        assertThrows(InternalInvariantViolationException.class,
                () -> book.addRestingOrder(createOrder(OrderSide.BUY, "100", 1)));
        assertTrue(book.bestPrice(OrderSide.BUY).isEmpty());
    }

    @Test
    void testFillRestingOrderPrunesLevelAndIndex() {
        Order a = createOrder(OrderSide.SELL, "100", 4);
        Order b = createOrder(OrderSide.SELL, "100", 6);
        book.addRestingOrder(a);
        book.addRestingOrder(b);

        book.fillRestingOrder(a, 4);
        assertTrue(book.findOrder(a.getId()).isEmpty());
        assertEquals(6, book.getAsks().getLevel(new BigDecimal("100")).getTotalQuantity());

        book.fillRestingOrder(b, 2);
        assertEquals(4, book.getAsks().getLevel(new BigDecimal("100")).getTotalQuantity());
        book.verifyInvariants();

        book.fillRestingOrder(b, 4);
        assertNull(book.getAsks().getLevel(new BigDecimal("100")));
        assertEquals(0, book.getOrderCount());
        book.verifyInvariants();
    }

    @Test
    void testOpenOrdersAreDetachedCopies() {
        Order order = createOrder(OrderSide.BUY, "99", 10);
        book.addRestingOrder(order);

        Order copy = book.openOrders().get(0);
        order.fill(3);

        assertEquals(0, copy.getFilledQuantity());
        assertEquals(OrderStatus.NEW, copy.getStatus());
    }

    @Test
    void testClearEmptiesBookAndBumpsVersion() {
        book.addRestingOrder(createOrder(OrderSide.BUY, "99", 10));
        book.addRestingOrder(createOrder(OrderSide.SELL, "101", 10));
        long before = book.getVersion();

        book.clear();

        assertEquals(0, book.getOrderCount());
        assertTrue(book.getBids().isEmpty());
        assertTrue(book.getAsks().isEmpty());
        assertEquals(before + 1, book.getVersion());
    }
}
