package com.limitbook.engine.core.concurrency;

import com.limitbook.engine.core.model.OrderBook;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Books of a multi-symbol transaction. Only symbols whose shards were locked by the
 * transaction are reachable from here.
 */
public class TransactionContext {
    private final Map<String, OrderBook> books;
    private final List<Integer> lockedShards;

    TransactionContext(Map<String, OrderBook> books, List<Integer> lockedShards) {
        this.books = Map.copyOf(books);
        this.lockedShards = List.copyOf(lockedShards);
    }

    public OrderBook book(String symbol) {
        OrderBook book = books.get(symbol);
        if (book == null) {
            throw new IllegalStateException("Symbol " + symbol + " is not part of this transaction " + books.keySet());
        }
        return book;
    }

    public Set<String> symbols() {
        return books.keySet();
    }

    /**
     * Shard indexes in the order they were locked.
     */
    public List<Integer> lockedShards() {
        return lockedShards;
    }
}
