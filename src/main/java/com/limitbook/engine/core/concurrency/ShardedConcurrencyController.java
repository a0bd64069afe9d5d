package com.limitbook.engine.core.concurrency;

import com.limitbook.engine.config.EngineProperties;
import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.error.ShardBusyException;
import com.limitbook.engine.core.model.OrderBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Owns every order book, grouped into shards by symbol hash.
 * <p>
 * Single-symbol mutations run under that symbol's shard write lock. Mutations spanning several
 * symbols must go through {@link #executeInTransaction}, which locks the involved shards in
 * ascending shard index. Every caller agrees on that order, so no lock cycle can form.
 * Entering another shard while already holding one, for reading or writing, is rejected, and so
 * is writing to a shard from inside a read of it.
 */
@Slf4j
@Component
public class ShardedConcurrencyController {
    private final List<Shard> shards;
    private final Duration lockTimeout;

    public ShardedConcurrencyController(EngineProperties properties) {
        int count = properties.getShard().getCount();
        if (count < 1) {
            throw new IllegalArgumentException("engine.shard.count must be at least 1, got " + count);
        }
        this.shards = IntStream.range(0, count)
                .mapToObj(Shard::new)
                .collect(Collectors.toUnmodifiableList());
        this.lockTimeout = properties.getShard().getLockTimeout();

        for (EngineProperties.Symbol symbol : properties.getSymbols()) {
            registerSymbol(symbol.getName(), symbol.getTickSize());
        }
        log.info("Concurrency controller started: shards={}, lockTimeout={}, symbols={}",
                count, lockTimeout, symbols());
    }

    public int getShardCount() {
        return shards.size();
    }

    public int shardIndex(String symbol) {
        return Math.floorMod(symbol.hashCode(), shards.size());
    }

    /**
     * Adds a book for {@code symbol} to its shard. Returns false when the symbol already exists.
     */
    public boolean registerSymbol(String symbol, BigDecimal tickSize) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be blank");
        }
        Shard shard = shards.get(shardIndex(symbol));
        if (shard.owns(symbol)) {
            return false;
        }
        shard.register(symbol, tickSize);
        log.info("Registered symbol {} (tick {}) on {}", symbol, tickSize, shard);
        return true;
    }

    public boolean isKnown(String symbol) {
        return symbol != null && shards.get(shardIndex(symbol)).owns(symbol);
    }

    public Set<String> symbols() {
        Set<String> all = new TreeSet<>();
        shards.forEach(shard -> all.addAll(shard.symbols()));
        return all;
    }

    /**
     * Runs {@code operation} with exclusive access to the symbol's book.
     */
    public <T> T executeInShard(String symbol, Function<OrderBook, T> operation) {
        Shard shard = requireShard(symbol);
        checkNoOtherShardHeld(shard);
        checkNoReadLockHeld(shard);
        Lock writeLock = shard.getLock().writeLock();
        acquire(shard, writeLock);
        try {
            return operation.apply(shard.book(symbol));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs {@code operation} under the shard read lock. Concurrent readers proceed together,
     * writers of the same shard wait.
     */
    public <T> T readInShard(String symbol, Function<OrderBook, T> operation) {
        Shard shard = requireShard(symbol);
        checkNoOtherShardHeld(shard);
        Lock readLock = shard.getLock().readLock();
        readLock.lock();
        try {
            return operation.apply(shard.book(symbol));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * The only way to mutate several symbols atomically. Shards are locked in ascending index
     * regardless of the order the symbols are given in.
     */
    public <T> T executeInTransaction(Collection<String> symbols, Function<TransactionContext, T> operation) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("Transaction needs at least one symbol");
        }
        TreeMap<Integer, Shard> involved = new TreeMap<>();
        Map<String, Shard> bySymbol = new LinkedHashMap<>();
        for (String symbol : new TreeSet<>(symbols)) {
            Shard shard = requireShard(symbol);
            involved.put(shard.getIndex(), shard);
            bySymbol.put(symbol, shard);
        }
        for (Shard shard : involved.values()) {
            checkNoOtherShardHeld(shard);
            checkNoReadLockHeld(shard);
        }

        Deque<Lock> held = new ArrayDeque<>();
        try {
            for (Shard shard : involved.values()) {
                Lock writeLock = shard.getLock().writeLock();
                acquire(shard, writeLock);
                held.push(writeLock);
            }
            Map<String, OrderBook> books = new LinkedHashMap<>();
            bySymbol.forEach((symbol, shard) -> books.put(symbol, shard.book(symbol)));
            log.debug("Transaction locked shards {} for symbols {}", involved.keySet(), books.keySet());
            return operation.apply(new TransactionContext(books, List.copyOf(involved.keySet())));
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    private Shard requireShard(String symbol) {
        if (!isKnown(symbol)) {
            throw new InvalidOrderException("Unknown symbol: " + symbol);
        }
        return shards.get(shardIndex(symbol));
    }

    private void checkNoOtherShardHeld(Shard target) {
        for (Shard shard : shards) {
            if (shard != target && (shard.getLock().isWriteLockedByCurrentThread()
                    || shard.getLock().getReadHoldCount() > 0)) {
                throw new IllegalStateException("Thread already holds " + shard + " and may not enter " + target
                        + "; use executeInTransaction for multi-symbol work");
            }
        }
    }

    /**
     * A read lock cannot be upgraded; waiting for the write lock here would never return.
     */
    private void checkNoReadLockHeld(Shard target) {
        if (target.getLock().getReadHoldCount() > 0) {
            throw new IllegalStateException("Thread holds the read lock of " + target
                    + " and may not write to it from inside the read");
        }
    }

    private void acquire(Shard shard, Lock lock) {
        if (lockTimeout == null) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(lockTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Timed out after {} waiting for {}", lockTimeout, shard);
                throw new ShardBusyException(shard.getIndex());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShardBusyException(shard.getIndex(), e);
        }
    }
}
