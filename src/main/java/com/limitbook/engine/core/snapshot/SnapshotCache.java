package com.limitbook.engine.core.snapshot;

import com.limitbook.engine.core.error.InternalInvariantViolationException;
import com.limitbook.engine.core.model.BookSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest published snapshot per symbol. Only the symbol's shard writer publishes; readers take
 * the current reference without locking and keep a complete, immutable view for as long as
 * they hold it.
 */
@Slf4j
@Component
public class SnapshotCache {
    private final Map<String, AtomicReference<BookSnapshot>> snapshots = new ConcurrentHashMap<>();

    public void register(String symbol) {
        snapshots.computeIfAbsent(symbol, s -> new AtomicReference<>(BookSnapshot.empty(s)));
    }

    /**
     * Swaps in a newer snapshot. Must be called by the shard writer that owns the symbol.
     */
    public void publish(BookSnapshot snapshot) {
        AtomicReference<BookSnapshot> ref = snapshots.computeIfAbsent(snapshot.getSymbol(),
                s -> new AtomicReference<>(BookSnapshot.empty(s)));
        BookSnapshot current = ref.get();
        if (snapshot.getVersion() <= current.getVersion()) {
            throw new InternalInvariantViolationException(snapshot.getSymbol(), "snapshot version "
                    + snapshot.getVersion() + " is not newer than published " + current.getVersion());
        }
        ref.set(snapshot);
        log.trace("Published snapshot {} v{}", snapshot.getSymbol(), snapshot.getVersion());
    }

    public Optional<BookSnapshot> get(String symbol) {
        AtomicReference<BookSnapshot> ref = snapshots.get(symbol);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    public int size() {
        return snapshots.size();
    }
}
