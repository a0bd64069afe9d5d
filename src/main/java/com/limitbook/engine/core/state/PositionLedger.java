package com.limitbook.engine.core.state;

import com.limitbook.engine.core.model.Position;
import com.limitbook.engine.core.model.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Positions per account and symbol. Updated by the symbol's shard writer right after each
 * trade; each update replaces an immutable {@link Position}, so readers never lock and never
 * see half of an update.
 */
@Slf4j
@Service
public class PositionLedger {
    private final Map<PositionKey, Position> positions = new ConcurrentHashMap<>();

    /**
     * Books both counterparties of a trade: the buyer gains the quantity, the seller loses it.
     *
     * @return the buyer's and then the seller's position after the trade
     */
    public List<Position> apply(Trade trade) {
        Position buyer = update(trade.getBuyerAccountId(), trade.getSymbol(), trade.getQuantity(), trade.getPrice());
        Position seller = update(trade.getSellerAccountId(), trade.getSymbol(), -trade.getQuantity(), trade.getPrice());
        log.debug("LEDGER: trade {} {} qty={} @ {} -> buyer {} now {}, seller {} now {}",
                trade.getId(), trade.getSymbol(), trade.getQuantity(), trade.getPrice(),
                buyer.getAccountId(), buyer.getQuantity(), seller.getAccountId(), seller.getQuantity());
        return List.of(buyer, seller);
    }

    private Position update(String accountId, String symbol, long quantityDelta, BigDecimal price) {
        return positions.compute(new PositionKey(accountId, symbol),
                (key, current) -> (current != null ? current : Position.flat(accountId, symbol))
                        .applyFill(quantityDelta, price));
    }

    public Optional<Position> position(String accountId, String symbol) {
        return Optional.ofNullable(positions.get(new PositionKey(accountId, symbol)));
    }

    public List<Position> positions(String accountId) {
        return positions.values().stream()
                .filter(p -> p.getAccountId().equals(accountId))
                .sorted(Comparator.comparing(Position::getSymbol))
                .collect(Collectors.toList());
    }

    public BigDecimal unrealizedPnl(String accountId, String symbol, BigDecimal markPrice) {
        return position(accountId, symbol)
                .map(p -> p.unrealizedPnl(markPrice))
                .orElse(BigDecimal.ZERO);
    }

    public BigDecimal totalRealizedPnl(String accountId) {
        return positions(accountId).stream()
                .map(Position::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Sum of signed quantities over all accounts. Every trade adds as much to one side as it
     * removes from the other, so this stays zero.
     */
    public long netQuantity(String symbol) {
        return positions.values().stream()
                .filter(p -> p.getSymbol().equals(symbol))
                .mapToLong(Position::getQuantity)
                .sum();
    }

    private record PositionKey(String accountId, String symbol) {}
}
