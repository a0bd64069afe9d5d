package com.limitbook.engine.core.risk;

import com.limitbook.engine.config.EngineProperties;
import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.error.PositionLimitExceededException;
import com.limitbook.engine.core.model.Position;
import com.limitbook.engine.core.state.PositionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pre-trade cap on the absolute position an account may reach in a symbol, assuming the
 * order fills completely. Runs before the book is touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionLimitChecker {
    private final EngineProperties properties;
    private final PositionLedger ledger;

    /**
     * @throws InvalidOrderException when the projected position does not fit in a {@code long},
     *                               whether or not a limit is configured
     */
    public void check(String accountId, String symbol, long signedQuantity) {
        long current = ledger.position(accountId, symbol).map(Position::getQuantity).orElse(0L);
        long projected;
        try {
            projected = Math.addExact(current, signedQuantity);
        } catch (ArithmeticException e) {
            log.warn("RISK: Rejecting {} {} for {}: position {} would overflow", signedQuantity, symbol, accountId, current);
            throw new InvalidOrderException("Position of " + accountId + " in " + symbol + " would overflow: "
                    + current + " + " + signedQuantity);
        }
        Long limit = limitFor(symbol);
        if (limit == null) {
            return;
        }
        if (projected > limit || projected < -limit) {
            log.warn("RISK: Rejecting {} {} for {}: projected position {} exceeds limit {}",
                    signedQuantity, symbol, accountId, projected, limit);
            throw new PositionLimitExceededException(accountId, symbol, projected, limit);
        }
    }

    public Long limitFor(String symbol) {
        EngineProperties.Symbol config = properties.findSymbol(symbol);
        if (config != null && config.getMaxPosition() != null) {
            return config.getMaxPosition();
        }
        return properties.getRisk().getMaxPosition();
    }
}
