package com.limitbook.engine.web.controller;

import com.limitbook.engine.config.EngineProperties;
import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.model.BookSnapshot;
import com.limitbook.engine.core.model.Position;
import com.limitbook.engine.core.model.SubmitResult;
import com.limitbook.engine.core.service.TradingService;
import com.limitbook.engine.web.dto.BasketRequest;
import com.limitbook.engine.web.dto.CreateOrderRequest;
import com.limitbook.engine.web.dto.OrderBookDto;
import com.limitbook.engine.web.dto.OrderDto;
import com.limitbook.engine.web.dto.PnlDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final TradingService tradingService;
    private final EngineProperties properties;

    @GetMapping("/orderbook/{symbol}")
    public ResponseEntity<OrderBookDto> getOrderBook(@PathVariable String symbol,
                                                     @RequestParam(required = false) Integer depth) {
        int levels = depth != null ? depth : properties.getSnapshot().getDepth();
        log.debug("REST GetOrderBook: symbol={}, depth={}", symbol, levels);
        return tradingService.snapshot(symbol)
                .map(snapshot -> ResponseEntity.ok(OrderBookDto.from(snapshot, levels)))
                .orElseGet(() -> {
                    log.warn("REST GetOrderBook: unknown symbol {}", symbol);
                    return ResponseEntity.notFound().build();
                });
    }

    @GetMapping("/orders/{symbol}")
    public List<OrderDto> getOpenOrders(@PathVariable String symbol) {
        List<OrderDto> orders = tradingService.openOrders(symbol).stream()
                .map(OrderDto::from)
                .collect(Collectors.toList());
        log.debug("REST GetOrders: {} resting orders in {}", orders.size(), symbol);
        return orders;
    }

    @PostMapping("/orders")
    public SubmitResult createOrder(@RequestBody CreateOrderRequest request) {
        log.info("REST CreateOrder [{}]: {} {} @ {} qty={}",
                request.getAccountId(), request.getSymbol(), request.getSide(), request.getPrice(), request.getQuantity());

        SubmitResult result = tradingService.submitOrder(request.getAccountId(), request.getSymbol(),
                request.getSide(), request.getPrice(), request.getQuantity());

        log.info("REST CreateOrder: Order {} {} with {} trades, remaining={}",
                result.getOrderId(), result.getStatus(), result.getTrades().size(), result.getRemainingQuantity());
        return result;
    }

    @PostMapping("/baskets")
    public List<SubmitResult> createBasket(@RequestBody BasketRequest request) {
        List<CreateOrderRequest> orders = request.getOrders();
        if (orders == null || orders.isEmpty()) {
            throw new InvalidOrderException("Basket has no orders");
        }
        if (orders.stream().anyMatch(Objects::isNull)) {
            throw new InvalidOrderException("Basket contains an empty order");
        }
        log.info("REST CreateBasket: {} orders", orders.size());
        return tradingService.submitBasket(orders.stream()
                .map(CreateOrderRequest::toOrderRequest)
                .collect(Collectors.toList()));
    }

    @DeleteMapping("/orders/{symbol}/{id}")
    public ResponseEntity<Void> cancelOrder(@PathVariable String symbol, @PathVariable long id) {
        log.info("REST CancelOrder: {} id={}", symbol, id);
        tradingService.cancelOrder(symbol, id);
        log.info("REST CancelOrder: Order {} successfully removed", id);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/positions/{symbol}")
    public ResponseEntity<Position> getPosition(@PathVariable String symbol,
                                                @RequestParam(required = false) String accountId) {
        return tradingService.position(accountId, symbol)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/positions")
    public List<Position> getPositions(@RequestParam(required = false) String accountId) {
        return tradingService.positions(accountId);
    }

    @GetMapping("/positions/{symbol}/pnl")
    public PnlDto getPnl(@PathVariable String symbol,
                         @RequestParam BigDecimal mark,
                         @RequestParam(required = false) String accountId) {
        String account = tradingService.resolveAccount(accountId);
        Position position = tradingService.position(account, symbol).orElse(null);
        return PnlDto.builder()
                .accountId(account)
                .symbol(symbol)
                .quantity(position != null ? position.getQuantity() : 0)
                .markPrice(mark)
                .unrealizedPnl(tradingService.unrealizedPnl(account, symbol, mark))
                .realizedPnl(position != null ? position.getRealizedPnl() : BigDecimal.ZERO)
                .build();
    }
}
