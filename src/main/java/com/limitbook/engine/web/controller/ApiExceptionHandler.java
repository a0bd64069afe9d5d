package com.limitbook.engine.web.controller;

import com.limitbook.engine.core.error.EngineException;
import com.limitbook.engine.core.error.InternalInvariantViolationException;
import com.limitbook.engine.core.error.InvalidOrderException;
import com.limitbook.engine.core.error.OrderNotFoundException;
import com.limitbook.engine.core.error.PositionLimitExceededException;
import com.limitbook.engine.core.error.ShardBusyException;
import com.limitbook.engine.web.dto.ErrorDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidOrderException.class)
    public ResponseEntity<ErrorDto> handleInvalidOrder(InvalidOrderException e) {
        log.warn("REST: order rejected: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ORDER", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorDto> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("REST: bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<ErrorDto> handleOrderNotFound(OrderNotFoundException e) {
        log.info("REST: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "ORDER_NOT_FOUND", e);
    }

    @ExceptionHandler(PositionLimitExceededException.class)
    public ResponseEntity<ErrorDto> handlePositionLimit(PositionLimitExceededException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "POSITION_LIMIT_EXCEEDED", e);
    }

    @ExceptionHandler(ShardBusyException.class)
    public ResponseEntity<ErrorDto> handleBusy(ShardBusyException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "BUSY", e);
    }

    @ExceptionHandler(InternalInvariantViolationException.class)
    public ResponseEntity<ErrorDto> handleInvariant(InternalInvariantViolationException e) {
        log.error("REST: invariant violation in {}", e.getSymbol(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_INVARIANT_VIOLATION", e);
    }

    private ResponseEntity<ErrorDto> respond(HttpStatus status, String error, RuntimeException e) {
        return ResponseEntity.status(status)
                .body(ErrorDto.builder().error(error).message(e.getMessage()).build());
    }
}
