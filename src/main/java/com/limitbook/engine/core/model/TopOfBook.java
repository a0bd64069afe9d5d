package com.limitbook.engine.core.model;

import java.math.BigDecimal;

public record TopOfBook(BigDecimal bid, BigDecimal ask) {

    public BigDecimal spread() {
        return ask.subtract(bid);
    }
}
