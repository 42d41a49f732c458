package com.calor.verification.contract;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("!"),
    BITWISE_NOT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }
}
