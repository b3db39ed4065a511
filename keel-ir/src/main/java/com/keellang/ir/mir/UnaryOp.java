package com.keellang.ir.mir;

/**
 * MIR 一元运算。
 */
public enum UnaryOp {
    NEG("-"), NOT("!"), BIT_NOT("~");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
