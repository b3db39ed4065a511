package com.keellang.ir.mir;

/**
 * MIR 二元运算。短路运算在建图时已展开为控制流，不出现在这里。
 */
public enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
    BAND("&"), BOR("|"), BXOR("^"), SHL("<<"), SHR(">>"),
    EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">=");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isComparison() {
        return ordinal() >= EQ.ordinal();
    }
}
