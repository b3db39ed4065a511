package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, TypeId type, Regime regime,
                      Expression left, BinaryOp operator, Expression right) {
        super(location, type, regime);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 位运算
        BAND("&"),
        BOR("|"),
        BXOR("^"),
        SHL("<<"),
        SHR(">>"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑（短路）
        AND("&&"),
        OR("||");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isShortCircuit() {
            return this == AND || this == OR;
        }
    }
}
