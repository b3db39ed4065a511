package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 赋值表达式（含复合赋值）
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, TypeId type, Regime regime,
                      Expression target, AssignOp operator, Expression value) {
        super(location, type, regime);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isCompound() {
        return operator != AssignOp.ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%="),
        AND_ASSIGN("&="),
        OR_ASSIGN("|="),
        XOR_ASSIGN("^="),
        SHL_ASSIGN("<<="),
        SHR_ASSIGN(">>=");

        private final String symbol;

        AssignOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
