package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 条件表达式 cond ? thenExpr : elseExpr
 */
public class ConditionalExpr extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public ConditionalExpr(SourceLocation location, TypeId type, Regime regime,
                           Expression condition, Expression thenExpr, Expression elseExpr) {
        super(location, type, regime);
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenExpr() {
        return thenExpr;
    }

    public Expression getElseExpr() {
        return elseExpr;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpr(this, context);
    }
}
