package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 解引用 *operand
 */
public class DerefExpr extends Expression {
    private final Expression operand;

    public DerefExpr(SourceLocation location, TypeId type, Regime regime, Expression operand) {
        super(location, type, regime);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public boolean isPlace() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDerefExpr(this, context);
    }
}
