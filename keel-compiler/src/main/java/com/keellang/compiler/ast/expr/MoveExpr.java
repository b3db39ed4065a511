package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 显式所有权转移 move place。读取后源位置失效。
 */
public class MoveExpr extends Expression {
    private final Expression operand;

    public MoveExpr(SourceLocation location, TypeId type, Regime regime, Expression operand) {
        super(location, type, regime);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMoveExpr(this, context);
    }
}
