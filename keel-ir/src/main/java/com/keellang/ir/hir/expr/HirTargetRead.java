package com.keellang.ir.hir.expr;

import com.keellang.compiler.ast.expr.Expression;
import com.keellang.ir.hir.HirExpr;
import com.keellang.ir.hir.HirVisitor;

/**
 * 复合赋值展开后右侧对赋值目标的读取。
 * 读取的是外层赋值已经求值的 place，目标中的下标等子表达式不会再次求值。
 */
public class HirTargetRead extends HirExpr {

    private final Expression target;

    public HirTargetRead(Expression target) {
        super(target.getLocation(), target.getType(), target.getRegime());
        this.target = target;
    }

    public Expression getTarget() {
        return target;
    }

    @Override
    public boolean isPlace() {
        return true;
    }

    @Override
    public <R, C> R accept(HirVisitor<R, C> visitor, C context) {
        return visitor.visitTargetRead(this, context);
    }
}
