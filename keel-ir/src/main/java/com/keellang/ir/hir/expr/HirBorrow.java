package com.keellang.ir.hir.expr;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;
import com.keellang.ir.hir.HirExpr;
import com.keellang.ir.hir.HirVisitor;

/**
 * 对 place 的临时借用，仅作为方法调用脱糖后的首个实参出现。
 * 借用只在该次调用期间有效。
 */
public class HirBorrow extends HirExpr {

    private final Expression place;

    public HirBorrow(SourceLocation location, TypeId borrowType, Expression place) {
        super(location, borrowType, Regime.BORROW);
        this.place = place;
    }

    public Expression getPlace() {
        return place;
    }

    @Override
    public <R, C> R accept(HirVisitor<R, C> visitor, C context) {
        return visitor.visitBorrow(this, context);
    }
}
