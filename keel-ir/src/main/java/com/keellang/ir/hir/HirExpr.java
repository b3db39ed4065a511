package com.keellang.ir.hir;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * HIR 表达式基类。extends Expression implements HirNode，
 * HIR 表达式同时也是 AST Expression，携带类型与制式。
 */
public abstract class HirExpr extends Expression implements HirNode {

    protected HirExpr(SourceLocation location, TypeId type, Regime regime) {
        super(location, type, regime);
    }

    /**
     * AST visitor 不处理 HIR 节点，返回 null。
     */
    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
