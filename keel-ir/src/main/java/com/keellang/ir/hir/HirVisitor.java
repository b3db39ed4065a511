package com.keellang.ir.hir;

import com.keellang.ir.hir.decl.HirFunction;
import com.keellang.ir.hir.expr.HirBorrow;
import com.keellang.ir.hir.expr.HirTargetRead;
import com.keellang.ir.hir.stmt.HirLoop;

/**
 * HIR 访问者接口。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface HirVisitor<R, C> {

    R visitFunction(HirFunction node, C context);

    R visitLoop(HirLoop node, C context);

    R visitBorrow(HirBorrow node, C context);

    R visitTargetRead(HirTargetRead node, C context);
}
