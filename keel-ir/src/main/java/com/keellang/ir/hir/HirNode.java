package com.keellang.ir.hir;

import com.keellang.compiler.ast.SourceLocation;

/**
 * HIR（High-level IR）节点接口。
 * HIR 是已类型化 AST 脱糖后的中间表示，保留结构化控制流。
 * 未被脱糖改写的 AST 节点原样出现在 HIR 树中。
 */
public interface HirNode {

    SourceLocation getLocation();

    <R, C> R accept(HirVisitor<R, C> visitor, C context);
}
