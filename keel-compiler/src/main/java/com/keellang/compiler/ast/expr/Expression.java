package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstNode;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 表达式基类。类型检查后每个表达式都携带驻留的类型句柄及其所有权制式。
 */
public abstract class Expression extends AstNode {
    protected final TypeId type;
    protected final Regime regime;

    protected Expression(SourceLocation location, TypeId type, Regime regime) {
        super(location);
        this.type = type;
        this.regime = regime;
    }

    public TypeId getType() {
        return type;
    }

    public Regime getRegime() {
        return regime;
    }

    /** 是否可作为左值（place）使用 */
    public boolean isPlace() {
        return false;
    }
}
