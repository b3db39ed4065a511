package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.LocalId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 已解析的局部变量/参数引用
 */
public class LocalRef extends Expression {
    private final LocalId local;
    private final String name;

    public LocalRef(SourceLocation location, TypeId type, Regime regime, LocalId local, String name) {
        super(location, type, regime);
        this.local = local;
        this.name = name;
    }

    public LocalId getLocal() {
        return local;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isPlace() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalRef(this, context);
    }
}
