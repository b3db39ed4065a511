package com.keellang.compiler.ast.stmt;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;
import com.keellang.compiler.types.LocalId;
import com.keellang.compiler.types.TypeId;

/**
 * 局部变量声明 let name: Type = init
 */
public class LetStmt extends Statement {
    private final LocalId local;
    private final String name;
    private final TypeId type;
    private final Expression initializer;  // 可选

    public LetStmt(SourceLocation location, LocalId local, String name, TypeId type, Expression initializer) {
        super(location);
        this.local = local;
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public LocalId getLocal() {
        return local;
    }

    public String getName() {
        return name;
    }

    public TypeId getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
