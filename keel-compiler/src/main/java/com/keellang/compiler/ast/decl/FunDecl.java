package com.keellang.compiler.ast.decl;

import com.keellang.compiler.ast.AstNode;
import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.stmt.Block;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.TypeId;

import java.util.List;

/**
 * 函数声明（已类型化）
 */
public class FunDecl extends AstNode {
    private final FnId id;
    private final String name;
    private final List<Parameter> params;
    private final TypeId returnType;
    private final Block body;

    public FunDecl(SourceLocation location, FnId id, String name, List<Parameter> params,
                   TypeId returnType, Block body) {
        super(location);
        this.id = id;
        this.name = name;
        this.params = List.copyOf(params);
        this.returnType = returnType;
        this.body = body;
    }

    public FnId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeId getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
