package com.keellang.ir.hir.decl;

import com.keellang.compiler.ast.AstNode;
import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.decl.Parameter;
import com.keellang.compiler.ast.stmt.Block;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.TypeId;
import com.keellang.ir.hir.HirNode;
import com.keellang.ir.hir.HirVisitor;

import java.util.List;

/**
 * 脱糖后的函数。
 */
public class HirFunction extends AstNode implements HirNode {

    private final FnId id;
    private final String name;
    private final List<Parameter> params;
    private final TypeId returnType;
    private final Block body;

    public HirFunction(SourceLocation location, FnId id, String name, List<Parameter> params,
                       TypeId returnType, Block body) {
        super(location);
        this.id = id;
        this.name = name;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public FnId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** 诊断中使用的函数标识 */
    public String getLabel() {
        return name + "#" + id.getIndex();
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

    /**
     * AST visitor 不处理 HIR 节点，返回 null。
     */
    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }

    @Override
    public <R, C> R accept(HirVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
