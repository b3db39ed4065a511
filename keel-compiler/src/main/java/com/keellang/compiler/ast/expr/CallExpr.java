package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.List;

/**
 * 普通函数调用 f(args)，被调函数已解析为 {@link FnId}
 */
public class CallExpr extends Expression {
    private final FnId function;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, TypeId type, Regime regime, FnId function, List<Expression> args) {
        super(location, type, regime);
        this.function = function;
        this.args = List.copyOf(args);
    }

    public FnId getFunction() {
        return function;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
