package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.List;

/**
 * 方法调用 receiver.method(args)。
 * 方法已由类型检查器解析为 {@link FnId}，其首个参数是接收者的借用类型。
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final FnId method;
    private final String methodName;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, TypeId type, Regime regime,
                          Expression receiver, FnId method, String methodName, List<Expression> args) {
        super(location, type, regime);
        this.receiver = receiver;
        this.method = method;
        this.methodName = methodName;
        this.args = List.copyOf(args);
    }

    public Expression getReceiver() {
        return receiver;
    }

    public FnId getMethod() {
        return method;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
