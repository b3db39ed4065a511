package com.keellang.compiler.ast.stmt;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;

/**
 * For 循环 for (init; condition; update) body
 */
public class ForStmt extends Statement {
    private final String label;          // 可选
    private final Statement initializer; // 可选
    private final Expression condition;  // 可选，缺省为 true
    private final Expression update;     // 可选
    private final Statement body;

    public ForStmt(SourceLocation location, String label, Statement initializer,
                   Expression condition, Expression update, Statement body) {
        super(location);
        this.label = label;
        this.initializer = initializer;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
