package com.keellang.compiler.ast.stmt;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;

/**
 * While 循环
 */
public class WhileStmt extends Statement {
    private final String label;  // 可选
    private final Expression condition;
    private final Statement body;

    public WhileStmt(SourceLocation location, String label, Expression condition, Statement body) {
        super(location);
        this.label = label;
        this.condition = condition;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
