package com.keellang.ir.hir.stmt;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Expression;
import com.keellang.compiler.ast.stmt.Statement;
import com.keellang.ir.hir.HirStmt;
import com.keellang.ir.hir.HirVisitor;

/**
 * 循环语句，合并 WhileStmt + ForStmt。
 * for 的初始化语句由外层 Block 承载，更新表达式在每轮 body 之后（含 continue）执行。
 */
public class HirLoop extends HirStmt {

    private final String label;         // nullable
    private final Expression condition;
    private final Statement body;
    private final Expression update;    // nullable

    public HirLoop(SourceLocation location, String label, Expression condition,
                   Statement body, Expression update) {
        super(location);
        this.label = label;
        this.condition = condition;
        this.body = body;
        this.update = update;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getUpdate() {
        return update;
    }

    public boolean hasUpdate() {
        return update != null;
    }

    @Override
    public <R, C> R accept(HirVisitor<R, C> visitor, C context) {
        return visitor.visitLoop(this, context);
    }
}
