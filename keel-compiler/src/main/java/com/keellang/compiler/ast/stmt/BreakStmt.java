package com.keellang.compiler.ast.stmt;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {
    private final String label;  // 可选

    public BreakStmt(SourceLocation location, String label) {
        super(location);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
