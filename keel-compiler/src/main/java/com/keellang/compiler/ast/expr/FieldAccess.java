package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.FieldId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * 字段访问 target.field。
 * target 为句柄或借用时，降级阶段插入显式解引用。
 */
public class FieldAccess extends Expression {
    private final Expression target;
    private final FieldId field;
    private final int fieldIndex;

    public FieldAccess(SourceLocation location, TypeId type, Regime regime,
                       Expression target, FieldId field, int fieldIndex) {
        super(location, type, regime);
        this.target = target;
        this.field = field;
        this.fieldIndex = fieldIndex;
    }

    public Expression getTarget() {
        return target;
    }

    public FieldId getField() {
        return field;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    @Override
    public boolean isPlace() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccess(this, context);
    }
}
