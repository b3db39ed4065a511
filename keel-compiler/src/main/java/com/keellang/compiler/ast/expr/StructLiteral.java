package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.List;

/**
 * 结构体字面量，字段值按声明顺序给出
 */
public class StructLiteral extends Expression {
    private final List<Expression> fieldValues;

    public StructLiteral(SourceLocation location, TypeId type, Regime regime, List<Expression> fieldValues) {
        super(location, type, regime);
        this.fieldValues = List.copyOf(fieldValues);
    }

    public List<Expression> getFieldValues() {
        return fieldValues;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }
}
