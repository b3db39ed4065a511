package com.keellang.compiler.ast.expr;

import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.List;

/**
 * 字符串插值 "Hello, ${name}!"
 */
public class StringInterpolation extends Expression {
    private final List<StringPart> parts;

    public StringInterpolation(SourceLocation location, TypeId type, Regime regime, List<StringPart> parts) {
        super(location, type, regime);
        this.parts = List.copyOf(parts);
    }

    public List<StringPart> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }

    /**
     * 字符串片段
     */
    public abstract static class StringPart {
        private final SourceLocation location;

        protected StringPart(SourceLocation location) {
            this.location = location;
        }

        public SourceLocation getLocation() {
            return location;
        }
    }

    /**
     * 字面量片段
     */
    public static class LiteralPart extends StringPart {
        private final String value;

        public LiteralPart(SourceLocation location, String value) {
            super(location);
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    /**
     * 表达式片段
     */
    public static class ExprPart extends StringPart {
        private final Expression expression;

        public ExprPart(SourceLocation location, Expression expression) {
            super(location);
            this.expression = expression;
        }

        public Expression getExpression() {
            return expression;
        }
    }
}
