package com.keellang.ir.mir;

import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.TypeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * 赋值右侧的计算。除 {@link Call} 外均无副作用。
 */
public abstract class Rvalue {

    public static Rvalue use(Operand operand) {
        return new Use(operand);
    }

    public static Rvalue unary(UnaryOp op, Operand operand) {
        return new Unary(op, operand);
    }

    public static Rvalue binary(BinaryOp op, Operand left, Operand right) {
        return new Binary(op, left, right);
    }

    public static Call call(FnId function, List<Operand> args) {
        return new Call(function, args);
    }

    public static Rvalue aggregate(TypeId type, List<Operand> fields) {
        return new Aggregate(type, fields);
    }

    public static Rvalue borrow(Place place) {
        return new Borrow(place);
    }

    /** 读取的操作数（按求值顺序） */
    public abstract List<Operand> getOperands();

    /** 替换所有操作数，返回新的 rvalue（无变化时返回自身） */
    public abstract Rvalue mapOperands(UnaryOperator<Operand> mapper);

    public Rvalue remapLocals(IntUnaryOperator mapping) {
        return mapOperands(op -> op.remapLocals(mapping));
    }

    public boolean hasSideEffects() {
        return false;
    }

    static List<Operand> mapList(List<Operand> operands, UnaryOperator<Operand> mapper) {
        List<Operand> result = null;
        for (int i = 0; i < operands.size(); i++) {
            Operand op = operands.get(i);
            Operand mapped = mapper.apply(op);
            if (mapped != op && result == null) {
                result = new ArrayList<>(operands);
            }
            if (result != null) result.set(i, mapped);
        }
        return result == null ? operands : Collections.unmodifiableList(result);
    }

    /**
     * 直接使用操作数。
     */
    public static final class Use extends Rvalue {
        private final Operand operand;

        private Use(Operand operand) {
            this.operand = operand;
        }

        public Operand getOperand() { return operand; }

        @Override
        public List<Operand> getOperands() {
            return Collections.singletonList(operand);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            Operand mapped = mapper.apply(operand);
            return mapped == operand ? this : new Use(mapped);
        }

        @Override
        public String toString() {
            return operand.toString();
        }
    }

    /**
     * 一元运算。
     */
    public static final class Unary extends Rvalue {
        private final UnaryOp op;
        private final Operand operand;

        private Unary(UnaryOp op, Operand operand) {
            this.op = op;
            this.operand = operand;
        }

        public UnaryOp getOp() { return op; }
        public Operand getOperand() { return operand; }

        @Override
        public List<Operand> getOperands() {
            return Collections.singletonList(operand);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            Operand mapped = mapper.apply(operand);
            return mapped == operand ? this : new Unary(op, mapped);
        }

        @Override
        public String toString() {
            return op.name() + "(" + operand + ")";
        }
    }

    /**
     * 二元运算。
     */
    public static final class Binary extends Rvalue {
        private final BinaryOp op;
        private final Operand left;
        private final Operand right;

        private Binary(BinaryOp op, Operand left, Operand right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        public BinaryOp getOp() { return op; }
        public Operand getLeft() { return left; }
        public Operand getRight() { return right; }

        @Override
        public List<Operand> getOperands() {
            List<Operand> list = new ArrayList<>(2);
            list.add(left);
            list.add(right);
            return list;
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            Operand l = mapper.apply(left);
            Operand r = mapper.apply(right);
            return l == left && r == right ? this : new Binary(op, l, r);
        }

        @Override
        public String toString() {
            return op.name() + "(" + left + ", " + right + ")";
        }
    }

    /**
     * 函数调用。参数按位置传递，借用实参以 move 形式传入。
     */
    public static final class Call extends Rvalue {
        private final FnId function;
        private final List<Operand> args;

        private Call(FnId function, List<Operand> args) {
            this.function = function;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public FnId getFunction() { return function; }
        public List<Operand> getArgs() { return args; }

        @Override
        public List<Operand> getOperands() {
            return args;
        }

        @Override
        public Call mapOperands(UnaryOperator<Operand> mapper) {
            List<Operand> mapped = mapList(args, mapper);
            return mapped == args ? this : new Call(function, mapped);
        }

        @Override
        public Call remapLocals(IntUnaryOperator mapping) {
            return mapOperands(op -> op.remapLocals(mapping));
        }

        @Override
        public boolean hasSideEffects() {
            return true;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(function).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * 结构体构造（按字段声明顺序）。
     */
    public static final class Aggregate extends Rvalue {
        private final TypeId type;
        private final List<Operand> fields;

        private Aggregate(TypeId type, List<Operand> fields) {
            this.type = type;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        public TypeId getType() { return type; }
        public List<Operand> getFields() { return fields; }

        @Override
        public List<Operand> getOperands() {
            return fields;
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            List<Operand> mapped = mapList(fields, mapper);
            return mapped == fields ? this : new Aggregate(type, mapped);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(type).append(" {");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(fields.get(i));
            }
            return sb.append('}').toString();
        }
    }

    /**
     * 对 place 取临时借用。
     */
    public static final class Borrow extends Rvalue {
        private final Place place;

        private Borrow(Place place) {
            this.place = place;
        }

        public Place getPlace() { return place; }

        @Override
        public List<Operand> getOperands() {
            return Collections.emptyList();
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return this;
        }

        @Override
        public Rvalue remapLocals(IntUnaryOperator mapping) {
            Place mapped = place.remapLocals(mapping);
            return mapped == place ? this : new Borrow(mapped);
        }

        @Override
        public String toString() {
            return "&" + place;
        }
    }
}
