package com.keellang.ir.mir;

import com.keellang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * 基本块内的非终止语句。语句不可变，pass 通过替换列表元素改写。
 */
public abstract class MirStatement {

    protected final SourceLocation location;

    protected MirStatement(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() { return location; }

    /** 语句读取的操作数（不含目标 place） */
    public abstract List<Operand> getOperands();

    /** 语句读取的全部局部变量（操作数、借用位置、索引、经解引用写入的句柄） */
    public abstract void forEachReadLocal(IntConsumer consumer);

    public abstract MirStatement remapLocals(IntUnaryOperator mapping);

    /**
     * place = rvalue
     */
    public static final class Assign extends MirStatement {
        private final Place destination;
        private final Rvalue value;

        public Assign(SourceLocation location, Place destination, Rvalue value) {
            super(location);
            this.destination = destination;
            this.value = value;
        }

        public Place getDestination() { return destination; }
        public Rvalue getValue() { return value; }

        public Assign withValue(Rvalue newValue) {
            return newValue == value ? this : new Assign(location, destination, newValue);
        }

        @Override
        public List<Operand> getOperands() {
            return value.getOperands();
        }

        @Override
        public void forEachReadLocal(IntConsumer consumer) {
            if (value instanceof Rvalue.Borrow) {
                ((Rvalue.Borrow) value).getPlace().forEachReadLocal(consumer);
            }
            for (Operand op : value.getOperands()) {
                if (op.getPlace() != null) op.getPlace().forEachReadLocal(consumer);
            }
            destination.forEachDestinationReadLocal(consumer);
        }

        @Override
        public MirStatement remapLocals(IntUnaryOperator mapping) {
            Place dest = destination.remapLocals(mapping);
            Rvalue rv = value.remapLocals(mapping);
            return dest == destination && rv == value ? this : new Assign(location, dest, rv);
        }

        @Override
        public String toString() {
            return destination + " = " + value;
        }
    }

    /**
     * 丢弃结果的调用，仅为副作用保留。
     */
    public static final class Eval extends MirStatement {
        private final Rvalue.Call call;

        public Eval(SourceLocation location, Rvalue.Call call) {
            super(location);
            this.call = call;
        }

        public Rvalue.Call getCall() { return call; }

        @Override
        public List<Operand> getOperands() {
            return call.getArgs();
        }

        @Override
        public void forEachReadLocal(IntConsumer consumer) {
            for (Operand op : call.getArgs()) {
                if (op.getPlace() != null) op.getPlace().forEachReadLocal(consumer);
            }
        }

        @Override
        public MirStatement remapLocals(IntUnaryOperator mapping) {
            Rvalue.Call mapped = call.remapLocals(mapping);
            return mapped == call ? this : new Eval(location, mapped);
        }

        @Override
        public String toString() {
            return "eval " + call;
        }
    }

    /**
     * 运行时检查：句柄非空，或索引在数组长度范围内。失败时由后端陷入。
     */
    public static final class Check extends MirStatement {

        public enum CheckKind {
            NULL, BOUNDS
        }

        private final CheckKind kind;
        private final Operand operand;
        private final int length;      // 仅 BOUNDS 使用

        public Check(SourceLocation location, CheckKind kind, Operand operand, int length) {
            super(location);
            this.kind = kind;
            this.operand = operand;
            this.length = length;
        }

        public static Check notNull(SourceLocation location, Operand handle) {
            return new Check(location, CheckKind.NULL, handle, -1);
        }

        public static Check bounds(SourceLocation location, Operand index, int length) {
            return new Check(location, CheckKind.BOUNDS, index, length);
        }

        public CheckKind getKind() { return kind; }
        public Operand getOperand() { return operand; }
        public int getLength() { return length; }

        public Check withOperand(Operand newOperand) {
            return newOperand == operand ? this : new Check(location, kind, newOperand, length);
        }

        @Override
        public List<Operand> getOperands() {
            return Collections.singletonList(operand);
        }

        @Override
        public void forEachReadLocal(IntConsumer consumer) {
            if (operand.getPlace() != null) operand.getPlace().forEachReadLocal(consumer);
        }

        @Override
        public MirStatement remapLocals(IntUnaryOperator mapping) {
            return withOperand(operand.remapLocals(mapping));
        }

        @Override
        public String toString() {
            return kind == CheckKind.NULL
                    ? "check notnull " + operand
                    : "check " + operand + " < " + length;
        }
    }
}
