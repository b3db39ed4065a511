package com.keellang.ir.mir;

import com.keellang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * MIR 基本块终止指令。每个基本块必须恰好有一个终止指令。
 */
public abstract class MirTerminator {

    protected final SourceLocation location;

    protected MirTerminator(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() { return location; }

    /** 后继块 ID（按出边顺序，可能重复） */
    public abstract List<Integer> getSuccessors();

    /** 按映射改写跳转目标 */
    public abstract MirTerminator remapTargets(IntUnaryOperator mapping);

    public List<Operand> getOperands() {
        return Collections.emptyList();
    }

    public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
        return this;
    }

    public MirTerminator remapLocals(IntUnaryOperator mapping) {
        return mapOperands(op -> op.remapLocals(mapping));
    }

    public void forEachReadLocal(IntConsumer consumer) {
        for (Operand op : getOperands()) {
            if (op.getPlace() != null) op.getPlace().forEachReadLocal(consumer);
        }
    }

    /**
     * 无条件跳转。
     */
    public static class Goto extends MirTerminator {
        private final int targetBlockId;

        public Goto(SourceLocation location, int targetBlockId) {
            super(location);
            this.targetBlockId = targetBlockId;
        }

        public int getTargetBlockId() { return targetBlockId; }

        @Override
        public List<Integer> getSuccessors() {
            return Collections.singletonList(targetBlockId);
        }

        @Override
        public MirTerminator remapTargets(IntUnaryOperator mapping) {
            int mapped = mapping.applyAsInt(targetBlockId);
            return mapped == targetBlockId ? this : new Goto(location, mapped);
        }

        @Override
        public String toString() {
            return "goto B" + targetBlockId;
        }
    }

    /**
     * 条件分支。
     */
    public static class Branch extends MirTerminator {
        private final Operand condition;
        private final int thenBlock;
        private final int elseBlock;

        public Branch(SourceLocation location, Operand condition, int thenBlock, int elseBlock) {
            super(location);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public Operand getCondition() { return condition; }
        public int getThenBlock() { return thenBlock; }
        public int getElseBlock() { return elseBlock; }

        @Override
        public List<Integer> getSuccessors() {
            return Arrays.asList(thenBlock, elseBlock);
        }

        @Override
        public MirTerminator remapTargets(IntUnaryOperator mapping) {
            int t = mapping.applyAsInt(thenBlock);
            int e = mapping.applyAsInt(elseBlock);
            return t == thenBlock && e == elseBlock ? this : new Branch(location, condition, t, e);
        }

        @Override
        public List<Operand> getOperands() {
            return Collections.singletonList(condition);
        }

        @Override
        public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
            Operand mapped = mapper.apply(condition);
            return mapped == condition ? this : new Branch(location, mapped, thenBlock, elseBlock);
        }

        @Override
        public String toString() {
            return "branch " + condition + " ? B" + thenBlock + " : B" + elseBlock;
        }
    }

    /**
     * Switch（多路分支）。整数键，未命中走 default。
     */
    public static class Switch extends MirTerminator {
        private final Operand key;
        private final List<Long> values;
        private final List<Integer> targets;
        private final int defaultBlock;

        public Switch(SourceLocation location, Operand key, List<Long> values, List<Integer> targets,
                      int defaultBlock) {
            super(location);
            if (values.size() != targets.size()) {
                throw new IllegalArgumentException("switch values/targets size mismatch");
            }
            this.key = key;
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
            this.defaultBlock = defaultBlock;
        }

        public Operand getKey() { return key; }
        public List<Long> getValues() { return values; }
        public List<Integer> getTargets() { return targets; }
        public int getDefaultBlock() { return defaultBlock; }

        @Override
        public List<Integer> getSuccessors() {
            List<Integer> list = new ArrayList<>(targets);
            list.add(defaultBlock);
            return list;
        }

        @Override
        public MirTerminator remapTargets(IntUnaryOperator mapping) {
            List<Integer> mapped = new ArrayList<>(targets.size());
            for (int t : targets) mapped.add(mapping.applyAsInt(t));
            return new Switch(location, key, values, mapped, mapping.applyAsInt(defaultBlock));
        }

        @Override
        public List<Operand> getOperands() {
            return Collections.singletonList(key);
        }

        @Override
        public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
            Operand mapped = mapper.apply(key);
            return mapped == key ? this : new Switch(location, mapped, values, targets, defaultBlock);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("switch ").append(key).append(" [");
            for (int i = 0; i < values.size(); i++) {
                sb.append(values.get(i)).append(": B").append(targets.get(i)).append(", ");
            }
            return sb.append("otherwise: B").append(defaultBlock).append(']').toString();
        }
    }

    /**
     * 返回。返回值由返回槽 _0 携带。
     */
    public static class Return extends MirTerminator {
        public Return(SourceLocation location) {
            super(location);
        }

        @Override
        public List<Integer> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public MirTerminator remapTargets(IntUnaryOperator mapping) {
            return this;
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    /**
     * 陷入（运行时终止），如非 unit 函数缺少 return。
     */
    public static class Trap extends MirTerminator {
        private final String reason;

        public Trap(SourceLocation location, String reason) {
            super(location);
            this.reason = reason;
        }

        public String getReason() { return reason; }

        @Override
        public List<Integer> getSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public MirTerminator remapTargets(IntUnaryOperator mapping) {
            return this;
        }

        @Override
        public String toString() {
            return "trap \"" + reason + "\"";
        }
    }
}
