package com.keellang.ir.mir;

import java.util.function.IntUnaryOperator;

/**
 * Place 投影：字段、解引用、索引。
 */
public abstract class Projection {

    public static final Projection DEREF = new Deref();

    public static Projection field(int index) {
        return new Field(index);
    }

    public static Projection index(int local) {
        return new Index(local);
    }

    Projection remapLocals(IntUnaryOperator mapping) {
        return this;
    }

    /**
     * 结构体字段（按声明位置）。
     */
    public static final class Field extends Projection {
        private final int index;

        private Field(int index) {
            this.index = index;
        }

        public int getIndex() { return index; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Field && ((Field) o).index == index;
        }

        @Override
        public int hashCode() {
            return 31 + index;
        }

        @Override
        public String toString() {
            return "." + index;
        }
    }

    /**
     * 解引用句柄或借用。
     */
    public static final class Deref extends Projection {
        private Deref() {
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    /**
     * 以局部变量为下标的数组元素。
     */
    public static final class Index extends Projection {
        private final int local;

        private Index(int local) {
            this.local = local;
        }

        public int getLocal() { return local; }

        @Override
        Projection remapLocals(IntUnaryOperator mapping) {
            int mapped = mapping.applyAsInt(local);
            return mapped == local ? this : new Index(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Index && ((Index) o).local == local;
        }

        @Override
        public int hashCode() {
            return 17 * 31 + local;
        }

        @Override
        public String toString() {
            return "[_" + local + "]";
        }
    }
}
