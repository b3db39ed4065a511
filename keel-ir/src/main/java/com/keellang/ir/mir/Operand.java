package com.keellang.ir.mir;

import com.keellang.compiler.types.TypeId;

import java.util.function.IntUnaryOperator;

/**
 * 操作数：常量、复制读取、移动读取。
 */
public abstract class Operand {

    public static Operand constant(ConstValue value, TypeId type) {
        return new Constant(value, type);
    }

    public static Operand copy(Place place) {
        return new Copy(place);
    }

    public static Operand move(Place place) {
        return new Move(place);
    }

    /** 读取的位置，常量返回 null */
    public Place getPlace() {
        return null;
    }

    public boolean isConstant() {
        return false;
    }

    public abstract Operand remapLocals(IntUnaryOperator mapping);

    /**
     * 常量。
     */
    public static final class Constant extends Operand {
        private final ConstValue value;
        private final TypeId type;

        private Constant(ConstValue value, TypeId type) {
            this.value = value;
            this.type = type;
        }

        public ConstValue getValue() { return value; }
        public TypeId getType() { return type; }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public Operand remapLocals(IntUnaryOperator mapping) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Constant)) return false;
            Constant that = (Constant) o;
            return value.equals(that.value) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return value.hashCode() * 31 + type.hashCode();
        }

        @Override
        public String toString() {
            return "const " + value;
        }
    }

    /**
     * 复制读取（按制式复制，源仍有效）。
     */
    public static final class Copy extends Operand {
        private final Place place;

        private Copy(Place place) {
            this.place = place;
        }

        @Override
        public Place getPlace() { return place; }

        @Override
        public Operand remapLocals(IntUnaryOperator mapping) {
            Place mapped = place.remapLocals(mapping);
            return mapped == place ? this : new Copy(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Copy && ((Copy) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode();
        }

        @Override
        public String toString() {
            return "copy " + place;
        }
    }

    /**
     * 移动读取（所有权转移，源失效）。
     */
    public static final class Move extends Operand {
        private final Place place;

        private Move(Place place) {
            this.place = place;
        }

        @Override
        public Place getPlace() { return place; }

        @Override
        public Operand remapLocals(IntUnaryOperator mapping) {
            Place mapped = place.remapLocals(mapping);
            return mapped == place ? this : new Move(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Move && ((Move) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 7;
        }

        @Override
        public String toString() {
            return "move " + place;
        }
    }
}
