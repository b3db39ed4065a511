package com.keellang.compiler.types;

/**
 * 类型句柄。
 * 由上游类型检查器分配的稠密整数句柄，相等性只比较数值。
 */
public final class TypeId implements Comparable<TypeId> {

    private final int index;

    private TypeId(int index) {
        if (index < 0) throw new IllegalArgumentException("negative TypeId: " + index);
        this.index = index;
    }

    public static TypeId of(int index) {
        return new TypeId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(TypeId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeId && ((TypeId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "t" + index;
    }
}
