package com.keellang.compiler.types;

/**
 * 源码局部变量句柄（函数内唯一）。
 * 由上游类型检查器分配的稠密整数句柄，相等性只比较数值。
 */
public final class LocalId implements Comparable<LocalId> {

    private final int index;

    private LocalId(int index) {
        if (index < 0) throw new IllegalArgumentException("negative LocalId: " + index);
        this.index = index;
    }

    public static LocalId of(int index) {
        return new LocalId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(LocalId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalId && ((LocalId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "l" + index;
    }
}
