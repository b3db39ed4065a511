package com.keellang.compiler.types;

/**
 * 函数句柄。
 * 由上游类型检查器分配的稠密整数句柄，相等性只比较数值。
 */
public final class FnId implements Comparable<FnId> {

    private final int index;

    private FnId(int index) {
        if (index < 0) throw new IllegalArgumentException("negative FnId: " + index);
        this.index = index;
    }

    public static FnId of(int index) {
        return new FnId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(FnId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FnId && ((FnId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "fn" + index;
    }
}
