package com.keellang.compiler.types;

/**
 * 字段句柄。
 * 由上游类型检查器分配的稠密整数句柄，相等性只比较数值。
 */
public final class FieldId implements Comparable<FieldId> {

    private final int index;

    private FieldId(int index) {
        if (index < 0) throw new IllegalArgumentException("negative FieldId: " + index);
        this.index = index;
    }

    public static FieldId of(int index) {
        return new FieldId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(FieldId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldId && ((FieldId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "f" + index;
    }
}
