package com.keellang.compiler.types;

/**
 * 符号句柄。
 * 由上游类型检查器分配的稠密整数句柄，相等性只比较数值。
 */
public final class SymbolId implements Comparable<SymbolId> {

    private final int index;

    private SymbolId(int index) {
        if (index < 0) throw new IllegalArgumentException("negative SymbolId: " + index);
        this.index = index;
    }

    public static SymbolId of(int index) {
        return new SymbolId(index);
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(SymbolId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolId && ((SymbolId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "s" + index;
    }
}
