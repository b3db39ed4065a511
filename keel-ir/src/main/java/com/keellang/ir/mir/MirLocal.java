package com.keellang.ir.mir;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

/**
 * MIR 局部变量。
 */
public final class MirLocal {

    private final int index;
    private final TypeId type;
    private final Regime regime;
    private final LocalKind kind;
    private final String name;              // 调试名，可为 null
    private final SourceLocation location;

    public MirLocal(int index, TypeId type, Regime regime, LocalKind kind, String name, SourceLocation location) {
        this.index = index;
        this.type = type;
        this.regime = regime;
        this.kind = kind;
        this.name = name;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public int getIndex() { return index; }
    public TypeId getType() { return type; }
    public Regime getRegime() { return regime; }
    public LocalKind getKind() { return kind; }
    public String getName() { return name; }
    public SourceLocation getLocation() { return location; }

    public boolean isBorrow() {
        return regime == Regime.BORROW;
    }

    /** 返回槽与参数在任何 pass 中都保留 */
    public boolean isPinned() {
        return kind == LocalKind.RETURN || kind == LocalKind.ARG;
    }

    public MirLocal withIndex(int newIndex) {
        if (newIndex == index) return this;
        return new MirLocal(newIndex, type, regime, kind, name, location);
    }

    @Override
    public String toString() {
        return "_" + index + (name != null ? "(" + name + ")" : "") + ": " + type + " " + regime;
    }
}
