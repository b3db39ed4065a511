package com.keellang.compiler.types;

/**
 * 类型种类。
 */
public enum TypeKind {
    UNIT(Regime.VALUE),
    BOOL(Regime.VALUE),
    I32(Regime.VALUE),
    I64(Regime.VALUE),
    F32(Regime.VALUE),
    F64(Regime.VALUE),
    STRING(Regime.GC_HANDLE),
    STRUCT(Regime.VALUE),
    ARRAY(Regime.VALUE),
    GC_REF(Regime.GC_HANDLE),
    MANUAL_REF(Regime.MANUAL_HANDLE),
    BORROW(Regime.BORROW);

    private final Regime regime;

    TypeKind(Regime regime) {
        this.regime = regime;
    }

    public Regime getRegime() {
        return regime;
    }

    public boolean isInteger() {
        return this == I32 || this == I64;
    }

    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    /** 是否携带被指向类型（可解引用） */
    public boolean isPointer() {
        return this == GC_REF || this == MANUAL_REF || this == BORROW;
    }
}
