package com.keellang.ir.mir;

import java.util.Objects;

/**
 * MIR 常量值。浮点相等按位比较，保证打印/比较结果稳定。
 */
public final class ConstValue {

    public enum ConstKind {
        UNIT, BOOL, I32, I64, F32, F64, STRING
    }

    public static final ConstValue UNIT = new ConstValue(ConstKind.UNIT, null);
    public static final ConstValue TRUE = new ConstValue(ConstKind.BOOL, Boolean.TRUE);
    public static final ConstValue FALSE = new ConstValue(ConstKind.BOOL, Boolean.FALSE);

    private final ConstKind kind;
    private final Object value;

    private ConstValue(ConstKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ConstValue ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ConstValue ofI32(int value) {
        return new ConstValue(ConstKind.I32, value);
    }

    public static ConstValue ofI64(long value) {
        return new ConstValue(ConstKind.I64, value);
    }

    public static ConstValue ofF32(float value) {
        return new ConstValue(ConstKind.F32, value);
    }

    public static ConstValue ofF64(double value) {
        return new ConstValue(ConstKind.F64, value);
    }

    public static ConstValue ofString(String value) {
        return new ConstValue(ConstKind.STRING, Objects.requireNonNull(value));
    }

    public ConstKind getKind() { return kind; }
    public Object getValue() { return value; }

    public boolean asBool() { return (Boolean) value; }
    public int asI32() { return (Integer) value; }
    public long asI64() { return (Long) value; }
    public float asF32() { return (Float) value; }
    public double asF64() { return (Double) value; }
    public String asString() { return (String) value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstValue)) return false;
        ConstValue that = (ConstValue) o;
        if (kind != that.kind) return false;
        switch (kind) {
            case F32: return Float.floatToIntBits(asF32()) == Float.floatToIntBits(that.asF32());
            case F64: return Double.doubleToLongBits(asF64()) == Double.doubleToLongBits(that.asF64());
            default: return Objects.equals(value, that.value);
        }
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case UNIT: return "()";
            case STRING: return '"' + escape(asString()) + '"';
            case I64: return value + "_i64";
            case F32: return value + "_f32";
            case F64: return value + "_f64";
            default: return String.valueOf(value);
        }
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
