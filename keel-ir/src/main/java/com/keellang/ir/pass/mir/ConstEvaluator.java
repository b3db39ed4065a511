package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BinaryOp;
import com.keellang.ir.mir.ConstValue;
import com.keellang.ir.mir.ConstValue.ConstKind;
import com.keellang.ir.mir.UnaryOp;

/**
 * 常量求值。整数按定宽补码回绕（移位量按位宽取模），浮点按 IEEE 754。
 * 无法在编译期安全求值的组合（整数除零、类型不一致）返回 null。
 */
public final class ConstEvaluator {

    private ConstEvaluator() {
    }

    public static ConstValue binary(BinaryOp op, ConstValue left, ConstValue right) {
        if (left.getKind() != right.getKind()) return null;
        switch (left.getKind()) {
            case I32: return binaryI32(op, left.asI32(), right.asI32());
            case I64: return binaryI64(op, left.asI64(), right.asI64());
            case F32: return binaryF32(op, left.asF32(), right.asF32());
            case F64: return binaryF64(op, left.asF64(), right.asF64());
            case BOOL: return binaryBool(op, left.asBool(), right.asBool());
            case STRING:
                if (op == BinaryOp.EQ) return ConstValue.ofBool(left.asString().equals(right.asString()));
                if (op == BinaryOp.NE) return ConstValue.ofBool(!left.asString().equals(right.asString()));
                return null;
            default:
                return null;
        }
    }

    public static ConstValue unary(UnaryOp op, ConstValue operand) {
        ConstKind kind = operand.getKind();
        switch (op) {
            case NEG:
                if (kind == ConstKind.I32) return ConstValue.ofI32(-operand.asI32());
                if (kind == ConstKind.I64) return ConstValue.ofI64(-operand.asI64());
                if (kind == ConstKind.F32) return ConstValue.ofF32(-operand.asF32());
                if (kind == ConstKind.F64) return ConstValue.ofF64(-operand.asF64());
                return null;
            case NOT:
                return kind == ConstKind.BOOL ? ConstValue.ofBool(!operand.asBool()) : null;
            case BIT_NOT:
                if (kind == ConstKind.I32) return ConstValue.ofI32(~operand.asI32());
                if (kind == ConstKind.I64) return ConstValue.ofI64(~operand.asI64());
                return null;
            default:
                return null;
        }
    }

    private static ConstValue binaryI32(BinaryOp op, int a, int b) {
        switch (op) {
            case ADD: return ConstValue.ofI32(a + b);
            case SUB: return ConstValue.ofI32(a - b);
            case MUL: return ConstValue.ofI32(a * b);
            case DIV: return b == 0 ? null : ConstValue.ofI32(a / b);
            case MOD: return b == 0 ? null : ConstValue.ofI32(a % b);
            case BAND: return ConstValue.ofI32(a & b);
            case BOR: return ConstValue.ofI32(a | b);
            case BXOR: return ConstValue.ofI32(a ^ b);
            case SHL: return ConstValue.ofI32(a << b);
            case SHR: return ConstValue.ofI32(a >> b);
            case EQ: return ConstValue.ofBool(a == b);
            case NE: return ConstValue.ofBool(a != b);
            case LT: return ConstValue.ofBool(a < b);
            case GT: return ConstValue.ofBool(a > b);
            case LE: return ConstValue.ofBool(a <= b);
            case GE: return ConstValue.ofBool(a >= b);
            default: return null;
        }
    }

    private static ConstValue binaryI64(BinaryOp op, long a, long b) {
        switch (op) {
            case ADD: return ConstValue.ofI64(a + b);
            case SUB: return ConstValue.ofI64(a - b);
            case MUL: return ConstValue.ofI64(a * b);
            case DIV: return b == 0 ? null : ConstValue.ofI64(a / b);
            case MOD: return b == 0 ? null : ConstValue.ofI64(a % b);
            case BAND: return ConstValue.ofI64(a & b);
            case BOR: return ConstValue.ofI64(a | b);
            case BXOR: return ConstValue.ofI64(a ^ b);
            case SHL: return ConstValue.ofI64(a << b);
            case SHR: return ConstValue.ofI64(a >> b);
            case EQ: return ConstValue.ofBool(a == b);
            case NE: return ConstValue.ofBool(a != b);
            case LT: return ConstValue.ofBool(a < b);
            case GT: return ConstValue.ofBool(a > b);
            case LE: return ConstValue.ofBool(a <= b);
            case GE: return ConstValue.ofBool(a >= b);
            default: return null;
        }
    }

    private static ConstValue binaryF32(BinaryOp op, float a, float b) {
        switch (op) {
            case ADD: return ConstValue.ofF32(a + b);
            case SUB: return ConstValue.ofF32(a - b);
            case MUL: return ConstValue.ofF32(a * b);
            case DIV: return ConstValue.ofF32(a / b);
            case MOD: return ConstValue.ofF32(a % b);
            case EQ: return ConstValue.ofBool(a == b);
            case NE: return ConstValue.ofBool(a != b);
            case LT: return ConstValue.ofBool(a < b);
            case GT: return ConstValue.ofBool(a > b);
            case LE: return ConstValue.ofBool(a <= b);
            case GE: return ConstValue.ofBool(a >= b);
            default: return null;
        }
    }

    private static ConstValue binaryF64(BinaryOp op, double a, double b) {
        switch (op) {
            case ADD: return ConstValue.ofF64(a + b);
            case SUB: return ConstValue.ofF64(a - b);
            case MUL: return ConstValue.ofF64(a * b);
            case DIV: return ConstValue.ofF64(a / b);
            case MOD: return ConstValue.ofF64(a % b);
            case EQ: return ConstValue.ofBool(a == b);
            case NE: return ConstValue.ofBool(a != b);
            case LT: return ConstValue.ofBool(a < b);
            case GT: return ConstValue.ofBool(a > b);
            case LE: return ConstValue.ofBool(a <= b);
            case GE: return ConstValue.ofBool(a >= b);
            default: return null;
        }
    }

    private static ConstValue binaryBool(BinaryOp op, boolean a, boolean b) {
        switch (op) {
            case BAND: return ConstValue.ofBool(a & b);
            case BOR: return ConstValue.ofBool(a | b);
            case BXOR: return ConstValue.ofBool(a ^ b);
            case EQ: return ConstValue.ofBool(a == b);
            case NE: return ConstValue.ofBool(a != b);
            default: return null;
        }
    }
}
