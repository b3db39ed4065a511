package com.keellang.ir.verify;

/**
 * 单条校验失败：违反的不变量、所在块与指令下标。
 * 终止指令的下标等于块内语句数。
 */
public final class Violation {

    /** 与具体块/指令无关时的定位值 */
    public static final int NO_INDEX = -1;

    private final ViolationKind kind;
    private final int block;
    private final int instruction;
    private final String message;

    public Violation(ViolationKind kind, int block, int instruction, String message) {
        this.kind = kind;
        this.block = block;
        this.instruction = instruction;
        this.message = message;
    }

    public ViolationKind getKind() { return kind; }
    public int getBlock() { return block; }
    public int getInstruction() { return instruction; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (block >= 0) {
            sb.append(" at B").append(block);
            if (instruction >= 0) sb.append('[').append(instruction).append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
