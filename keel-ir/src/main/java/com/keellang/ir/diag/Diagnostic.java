package com.keellang.ir.diag;

import com.keellang.compiler.ast.SourceLocation;

/**
 * 结构化诊断记录：阶段、函数、块/指令定位、消息。
 * 本核心只产出编译器缺陷与规模超限两类诊断，不产出用户语义错误。
 */
public final class Diagnostic {

    public enum Kind {
        /** 内部不变量被破坏（上游阶段或本核心的 bug） */
        DEFECT,
        /** 输入规模超出配置上限，可恢复 */
        TOO_LARGE
    }

    /** 块/指令定位缺省值 */
    public static final int NO_INDEX = -1;

    private final Kind kind;
    private final Stage stage;
    private final String function;
    private final int block;
    private final int instruction;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(Kind kind, Stage stage, String function, int block, int instruction,
                      String message, SourceLocation location) {
        this.kind = kind;
        this.stage = stage;
        this.function = function;
        this.block = block;
        this.instruction = instruction;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Kind getKind() { return kind; }
    public Stage getStage() { return stage; }
    public String getFunction() { return function; }
    public int getBlock() { return block; }
    public int getInstruction() { return instruction; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    public boolean isDefect() {
        return kind == Kind.DEFECT;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind == Kind.DEFECT ? "compiler defect" : "compilation too large");
        sb.append(" [").append(stage.getDisplayName()).append("] ").append(function);
        if (block >= 0) {
            sb.append(" B").append(block);
            if (instruction >= 0) sb.append('[').append(instruction).append(']');
        }
        sb.append(": ").append(message);
        if (location != SourceLocation.UNKNOWN) sb.append(" (").append(location).append(')');
        return sb.toString();
    }
}
