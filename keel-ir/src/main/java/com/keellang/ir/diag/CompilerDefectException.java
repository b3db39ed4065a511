package com.keellang.ir.diag;

import com.keellang.compiler.ast.SourceLocation;

/**
 * 编译器缺陷：内部结构/所有权不变量被破坏。
 * 终止当前函数的处理，由 {@link com.keellang.ir.KeelMirCompiler} 转为诊断记录。
 */
public class CompilerDefectException extends RuntimeException {
    private final Stage stage;
    private final String function;
    private final int block;
    private final int instruction;
    private final SourceLocation location;

    public CompilerDefectException(Stage stage, String function, String message, SourceLocation location) {
        this(stage, function, Diagnostic.NO_INDEX, Diagnostic.NO_INDEX, message, location);
    }

    public CompilerDefectException(Stage stage, String function, int block, int instruction,
                                   String message, SourceLocation location) {
        super(message);
        this.stage = stage;
        this.function = function;
        this.block = block;
        this.instruction = instruction;
        this.location = location;
    }

    public Stage getStage() { return stage; }
    public String getFunction() { return function; }
    public int getBlock() { return block; }
    public int getInstruction() { return instruction; }
    public SourceLocation getLocation() { return location; }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Kind.DEFECT, stage, function, block, instruction,
                getMessage(), location);
    }
}
