package com.keellang.ir.diag;

import com.keellang.compiler.ast.SourceLocation;

/**
 * 输入超出配置的规模上限（块数、pass 迭代次数、嵌套深度）。
 */
public class CompilationTooLargeException extends RuntimeException {
    private final Stage stage;
    private final String function;
    private final SourceLocation location;

    public CompilationTooLargeException(Stage stage, String function, String message, SourceLocation location) {
        super(message);
        this.stage = stage;
        this.function = function;
        this.location = location;
    }

    public Stage getStage() { return stage; }
    public String getFunction() { return function; }
    public SourceLocation getLocation() { return location; }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Kind.TOO_LARGE, stage, function,
                Diagnostic.NO_INDEX, Diagnostic.NO_INDEX, getMessage(), location);
    }
}
