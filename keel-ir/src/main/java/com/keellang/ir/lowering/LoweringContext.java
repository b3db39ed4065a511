package com.keellang.ir.lowering;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.expr.Literal;
import com.keellang.compiler.ast.expr.Literal.LiteralKind;
import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.MirOptions;
import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.CompilerDefectException;
import com.keellang.ir.diag.Stage;

/**
 * AST → HIR 降级上下文。
 * 持有只读的类型/符号快照，并跟踪嵌套深度。每个函数一个实例，不跨线程共享。
 */
public class LoweringContext {

    private final TypeTable types;
    private final SymbolTable symbols;
    private final MirOptions options;
    private final String function;
    private int depth;

    public LoweringContext(TypeTable types, SymbolTable symbols, MirOptions options, String function) {
        this.types = types;
        this.symbols = symbols;
        this.options = options;
        this.function = function;
    }

    public TypeTable getTypes() { return types; }
    public SymbolTable getSymbols() { return symbols; }
    public String getFunction() { return function; }

    /**
     * 进入一层嵌套。超过上限时抛出规模超限异常。
     */
    public void enter(SourceLocation loc) {
        if (++depth > options.getMaxNestingDepth()) {
            throw new CompilationTooLargeException(Stage.DESUGAR, function,
                    "nesting deeper than " + options.getMaxNestingDepth(), loc);
        }
    }

    public void exit() {
        depth--;
    }

    public CompilerDefectException defect(String message, SourceLocation loc) {
        return new CompilerDefectException(Stage.DESUGAR, function, message, loc);
    }

    /**
     * 创建 boolean 字面量。
     */
    public Literal boolLiteral(SourceLocation loc, boolean value) {
        return new Literal(loc, types.bool(), Regime.VALUE, value, LiteralKind.BOOL);
    }

    /**
     * 创建字符串字面量。
     */
    public Literal stringLiteral(SourceLocation loc, String value) {
        return new Literal(loc, types.string(), Regime.GC_HANDLE, value, LiteralKind.STRING);
    }
}
