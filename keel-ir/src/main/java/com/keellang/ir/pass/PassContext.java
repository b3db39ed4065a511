package com.keellang.ir.pass;

import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.MirOptions;

/**
 * pass 运行时的只读环境：类型/符号快照与配置。
 */
public class PassContext {

    private final TypeTable types;
    private final SymbolTable symbols;
    private final MirOptions options;

    public PassContext(TypeTable types, SymbolTable symbols, MirOptions options) {
        this.types = types;
        this.symbols = symbols;
        this.options = options;
    }

    public TypeTable getTypes() { return types; }
    public SymbolTable getSymbols() { return symbols; }
    public MirOptions getOptions() { return options; }
}
