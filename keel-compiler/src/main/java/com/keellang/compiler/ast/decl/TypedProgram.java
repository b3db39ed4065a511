package com.keellang.compiler.ast.decl;

import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.TypeTable;

import java.util.List;

/**
 * 类型检查器的完整产出：驻留表快照 + 已类型化的函数列表。
 * 快照在编译会话内只读共享。
 */
public final class TypedProgram {
    private final String sourceName;
    private final TypeTable types;
    private final SymbolTable symbols;
    private final List<FunDecl> functions;

    public TypedProgram(String sourceName, TypeTable types, SymbolTable symbols, List<FunDecl> functions) {
        this.sourceName = sourceName;
        this.types = types;
        this.symbols = symbols;
        this.functions = List.copyOf(functions);
    }

    public String getSourceName() {
        return sourceName;
    }

    public TypeTable getTypes() {
        return types;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public List<FunDecl> getFunctions() {
        return functions;
    }
}
