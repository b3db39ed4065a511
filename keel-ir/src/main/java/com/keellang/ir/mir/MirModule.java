package com.keellang.ir.mir;

import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.TypeTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个编译单元的 MIR 产出：通过校验的函数（保持源顺序）与共享的驻留表快照。
 */
public class MirModule {

    private final String sourceName;
    private final TypeTable types;
    private final SymbolTable symbols;
    private final List<MirFunction> functions;

    public MirModule(String sourceName, TypeTable types, SymbolTable symbols, List<MirFunction> functions) {
        this.sourceName = sourceName;
        this.types = types;
        this.symbols = symbols;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public String getSourceName() { return sourceName; }
    public TypeTable getTypes() { return types; }
    public SymbolTable getSymbols() { return symbols; }
    public List<MirFunction> getFunctions() { return functions; }

    public MirFunction getFunction(String name) {
        for (MirFunction fn : functions) {
            if (fn.getName().equals(name)) return fn;
        }
        return null;
    }
}
