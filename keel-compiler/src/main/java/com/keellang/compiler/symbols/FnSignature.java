package com.keellang.compiler.symbols;

import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.SymbolId;
import com.keellang.compiler.types.TypeId;

import java.util.List;
import java.util.Objects;

/**
 * 函数签名（类型检查器已解析）。
 */
public final class FnSignature {

    private final FnId id;
    private final SymbolId symbol;
    private final String name;
    private final List<TypeId> paramTypes;
    private final TypeId returnType;
    private final Intrinsic intrinsic;

    public FnSignature(FnId id, SymbolId symbol, String name, List<TypeId> paramTypes,
                       TypeId returnType, Intrinsic intrinsic) {
        this.id = Objects.requireNonNull(id);
        this.symbol = symbol;
        this.name = name;
        this.paramTypes = List.copyOf(paramTypes);
        this.returnType = Objects.requireNonNull(returnType);
        this.intrinsic = intrinsic != null ? intrinsic : Intrinsic.NONE;
    }

    public FnSignature(FnId id, SymbolId symbol, String name, List<TypeId> paramTypes, TypeId returnType) {
        this(id, symbol, name, paramTypes, returnType, Intrinsic.NONE);
    }

    public FnId getId() { return id; }
    public SymbolId getSymbol() { return symbol; }
    public String getName() { return name; }
    public List<TypeId> getParamTypes() { return paramTypes; }
    public TypeId getReturnType() { return returnType; }
    public Intrinsic getIntrinsic() { return intrinsic; }

    public boolean isRelease() {
        return intrinsic == Intrinsic.RELEASE;
    }

    @Override
    public String toString() {
        return name + "/" + paramTypes.size() + " (" + id + ")";
    }
}
