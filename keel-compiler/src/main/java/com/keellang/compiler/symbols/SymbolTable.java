package com.keellang.compiler.symbols;

import com.keellang.compiler.types.FnId;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 函数符号表的只读快照。
 */
public final class SymbolTable {

    private final Map<FnId, FnSignature> functions;
    private final Map<Intrinsic, FnSignature> intrinsics;

    private SymbolTable(Map<FnId, FnSignature> functions, Map<Intrinsic, FnSignature> intrinsics) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.intrinsics = Collections.unmodifiableMap(new EnumMap<>(intrinsics));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 查找函数签名，未声明时返回 null */
    public FnSignature function(FnId id) {
        return functions.get(id);
    }

    public Collection<FnSignature> functions() {
        return functions.values();
    }

    /** 查找内建函数，未声明时返回 null */
    public FnSignature intrinsic(Intrinsic kind) {
        return intrinsics.get(kind);
    }

    public static final class Builder {
        private final Map<FnId, FnSignature> functions = new LinkedHashMap<>();
        private final Map<Intrinsic, FnSignature> intrinsics = new EnumMap<>(Intrinsic.class);

        private Builder() {
        }

        public Builder add(FnSignature signature) {
            if (functions.putIfAbsent(signature.getId(), signature) != null) {
                throw new IllegalArgumentException("duplicate function id: " + signature.getId());
            }
            if (signature.getIntrinsic() != Intrinsic.NONE) {
                intrinsics.put(signature.getIntrinsic(), signature);
            }
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(functions, intrinsics);
        }
    }
}
