package com.keellang.ir.mir;

import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 函数签名：参数与返回值的类型及制式。
 */
public final class MirSignature {

    private final List<TypeId> paramTypes;
    private final List<Regime> paramRegimes;
    private final TypeId returnType;
    private final Regime returnRegime;

    public MirSignature(List<TypeId> paramTypes, List<Regime> paramRegimes,
                        TypeId returnType, Regime returnRegime) {
        if (paramTypes.size() != paramRegimes.size()) {
            throw new IllegalArgumentException("param types/regimes size mismatch");
        }
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.paramRegimes = Collections.unmodifiableList(new ArrayList<>(paramRegimes));
        this.returnType = returnType;
        this.returnRegime = returnRegime;
    }

    public List<TypeId> getParamTypes() { return paramTypes; }
    public List<Regime> getParamRegimes() { return paramRegimes; }
    public TypeId getReturnType() { return returnType; }
    public Regime getReturnRegime() { return returnRegime; }

    public int getParamCount() {
        return paramTypes.size();
    }
}
