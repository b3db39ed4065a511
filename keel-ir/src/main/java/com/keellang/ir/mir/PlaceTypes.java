package com.keellang.ir.mir;

import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeKind;
import com.keellang.compiler.types.TypeTable;

/**
 * 按投影逐步推导 place / 操作数的类型。
 */
public final class PlaceTypes {

    private PlaceTypes() {
    }

    /**
     * @throws IllegalArgumentException 局部变量未声明或投影与类型不符
     */
    public static TypeId typeOf(Place place, MirFunction fn, TypeTable types) {
        if (place.getLocal() < 0 || place.getLocal() >= fn.getLocals().size()) {
            throw new IllegalArgumentException("undeclared local _" + place.getLocal());
        }
        TypeId current = fn.getLocal(place.getLocal()).getType();
        for (Projection p : place.getProjections()) {
            TypeKind kind = types.kindOf(current);
            if (p instanceof Projection.Deref) {
                if (!kind.isPointer()) {
                    throw new IllegalArgumentException("deref of non-pointer " + types.display(current) + " in " + place);
                }
                current = types.pointee(current);
            } else if (p instanceof Projection.Field) {
                if (kind != TypeKind.STRUCT) {
                    throw new IllegalArgumentException("field of non-struct " + types.display(current) + " in " + place);
                }
                current = types.fieldType(current, ((Projection.Field) p).getIndex());
            } else if (p instanceof Projection.Index) {
                if (kind != TypeKind.ARRAY) {
                    throw new IllegalArgumentException("index of non-array " + types.display(current) + " in " + place);
                }
                int indexLocal = ((Projection.Index) p).getLocal();
                if (indexLocal < 0 || indexLocal >= fn.getLocals().size()) {
                    throw new IllegalArgumentException("undeclared index local _" + indexLocal);
                }
                current = types.get(current).getElement();
            }
        }
        return current;
    }

    public static TypeId typeOf(Operand operand, MirFunction fn, TypeTable types) {
        if (operand instanceof Operand.Constant) {
            return ((Operand.Constant) operand).getType();
        }
        return typeOf(operand.getPlace(), fn, types);
    }
}
