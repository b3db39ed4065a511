package com.keellang.compiler.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型驻留表的只读快照。
 * <p>
 * 由类型检查器通过 {@link Builder} 构建，构建完成后不可变，
 * 可在多个编译工作线程之间共享读取。
 */
public final class TypeTable {

    private final List<TypeDesc> types;
    private final Map<TypeDesc, TypeId> index;
    private final Map<TypeKind, TypeId> primitives;

    private TypeTable(List<TypeDesc> types, Map<TypeDesc, TypeId> index, Map<TypeKind, TypeId> primitives) {
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.index = Collections.unmodifiableMap(new HashMap<>(index));
        this.primitives = Collections.unmodifiableMap(new EnumMap<>(primitives));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return types.size();
    }

    public boolean contains(TypeId id) {
        return id != null && id.getIndex() < types.size();
    }

    public TypeDesc get(TypeId id) {
        if (!contains(id)) {
            throw new IllegalArgumentException("unknown type id: " + id);
        }
        return types.get(id.getIndex());
    }

    public TypeKind kindOf(TypeId id) {
        return get(id).getKind();
    }

    public Regime regimeOf(TypeId id) {
        return get(id).getRegime();
    }

    /** 查找已驻留的类型，不存在时返回 null */
    public TypeId find(TypeDesc desc) {
        return index.get(desc);
    }

    public TypeId primitive(TypeKind kind) {
        TypeId id = primitives.get(kind);
        if (id == null) throw new IllegalArgumentException("not a primitive kind: " + kind);
        return id;
    }

    public TypeId unit() { return primitive(TypeKind.UNIT); }
    public TypeId bool() { return primitive(TypeKind.BOOL); }
    public TypeId i32() { return primitive(TypeKind.I32); }
    public TypeId i64() { return primitive(TypeKind.I64); }
    public TypeId f32() { return primitive(TypeKind.F32); }
    public TypeId f64() { return primitive(TypeKind.F64); }
    public TypeId string() { return primitive(TypeKind.STRING); }

    /** 指针（句柄/借用）的被指向类型 */
    public TypeId pointee(TypeId pointer) {
        TypeDesc desc = get(pointer);
        if (!desc.getKind().isPointer()) {
            throw new IllegalArgumentException("not a pointer type: " + display(pointer));
        }
        return desc.getElement();
    }

    /** 结构体第 index 个字段的类型 */
    public TypeId fieldType(TypeId struct, int fieldIndex) {
        List<TypeDesc.StructField> fields = structFields(struct);
        if (fieldIndex < 0 || fieldIndex >= fields.size()) {
            throw new IllegalArgumentException("field index " + fieldIndex + " out of range for " + display(struct));
        }
        return fields.get(fieldIndex).getType();
    }

    /** 字段句柄在结构体中的位置，未找到返回 -1 */
    public int fieldIndex(TypeId struct, FieldId field) {
        List<TypeDesc.StructField> fields = structFields(struct);
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getId().equals(field)) return i;
        }
        return -1;
    }

    public List<TypeDesc.StructField> structFields(TypeId struct) {
        TypeDesc desc = get(struct);
        if (desc.getKind() != TypeKind.STRUCT) {
            throw new IllegalArgumentException("not a struct type: " + display(struct));
        }
        return desc.getFields();
    }

    /** 可读的类型名（递归展开指针/数组） */
    public String display(TypeId id) {
        if (!contains(id)) return String.valueOf(id);
        TypeDesc desc = types.get(id.getIndex());
        switch (desc.getKind()) {
            case STRUCT: return desc.getName();
            case ARRAY: return "[" + display(desc.getElement()) + "; " + desc.getLength() + "]";
            case GC_REF: return "gc " + display(desc.getElement());
            case MANUAL_REF: return "own " + display(desc.getElement());
            case BORROW: return "&" + display(desc.getElement());
            default: return desc.getKind().name().toLowerCase();
        }
    }

    /**
     * 类型驻留构建器。基本类型在创建时预先驻留。
     */
    public static final class Builder {
        private final List<TypeDesc> types = new ArrayList<>();
        private final Map<TypeDesc, TypeId> index = new HashMap<>();
        private final Map<TypeKind, TypeId> primitives = new EnumMap<>(TypeKind.class);

        private Builder() {
            for (TypeKind kind : new TypeKind[]{TypeKind.UNIT, TypeKind.BOOL, TypeKind.I32, TypeKind.I64,
                    TypeKind.F32, TypeKind.F64, TypeKind.STRING}) {
                primitives.put(kind, intern(TypeDesc.primitive(kind)));
            }
        }

        public TypeId intern(TypeDesc desc) {
            TypeId existing = index.get(desc);
            if (existing != null) return existing;
            if (desc.getElement() != null && desc.getElement().getIndex() >= types.size()) {
                throw new IllegalArgumentException("element type not interned: " + desc.getElement());
            }
            TypeId id = TypeId.of(types.size());
            types.add(desc);
            index.put(desc, id);
            return id;
        }

        public TypeId primitive(TypeKind kind) {
            return primitives.get(kind);
        }

        public TypeId struct(String name, List<TypeDesc.StructField> fields) {
            return intern(TypeDesc.struct(name, fields));
        }

        public TypeId gcRef(TypeId pointee) {
            return intern(TypeDesc.pointer(TypeKind.GC_REF, pointee));
        }

        public TypeId manualRef(TypeId pointee) {
            return intern(TypeDesc.pointer(TypeKind.MANUAL_REF, pointee));
        }

        public TypeId borrow(TypeId pointee) {
            return intern(TypeDesc.pointer(TypeKind.BORROW, pointee));
        }

        public TypeId array(TypeId element, int length) {
            return intern(TypeDesc.array(element, length));
        }

        public TypeTable build() {
            return new TypeTable(types, index, primitives);
        }
    }
}
