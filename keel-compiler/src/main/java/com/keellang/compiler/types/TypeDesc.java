package com.keellang.compiler.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类型描述。由 {@link TypeTable} 驻留，结构相等的描述共享同一个 {@link TypeId}。
 */
public final class TypeDesc {

    private final TypeKind kind;
    private final String name;          // STRUCT 名称，其余为 null
    private final TypeId element;       // 指针的被指向类型 / 数组元素类型
    private final int length;           // ARRAY 长度
    private final List<StructField> fields;

    private TypeDesc(TypeKind kind, String name, TypeId element, int length, List<StructField> fields) {
        this.kind = kind;
        this.name = name;
        this.element = element;
        this.length = length;
        this.fields = fields;
    }

    public static TypeDesc primitive(TypeKind kind) {
        if (kind == TypeKind.STRUCT || kind == TypeKind.ARRAY || kind.isPointer()) {
            throw new IllegalArgumentException("not a primitive kind: " + kind);
        }
        return new TypeDesc(kind, null, null, 0, Collections.emptyList());
    }

    public static TypeDesc struct(String name, List<StructField> fields) {
        return new TypeDesc(TypeKind.STRUCT, name, null, 0, List.copyOf(fields));
    }

    public static TypeDesc pointer(TypeKind kind, TypeId pointee) {
        if (!kind.isPointer()) throw new IllegalArgumentException("not a pointer kind: " + kind);
        return new TypeDesc(kind, null, Objects.requireNonNull(pointee), 0, Collections.emptyList());
    }

    public static TypeDesc array(TypeId element, int length) {
        if (length < 0) throw new IllegalArgumentException("negative array length: " + length);
        return new TypeDesc(TypeKind.ARRAY, null, Objects.requireNonNull(element), length,
                Collections.emptyList());
    }

    public TypeKind getKind() { return kind; }
    public Regime getRegime() { return kind.getRegime(); }
    public String getName() { return name; }
    public TypeId getElement() { return element; }
    public int getLength() { return length; }
    public List<StructField> getFields() { return fields; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDesc)) return false;
        TypeDesc that = (TypeDesc) o;
        return kind == that.kind && length == that.length
                && Objects.equals(name, that.name)
                && Objects.equals(element, that.element)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, element, length, fields);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRUCT: return name;
            case ARRAY: return "[" + element + "; " + length + "]";
            case GC_REF: return "gc " + element;
            case MANUAL_REF: return "own " + element;
            case BORROW: return "&" + element;
            default: return kind.name().toLowerCase();
        }
    }

    /**
     * 结构体字段。
     */
    public static final class StructField {
        private final FieldId id;
        private final String name;
        private final TypeId type;

        public StructField(FieldId id, String name, TypeId type) {
            this.id = Objects.requireNonNull(id);
            this.name = name;
            this.type = Objects.requireNonNull(type);
        }

        public FieldId getId() { return id; }
        public String getName() { return name; }
        public TypeId getType() { return type; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StructField)) return false;
            StructField that = (StructField) o;
            return id.equals(that.id) && type.equals(that.type) && Objects.equals(name, that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, type);
        }

        @Override
        public String toString() {
            return name + ": " + type;
        }
    }
}
