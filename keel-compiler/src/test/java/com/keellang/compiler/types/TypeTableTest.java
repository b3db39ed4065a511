package com.keellang.compiler.types;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeTable 测试")
class TypeTableTest {

    private TypeTable.Builder builder;
    private TypeId point;

    @BeforeEach
    void setUp() {
        builder = TypeTable.builder();
        TypeId i32 = builder.primitive(TypeKind.I32);
        point = builder.struct("Point", Arrays.asList(
                new TypeDesc.StructField(FieldId.of(3), "x", i32),
                new TypeDesc.StructField(FieldId.of(7), "y", i32)));
    }

    @Nested
    @DisplayName("驻留")
    class Interning {

        @Test
        @DisplayName("基本类型预先驻留在固定位置")
        void testPrimitivesPreInterned() {
            TypeTable types = TypeTable.builder().build();

            assertThat(types.size()).isEqualTo(7);
            assertThat(types.unit()).isEqualTo(TypeId.of(0));
            assertThat(types.i32()).isEqualTo(TypeId.of(2));
            assertThat(types.string()).isEqualTo(TypeId.of(6));
            assertThat(types.regimeOf(types.string())).isEqualTo(Regime.GC_HANDLE);
        }

        @Test
        @DisplayName("结构相同的类型得到同一个 ID")
        void testStructuralInterning() {
            TypeId a = builder.borrow(point);
            TypeId b = builder.borrow(point);

            assertThat(a).isEqualTo(b);
            assertThat(builder.gcRef(point)).isNotEqualTo(a);
        }

        @Test
        @DisplayName("引用未驻留的元素类型时拒绝")
        void testUnknownElementRejected() {
            assertThatThrownBy(() -> builder.array(TypeId.of(99), 4))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not interned");
        }

        @Test
        @DisplayName("构建后的快照不受后续驻留影响")
        void testSnapshot() {
            TypeTable types = builder.build();
            TypeId later = builder.manualRef(point);

            assertThat(types.contains(later)).isFalse();
            assertThat(types.find(TypeDesc.pointer(TypeKind.MANUAL_REF, point))).isNull();
        }
    }

    @Nested
    @DisplayName("查询")
    class Queries {

        @Test
        @DisplayName("字段句柄映射到位置")
        void testFieldIndex() {
            TypeTable types = builder.build();

            assertThat(types.fieldIndex(point, FieldId.of(7))).isEqualTo(1);
            assertThat(types.fieldIndex(point, FieldId.of(8))).isEqualTo(-1);
            assertThat(types.fieldType(point, 0)).isEqualTo(types.i32());
        }

        @Test
        @DisplayName("非指针类型没有被指向类型")
        void testPointeeOfNonPointer() {
            TypeTable types = builder.build();

            assertThatThrownBy(() -> types.pointee(types.i32()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("not a pointer type: i32");
        }

        @Test
        @DisplayName("字段下标越界")
        void testFieldOutOfRange() {
            TypeTable types = builder.build();

            assertThatThrownBy(() -> types.fieldType(point, 2))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("out of range for Point");
        }

        @Test
        @DisplayName("可读类型名递归展开")
        void testDisplay() {
            TypeId array = builder.array(point, 4);
            TypeId handle = builder.gcRef(array);
            TypeId owned = builder.manualRef(point);
            TypeTable types = builder.build();

            assertThat(types.display(handle)).isEqualTo("gc [Point; 4]");
            assertThat(types.display(owned)).isEqualTo("own Point");
            assertThat(types.display(types.f64())).isEqualTo("f64");
        }

        @Test
        @DisplayName("未知类型 ID")
        void testUnknownId() {
            TypeTable types = builder.build();

            assertThat(types.contains(TypeId.of(1000))).isFalse();
            assertThatThrownBy(() -> types.kindOf(TypeId.of(1000)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("空结构体也是值类型")
    void testEmptyStruct() {
        TypeId empty = builder.struct("Empty", Collections.emptyList());
        TypeTable types = builder.build();

        assertThat(types.structFields(empty)).isEmpty();
        assertThat(types.regimeOf(empty)).isEqualTo(Regime.VALUE);
    }
}
