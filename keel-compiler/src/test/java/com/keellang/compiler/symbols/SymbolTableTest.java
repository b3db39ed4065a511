package com.keellang.compiler.symbols;

import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.TypeTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SymbolTable 测试")
class SymbolTableTest {

    private final TypeTable types = TypeTable.builder().build();

    @Test
    @DisplayName("按 ID 查找函数，按种类查找内建函数")
    void testLookup() {
        FnSignature concat = new FnSignature(FnId.of(1), null, "concat",
                Arrays.asList(types.string(), types.string()), types.string(), Intrinsic.STRING_CONCAT);
        SymbolTable symbols = SymbolTable.builder()
                .add(new FnSignature(FnId.of(0), null, "main", Collections.emptyList(), types.unit()))
                .add(concat)
                .build();

        assertThat(symbols.function(FnId.of(0)).getName()).isEqualTo("main");
        assertThat(symbols.function(FnId.of(2))).isNull();
        assertThat(symbols.intrinsic(Intrinsic.STRING_CONCAT)).isSameAs(concat);
        assertThat(symbols.intrinsic(Intrinsic.RELEASE)).isNull();
        assertThat(symbols.functions()).extracting(FnSignature::getName).containsExactly("main", "concat");
    }

    @Test
    @DisplayName("重复的函数 ID 被拒绝")
    void testDuplicateId() {
        SymbolTable.Builder builder = SymbolTable.builder()
                .add(new FnSignature(FnId.of(0), null, "a", Collections.emptyList(), types.unit()));

        assertThatThrownBy(() -> builder.add(new FnSignature(FnId.of(0), null, "b", Collections.emptyList(),
                types.unit())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate function id");
    }

    @Test
    @DisplayName("释放内建函数")
    void testRelease() {
        FnSignature free = new FnSignature(FnId.of(5), null, "free", Collections.singletonList(types.i32()),
                types.unit(), Intrinsic.RELEASE);

        assertThat(free.isRelease()).isTrue();
        assertThat(free.toString()).isEqualTo("free/1 (" + FnId.of(5) + ")");
    }
}
