package com.keellang.ir.pass.mir;

import com.keellang.compiler.types.Regime;
import com.keellang.ir.TestPrograms;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.BinaryOp;
import com.keellang.ir.mir.ConstValue;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirBuilder;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.Rvalue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.keellang.ir.TestPrograms.LOC;
import static com.keellang.ir.TestPrograms.PICK;
import static org.assertj.core.api.Assertions.*;

@DisplayName("DeadTempElimination 测试")
class DeadTempEliminationTest {

    private TestPrograms p;
    private MirFunction fn;

    @BeforeEach
    void setUp() {
        p = new TestPrograms();
        fn = p.mirFunction("f", p.types.i32(), p.types.i32());
    }

    private int temp() {
        return fn.newLocal(p.types.i32(), Regime.VALUE, LocalKind.TEMP, null, LOC);
    }

    private MirFunction eliminate(MirFunction input) {
        return new DeadTempElimination().run(input, p.passContext());
    }

    private static List<String> statements(BasicBlock block) {
        return block.getStatements().stream().map(Object::toString).collect(Collectors.toList());
    }

    private static Rvalue copy(int local) {
        return Rvalue.use(Operand.copy(Place.local(local)));
    }

    @Test
    @DisplayName("未读取的运算被删除，局部变量重新编号")
    void testDeadArithmeticRemoved() {
        int dead = temp();
        int live = temp();
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(dead), Rvalue.binary(BinaryOp.ADD, Operand.copy(Place.local(1)),
                Operand.constant(ConstValue.ofI32(1), p.types.i32())), LOC);
        b.emitAssign(Place.local(live), copy(1), LOC);
        b.emitAssign(Place.local(0), copy(live), LOC);
        b.emitReturn(LOC);

        MirFunction result = eliminate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("_2 = copy _1", "_0 = copy _2");
        assertThat(result.getLocals()).hasSize(3);
        assertThat(result.getLocal(2).getIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("结果无人读取的调用保留为 eval")
    void testDeadCallBecomesEval() {
        int dead = temp();
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(dead), Rvalue.call(PICK,
                Collections.singletonList(Operand.constant(ConstValue.ofI32(1), p.types.i32()))), LOC);
        b.emitAssign(Place.local(0), copy(1), LOC);
        b.emitReturn(LOC);

        MirFunction result = eliminate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("eval fn4(const 1)", "_0 = copy _1");
        assertThat(result.getLocals()).hasSize(2);
    }

    @Test
    @DisplayName("死赋值链被逐级删除")
    void testDeadChain() {
        int a = temp();
        int b2 = temp();
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(a), copy(1), LOC);
        b.emitAssign(Place.local(b2), copy(a), LOC);
        b.emitAssign(Place.local(0), copy(1), LOC);
        b.emitReturn(LOC);

        MirFunction result = eliminate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("_0 = copy _1");
    }

    @Test
    @DisplayName("返回槽与参数即使未读取也保留")
    void testPinnedLocalsKept() {
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(0), Rvalue.use(Operand.constant(ConstValue.ofI32(0), p.types.i32())), LOC);
        b.emitReturn(LOC);

        MirFunction result = eliminate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("_0 = const 0");
        assertThat(result.getLocals()).hasSize(2);
        assertThat(result.getLocal(1).getKind()).isEqualTo(LocalKind.ARG);
    }

    @Test
    @DisplayName("终止指令读取的临时变量保留")
    void testTerminatorReadKeepsLocal() {
        int flag = fn.newLocal(p.types.bool(), Regime.VALUE, LocalKind.TEMP, null, LOC);
        MirBuilder b = new MirBuilder(fn, 100);
        BasicBlock yes = b.newBlock();
        BasicBlock no = b.newBlock();
        b.emitAssign(Place.local(flag), Rvalue.binary(BinaryOp.GT, Operand.copy(Place.local(1)),
                Operand.constant(ConstValue.ofI32(0), p.types.i32())), LOC);
        b.emitBranch(Operand.copy(Place.local(flag)), yes.getId(), no.getId(), LOC);
        b.switchToBlock(yes);
        b.emitReturn(LOC);
        b.switchToBlock(no);
        b.emitReturn(LOC);

        MirFunction result = eliminate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("_2 = GT(copy _1, const 0)");
    }
}
