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

@DisplayName("CopyPropagation 测试")
class CopyPropagationTest {

    private TestPrograms p;
    private MirFunction fn;
    private int t2;
    private int t3;

    @BeforeEach
    void setUp() {
        p = new TestPrograms();
        // fn f(_1: i32) -> i32, 临时变量 _2 _3
        fn = p.mirFunction("f", p.types.i32(), p.types.i32());
        t2 = fn.newLocal(p.types.i32(), Regime.VALUE, LocalKind.TEMP, null, LOC);
        t3 = fn.newLocal(p.types.i32(), Regime.VALUE, LocalKind.TEMP, null, LOC);
    }

    private MirFunction propagate(MirFunction input) {
        return new CopyPropagation().run(input, p.passContext());
    }

    private static List<String> statements(BasicBlock block) {
        return block.getStatements().stream().map(Object::toString).collect(Collectors.toList());
    }

    private Rvalue copy(int local) {
        return Rvalue.use(Operand.copy(Place.local(local)));
    }

    private Rvalue plusOne(int local) {
        return Rvalue.binary(BinaryOp.ADD, Operand.copy(Place.local(local)),
                Operand.constant(ConstValue.ofI32(1), p.types.i32()));
    }

    @Test
    @DisplayName("复制目标的读取改为读取源")
    void testPropagatesCopy() {
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(t2), copy(1), LOC);
        b.emitAssign(Place.local(t3), plusOne(t2), LOC);
        b.emitAssign(Place.local(0), copy(t3), LOC);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(statements(result.getBlock(0)))
                .containsExactly("_2 = copy _1", "_3 = ADD(copy _1, const 1)", "_0 = copy _3");
    }

    @Test
    @DisplayName("源被改写后复制关系失效")
    void testSourceRedefinitionKills() {
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(t2), copy(1), LOC);
        b.emitAssign(Place.local(1), Rvalue.use(Operand.constant(ConstValue.ofI32(5), p.types.i32())), LOC);
        b.emitAssign(Place.local(t3), plusOne(t2), LOC);
        b.emitAssign(Place.local(0), copy(t3), LOC);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(statements(result.getBlock(0))).contains("_3 = ADD(copy _2, const 1)");
    }

    @Test
    @DisplayName("源被移动后复制关系失效，move 操作数不改写")
    void testMoveKills() {
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(t2), copy(1), LOC);
        b.emitEval(Rvalue.call(PICK, Collections.singletonList(Operand.move(Place.local(t2)))), LOC);
        b.emitAssign(Place.local(0), copy(1), LOC);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(statements(result.getBlock(0))).contains("eval fn4(move _2)");
    }

    @Test
    @DisplayName("复制关系不跨越基本块")
    void testBlockLocal() {
        MirBuilder b = new MirBuilder(fn, 100);
        BasicBlock next = b.newBlock();
        b.emitAssign(Place.local(t2), copy(1), LOC);
        b.emitGoto(next.getId(), LOC);
        b.switchToBlock(next);
        b.emitAssign(Place.local(0), copy(t2), LOC);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(statements(result.getBlock(1))).containsExactly("_0 = copy _2");
    }

    @Test
    @DisplayName("终止指令读取的操作数同样改写")
    void testTerminatorRewritten() {
        int flag = fn.newLocal(p.types.bool(), Regime.VALUE, LocalKind.TEMP, null, LOC);
        int other = fn.newLocal(p.types.bool(), Regime.VALUE, LocalKind.TEMP, null, LOC);
        MirBuilder b = new MirBuilder(fn, 100);
        BasicBlock yes = b.newBlock();
        BasicBlock no = b.newBlock();
        b.emitAssign(Place.local(flag), Rvalue.use(Operand.constant(ConstValue.TRUE, p.types.bool())), LOC);
        b.emitAssign(Place.local(other), copy(flag), LOC);
        b.emitBranch(Operand.copy(Place.local(other)), yes.getId(), no.getId(), LOC);
        b.switchToBlock(yes);
        b.emitReturn(LOC);
        b.switchToBlock(no);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(result.getBlock(0).getTerminator().toString()).isEqualTo("branch copy _4 ? B1 : B2");
    }

    @Test
    @DisplayName("写入返回槽的复制不记录")
    void testReturnSlotNotRecorded() {
        MirBuilder b = new MirBuilder(fn, 100);
        b.emitAssign(Place.local(0), copy(1), LOC);
        b.emitAssign(Place.local(t2), copy(0), LOC);
        b.emitReturn(LOC);

        MirFunction result = propagate(fn);

        assertThat(statements(result.getBlock(0))).containsExactly("_0 = copy _1", "_2 = copy _0");
    }
}
