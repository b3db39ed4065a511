package com.keellang.ir.verify;

import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.Regime;
import com.keellang.ir.MirOptions;
import com.keellang.ir.TestPrograms;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.ConstValue;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirBuilder;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.Rvalue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.keellang.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("MirVerifier 测试")
class MirVerifierTest {

    private TestPrograms p;

    @BeforeEach
    void setUp() {
        p = new TestPrograms();
    }

    private VerificationReport verify(MirFunction fn) {
        return new MirVerifier(p.types, p.symbols, p.options()).verify(fn);
    }

    private Operand i32(int value) {
        return Operand.constant(ConstValue.ofI32(value), p.types.i32());
    }

    /** translate(&_1, 1, 2) 的借用与调用 */
    private void emitTranslate(MirBuilder b, int borrow, int receiver) {
        b.emitAssign(Place.local(borrow), Rvalue.borrow(Place.local(receiver)), LOC);
        b.emitEval(Rvalue.call(TRANSLATE, Arrays.asList(Operand.move(Place.local(borrow)), i32(1), i32(2))), LOC);
    }

    @Nested
    @DisplayName("合法输入")
    class Accepted {

        @Test
        @DisplayName("构建器产出的函数全部通过")
        void testLoweredFunctionsAccepted() {
            for (FunDecl decl : Arrays.asList(p.chooseFunction(), p.signFunction(), p.countFunction(),
                    p.translateFunction())) {
                VerificationReport report = verify(p.lower(decl));

                assertThat(report.isAccepted()).as(report.toString()).isTrue();
            }
        }

        @Test
        @DisplayName("优化后的函数同样通过")
        void testOptimizedFunctionsAccepted() {
            for (FunDecl decl : Arrays.asList(p.chooseFunction(), p.signFunction(), p.countFunction(),
                    p.translateFunction())) {
                VerificationReport report = verify(p.optimize(p.lower(decl)));

                assertThat(report.isAccepted()).as(report.toString()).isTrue();
            }
        }

        @Test
        @DisplayName("释放手动句柄")
        void testReleaseManualHandle() {
            MirFunction fn = p.mirFunction("drop", p.types.unit(), p.vec2Own);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(FREE, Collections.singletonList(Operand.move(Place.local(1)))), LOC);
            b.emitReturn(LOC);

            assertThat(verify(fn).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("借用参数可以解引用或直接转交")
        void testBorrowArgumentForwarded() {
            MirFunction fn = p.mirFunction("forward", p.types.i32(), p.vec2Borrow);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(TRANSLATE, Arrays.asList(Operand.copy(Place.local(1)), i32(1), i32(2))), LOC);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.copy(Place.local(1).deref().field(0))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.isAccepted()).as(report.toString()).isTrue();
        }
    }

    @Nested
    @DisplayName("结构")
    class Structure {

        @Test
        @DisplayName("缺少终止指令")
        void testMissingTerminator() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            b.newBlock();
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.MISSING_TERMINATOR)).isTrue();
            assertThat(report.getViolations().get(0).getBlock()).isEqualTo(1);
        }

        @Test
        @DisplayName("跳转到不存在的块")
        void testInvalidTarget() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitGoto(5, LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.INVALID_TARGET)).isTrue();
            assertThat(report.getViolations().get(0).getMessage()).contains("B5");
        }

        @Test
        @DisplayName("入口块不能有前驱")
        void testEntryPredecessor() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            BasicBlock loop = b.newBlock();
            b.emitGoto(loop.getId(), LOC);
            b.switchToBlock(loop);
            b.emitGoto(0, LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.ENTRY_HAS_PREDECESSOR)).isTrue();
            assertThat(report.getViolations()).extracting(Violation::getBlock).containsExactly(1);
        }

        @Test
        @DisplayName("一次校验收集多条违规")
        void testCollectsAllViolations() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            BasicBlock other = b.newBlock();
            b.emitGoto(7, LOC);
            b.switchToBlock(other);
            b.emitGoto(0, LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.INVALID_TARGET, ViolationKind.ENTRY_HAS_PREDECESSOR);
            assertThat(report.toString()).startsWith("f#90: rejected");
        }
    }

    @Nested
    @DisplayName("局部变量与类型")
    class LocalsAndTypes {

        @Test
        @DisplayName("引用未声明的局部变量")
        void testUndeclaredLocal() {
            MirFunction fn = p.mirFunction("f", p.types.i32());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.copy(Place.local(7))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.UNDECLARED_LOCAL);
            assertThat(report.getViolations().get(0).getMessage()).isEqualTo("undeclared local _7");
        }

        @Test
        @DisplayName("赋值类型与目标不一致")
        void testAssignTypeMismatch() {
            MirFunction fn = p.mirFunction("f", p.types.i32());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.constant(ConstValue.TRUE, p.types.bool())), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.TYPE_MISMATCH)).isTrue();
            assertThat(report.getViolations().get(0).getMessage()).contains("expected i32");
        }

        @Test
        @DisplayName("分支条件必须是 bool")
        void testBranchConditionType() {
            MirFunction fn = p.mirFunction("f", p.types.unit(), p.types.i32());
            MirBuilder b = new MirBuilder(fn, 100);
            BasicBlock yes = b.newBlock();
            BasicBlock no = b.newBlock();
            b.emitBranch(Operand.copy(Place.local(1)), yes.getId(), no.getId(), LOC);
            b.switchToBlock(yes);
            b.emitReturn(LOC);
            b.switchToBlock(no);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.TYPE_MISMATCH)).isTrue();
            assertThat(report.getViolations().get(0).getInstruction()).isEqualTo(0);
        }

        @Test
        @DisplayName("调用未声明的函数")
        void testUnknownFunction() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(FnId.of(99), Collections.<Operand>emptyList()), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.TYPE_MISMATCH)).isTrue();
            assertThat(report.getViolations().get(0).getMessage()).contains("undeclared function");
        }

        @Test
        @DisplayName("实参个数不符")
        void testArgumentCount() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(PICK, Arrays.asList(i32(1), i32(2))), LOC);
            b.emitReturn(LOC);

            assertThat(verify(fn).getViolations().get(0).getMessage())
                    .isEqualTo("pick expects 1 argument(s), got 2");
        }

        @Test
        @DisplayName("局部变量制式与类型不符")
        void testLocalRegimeMismatch() {
            MirFunction fn = p.mirFunction("f", p.types.unit());
            fn.newLocal(p.vec2Gc, Regime.VALUE, LocalKind.TEMP, null, LOC);
            new MirBuilder(fn, 100).emitReturn(LOC);

            assertThat(verify(fn).has(ViolationKind.REGIME_MISMATCH)).isTrue();
        }
    }

    @Nested
    @DisplayName("借用")
    class Borrows {

        private MirFunction fn;
        private int borrow;

        @BeforeEach
        void setUp() {
            fn = p.mirFunction("f", p.types.unit(), p.vec2);
            borrow = fn.newLocal(p.vec2Borrow, Regime.BORROW, LocalKind.TEMP, null, LOC);
        }

        @Test
        @DisplayName("借用临时变量被读取两次")
        void testBorrowReadTwice() {
            MirBuilder b = new MirBuilder(fn, 100);
            emitTranslate(b, borrow, 1);
            b.emitEval(Rvalue.call(TRANSLATE, Arrays.asList(Operand.move(Place.local(borrow)), i32(3), i32(4))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.BORROW_ESCAPE);
            assertThat(report.getViolations().get(0).getInstruction()).isEqualTo(2);
        }

        @Test
        @DisplayName("借用未被紧随的调用消费")
        void testBorrowNotConsumed() {
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(borrow), Rvalue.borrow(Place.local(1)), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.BORROW_ESCAPE)).isTrue();
            assertThat(report.getViolations().get(0).getMessage()).contains("not consumed");
        }

        @Test
        @DisplayName("借用保存到命名局部变量")
        void testBorrowInUserLocal() {
            int named = fn.newLocal(p.vec2Borrow, Regime.BORROW, LocalKind.USER, "r", LOC);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(named), Rvalue.borrow(Place.local(1)), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.BORROW_ESCAPE)).isTrue();
            assertThat(report.getViolations()).extracting(Violation::getMessage)
                    .contains("named local _3 holds a borrow");
        }

        @Test
        @DisplayName("函数返回借用")
        void testReturnsBorrow() {
            MirFunction leaking = p.mirFunction("leak", p.vec2Borrow, p.vec2Borrow);
            MirBuilder b = new MirBuilder(leaking, 100);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.copy(Place.local(1))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(leaking);

            assertThat(report.getViolations()).extracting(Violation::getMessage)
                    .contains("function returns a borrow");
        }

        @Test
        @DisplayName("借用写入非借用位置")
        void testBorrowIntoValuePlace() {
            int plain = fn.newLocal(p.vec2, Regime.VALUE, LocalKind.TEMP, null, LOC);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(plain), Rvalue.borrow(Place.local(1)), LOC);
            emitTranslate(b, borrow, 1);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.BORROW_ESCAPE);
            assertThat(report.getViolations().get(0).getMessage()).startsWith("borrow stored into non-borrow place");
        }
    }

    @Nested
    @DisplayName("释放与移动")
    class ReleaseAndMoves {

        @Test
        @DisplayName("释放 GC 句柄")
        void testReleaseGcHandle() {
            MirFunction fn = p.mirFunction("drop", p.types.unit(), p.vec2Gc);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(FREE, Collections.singletonList(Operand.copy(Place.local(1)))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.has(ViolationKind.REGIME_MISMATCH)).isTrue();
        }

        @Test
        @DisplayName("释放借用")
        void testReleaseBorrow() {
            MirFunction fn = p.mirFunction("drop", p.types.unit(), p.vec2);
            int borrow = fn.newLocal(p.vec2Borrow, Regime.BORROW, LocalKind.TEMP, null, LOC);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitAssign(Place.local(borrow), Rvalue.borrow(Place.local(1)), LOC);
            b.emitEval(Rvalue.call(FREE, Collections.singletonList(Operand.move(Place.local(borrow)))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).anySatisfy(v -> {
                assertThat(v.getKind()).isEqualTo(ViolationKind.REGIME_MISMATCH);
                assertThat(v.getMessage()).contains("expected MANUAL_HANDLE");
            });
        }

        private MirFunction doubleFree() {
            MirFunction fn = p.mirFunction("twice", p.types.unit(), p.vec2Own);
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(FREE, Collections.singletonList(Operand.move(Place.local(1)))), LOC);
            b.emitEval(Rvalue.call(FREE, Collections.singletonList(Operand.move(Place.local(1)))), LOC);
            b.emitReturn(LOC);
            return fn;
        }

        @Test
        @DisplayName("严格模式下报告移动后使用")
        void testUseAfterMoveStrict() {
            TestPrograms strict = new TestPrograms(new MirOptions().setStrictMoves(true));
            p = strict;

            VerificationReport report = verify(doubleFree());

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.USE_AFTER_MOVE);
            assertThat(report.getViolations().get(0).getInstruction()).isEqualTo(1);
        }

        @Test
        @DisplayName("默认模式不跟踪移动")
        void testUseAfterMoveLenient() {
            assertThat(verify(doubleFree()).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("重新赋值后可再次使用")
        void testReassignmentRevives() {
            p = new TestPrograms(new MirOptions().setStrictMoves(true));
            MirFunction fn = p.mirFunction("revive", p.types.i32(), p.types.i32());
            MirBuilder b = new MirBuilder(fn, 100);
            b.emitEval(Rvalue.call(PICK, Collections.singletonList(Operand.move(Place.local(1)))), LOC);
            b.emitAssign(Place.local(1), Rvalue.use(i32(3)), LOC);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.copy(Place.local(1))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.isAccepted()).as(report.toString()).isTrue();
        }

        @Test
        @DisplayName("任一前驱路径上的移动都会被报告")
        void testMoveOnOnePath() {
            p = new TestPrograms(new MirOptions().setStrictMoves(true));
            MirFunction fn = p.mirFunction("maybe", p.types.i32(), p.types.i32(), p.types.bool());
            MirBuilder b = new MirBuilder(fn, 100);
            BasicBlock moves = b.newBlock();
            BasicBlock join = b.newBlock();
            b.emitBranch(Operand.copy(Place.local(2)), moves.getId(), join.getId(), LOC);
            b.switchToBlock(moves);
            b.emitEval(Rvalue.call(PICK, Collections.singletonList(Operand.move(Place.local(1)))), LOC);
            b.emitGoto(join.getId(), LOC);
            b.switchToBlock(join);
            b.emitAssign(Place.local(0), Rvalue.use(Operand.copy(Place.local(1))), LOC);
            b.emitReturn(LOC);

            VerificationReport report = verify(fn);

            assertThat(report.getViolations()).extracting(Violation::getKind)
                    .containsExactly(ViolationKind.USE_AFTER_MOVE);
            assertThat(report.getViolations().get(0).getBlock()).isEqualTo(2);
        }
    }
}
