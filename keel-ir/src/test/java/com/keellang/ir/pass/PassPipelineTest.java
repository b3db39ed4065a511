package com.keellang.ir.pass;

import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.expr.BinaryExpr;
import com.keellang.ir.MirOptions;
import com.keellang.ir.TestPrograms;
import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.pass.mir.CfgCleanup;
import com.keellang.ir.pass.mir.ConstantFolding;
import com.keellang.ir.pass.mir.CopyPropagation;
import com.keellang.ir.pass.mir.DeadTempElimination;
import com.keellang.ir.pass.mir.FunctionRewritePass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.keellang.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("PassPipeline 测试")
class PassPipelineTest {

    private TestPrograms p;

    @BeforeEach
    void setUp() {
        p = new TestPrograms();
    }

    private List<FunDecl> samples() {
        return Arrays.asList(p.chooseFunction(), p.signFunction(), p.countFunction(), p.translateFunction(),
                p.fun(70, "identity", p.types.i32(), params(param(0, "x", p.types.i32())),
                        let(1, "y", p.types.i32(), p.local(0, "x", p.types.i32())),
                        ret(p.local(1, "y", p.types.i32()))));
    }

    @Nested
    @DisplayName("默认管线")
    class DefaultPipeline {

        @Test
        @DisplayName("pass 顺序")
        void testPassOrder() {
            List<MirPass> passes = PassPipeline.createDefault().getMirPasses();

            assertThat(passes).extracting(MirPass::getName).containsExactly(
                    "CfgCleanup", "DeadTempElimination", "ConstantFolding", "CopyPropagation",
                    "CfgCleanup", "DeadTempElimination");
        }

        @Test
        @DisplayName("优化结果再次优化不变")
        void testIdempotent() {
            for (FunDecl decl : samples()) {
                MirFunction once = p.optimize(p.lower(decl));
                MirFunction twice = p.optimize(once);

                assertThat(twice.toString()).as(decl.getName()).isEqualTo(once.toString());
            }
        }

        @Test
        @DisplayName("if/else 优化后仍为四个块")
        void testIfElseShape() {
            MirFunction fn = p.optimize(p.lower(p.chooseFunction()));

            assertThat(fn.getBlocks()).hasSize(4);
            assertThat(fn.getBlock(3).getStatements()).extracting(Object::toString).containsExactly("_0 = copy _2");
        }

        @Test
        @DisplayName("常量条件折叠后只剩单个块")
        void testConstantProgramCollapses() {
            FunDecl decl = p.fun(71, "constant", p.types.i32(), params(),
                    let(0, "a", p.types.i32(), p.binary(p.i32(2), BinaryExpr.BinaryOp.ADD, p.i32(3), p.types.i32())),
                    ifStmt(p.compare(p.local(0, "a", p.types.i32()), BinaryExpr.BinaryOp.GT, p.i32(4)),
                            block(ret(p.i32(1))), null),
                    ret(p.i32(0)));

            MirFunction fn = p.optimize(p.lower(decl));

            assertThat(fn.getBlocks()).hasSize(1);
            assertThat(fn.getBlock(0).getStatements()).extracting(Object::toString).containsExactly("_0 = const 1");
            assertThat(fn.getBlock(0).getTerminator()).isInstanceOf(MirTerminator.Return.class);
            assertThat(fn.getLocals()).hasSize(1);
        }

        @Test
        @DisplayName("复制链被消去")
        void testCopyChainRemoved() {
            MirFunction fn = p.optimize(p.lower(samples().get(4)));

            assertThat(fn.getBlock(0).getStatements()).extracting(Object::toString).containsExactly("_0 = copy _1");
            assertThat(fn.getLocals()).hasSize(2);
        }

        @Test
        @DisplayName("借用与调用保持相邻")
        void testBorrowStaysAdjacent() {
            MirFunction fn = p.optimize(p.lower(p.translateFunction()));

            assertThat(fn.getBlock(0).getStatements()).extracting(Object::toString)
                    .containsExactly("_2 = &_1", "eval fn0(move _2, const 1, const 2)");
        }

        @Test
        @DisplayName("输入函数不被修改")
        void testInputUntouched() {
            MirFunction input = p.lower(p.signFunction());
            String before = input.toString();

            p.optimize(input);

            assertThat(input.toString()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("自定义管线")
    class CustomPipeline {

        @Test
        @DisplayName("空管线原样返回")
        void testEmptyPipeline() {
            MirFunction input = p.lower(p.chooseFunction());

            MirFunction result = new PassPipeline().optimize(input, p.passContext());

            assertThat(result.toString()).isEqualTo(input.toString());
        }

        @Test
        @DisplayName("始终产生变化的 pass 触发迭代上限")
        void testNonConvergingPass() {
            TestPrograms tight = new TestPrograms(new MirOptions().setMaxPassIterations(3));
            PassPipeline pipeline = new PassPipeline();
            pipeline.addMirPass(new FunctionRewritePass() {
                @Override
                public String getName() {
                    return "Duplicator";
                }

                @Override
                public boolean apply(MirFunction function, PassContext context) {
                    List<MirStatement> stmts = function.getBlock(0).getStatements();
                    stmts.add(stmts.get(0));
                    return true;
                }
            });
            MirFunction input = tight.lower(tight.chooseFunction());

            assertThatThrownBy(() -> pipeline.optimize(input, tight.passContext()))
                    .isInstanceOf(CompilationTooLargeException.class)
                    .hasMessageContaining("within 3 iterations");
        }

        @Test
        @DisplayName("单个 pass 可单独组合")
        void testSinglePasses() {
            PassPipeline pipeline = new PassPipeline();
            pipeline.addMirPass(new ConstantFolding());
            pipeline.addMirPass(new CopyPropagation());
            pipeline.addMirPass(new DeadTempElimination());
            pipeline.addMirPass(new CfgCleanup());

            MirFunction fn = pipeline.optimize(p.lower(p.signFunction()), p.passContext());

            assertThat(fn.getBlocks()).hasSize(3);
        }
    }
}
