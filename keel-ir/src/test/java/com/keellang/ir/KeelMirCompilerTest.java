package com.keellang.ir;

import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.expr.BinaryExpr;
import com.keellang.compiler.ast.expr.LocalRef;
import com.keellang.compiler.types.FnId;
import com.keellang.ir.diag.Diagnostic;
import com.keellang.ir.diag.DiagnosticCollector;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.mir.MirFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.keellang.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("KeelMirCompiler 测试")
class KeelMirCompilerTest {

    private TestPrograms p;

    @BeforeEach
    void setUp() {
        p = new TestPrograms();
    }

    private FunDecl stray() {
        return p.fun(23, "stray", p.types.unit(), params(), breakStmt(null));
    }

    /** fn add{k}(x: i32) -&gt; i32 { return x + k; } */
    private List<FunDecl> adders(TestPrograms programs, int count) {
        List<FunDecl> decls = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            LocalRef x = programs.local(0, "x", programs.types.i32());
            decls.add(programs.fun(200 + k, "add" + k, programs.types.i32(),
                    params(param(0, "x", programs.types.i32())),
                    ret(programs.binary(x, BinaryExpr.BinaryOp.ADD, programs.i32(k), programs.types.i32()))));
        }
        return decls;
    }

    @Nested
    @DisplayName("整体编译")
    class WholeProgram {

        @Test
        @DisplayName("全部函数通过时无诊断")
        void testCompileSuccess() {
            CompilationResult result = new KeelMirCompiler(p.options()).compile(
                    p.program(p.chooseFunction(), p.signFunction(), p.countFunction(), p.translateFunction()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getModule().getFunctions()).extracting(MirFunction::getName)
                    .containsExactly("choose", "sign", "count", "nudge");
            assertThat(result.getModule().getSourceName()).isEqualTo("test.keel");
            assertThat(result.getModule().getFunction("count").getId()).isEqualTo(FnId.of(11));
        }

        @Test
        @DisplayName("单个函数的缺陷不影响其他函数")
        void testDefectIsolated() {
            CompilationResult result = new KeelMirCompiler(p.options()).compile(
                    p.program(p.chooseFunction(), stray(), p.countFunction()));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getModule().getFunctions()).extracting(MirFunction::getName)
                    .containsExactly("choose", "count");
            assertThat(result.getDiagnostics()).hasSize(1);
            Diagnostic d = result.getDiagnostics().get(0);
            assertThat(d.getKind()).isEqualTo(Diagnostic.Kind.DEFECT);
            assertThat(d.getStage()).isEqualTo(Stage.CFG_BUILD);
            assertThat(d.getFunction()).isEqualTo("stray#23");
            assertThat(d.toString()).startsWith("compiler defect [cfg-build] stray#23");
        }

        @Test
        @DisplayName("规模超限作为诊断报告")
        void testTooLargeReported() {
            TestPrograms small = new TestPrograms(new MirOptions().setMaxBlocks(3));

            CompilationResult result = new KeelMirCompiler(small.options()).compile(
                    small.program(small.countFunction(), small.translateFunction()));

            assertThat(result.getModule().getFunctions()).extracting(MirFunction::getName).containsExactly("nudge");
            assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                    .containsExactly(Diagnostic.Kind.TOO_LARGE);
            assertThat(result.getDiagnostics().get(0).getStage()).isEqualTo(Stage.CFG_BUILD);
            assertThat(result.getDiagnostics().get(0).getMessage()).isEqualTo("function exceeds 3 basic blocks");
        }

        @Test
        @DisplayName("诊断按函数排序，与输入顺序无关")
        void testDiagnosticsSorted() {
            FunDecl late = p.fun(24, "another", p.types.unit(), params(), breakStmt(null));

            CompilationResult result = new KeelMirCompiler(p.options()).compile(p.program(stray(), late));

            assertThat(result.getDiagnostics()).extracting(Diagnostic::getFunction)
                    .containsExactly("another#24", "stray#23");
        }

        @Test
        @DisplayName("关闭优化时输出 CFG 构建结果")
        void testOptimizeDisabled() {
            TestPrograms plain = new TestPrograms(new MirOptions().setOptimize(false));
            FunDecl decl = plain.chooseFunction();

            CompilationResult result = new KeelMirCompiler(plain.options()).compile(plain.program(decl));

            assertThat(result.getModule().getFunctions().get(0).toString())
                    .isEqualTo(plain.lower(plain.chooseFunction()).toString());
        }
    }

    @Nested
    @DisplayName("并行编译")
    class Parallel {

        @Test
        @DisplayName("多线程编译保持输入顺序与结果")
        void testParallelMatchesSequential() {
            TestPrograms parallel = new TestPrograms(new MirOptions().setParallelism(4));
            List<FunDecl> decls = adders(parallel, 24);
            decls.add(5, stray());

            CompilationResult concurrent = new KeelMirCompiler(parallel.options())
                    .compile(parallel.program(decls.toArray(new FunDecl[0])));
            CompilationResult sequential = new KeelMirCompiler(p.options())
                    .compile(p.program(decls.toArray(new FunDecl[0])));

            assertThat(concurrent.getModule().getFunctions()).hasSize(24);
            assertThat(concurrent.getModule().getFunctions()).extracting(MirFunction::toString)
                    .containsExactlyElementsOf(sequential.getModule().getFunctions().stream()
                            .map(MirFunction::toString)
                            .collect(Collectors.toList()));
            assertThat(concurrent.getDiagnostics()).extracting(Diagnostic::toString)
                    .containsExactlyElementsOf(sequential.getDiagnostics().stream()
                            .map(Diagnostic::toString)
                            .collect(Collectors.toList()));
        }
    }

    @Nested
    @DisplayName("单函数编译")
    class SingleFunction {

        @Test
        @DisplayName("成功时返回通过校验的函数")
        void testCompileFunction() {
            DiagnosticCollector diagnostics = new DiagnosticCollector();

            MirFunction fn = p.compile(p.translateFunction(), diagnostics);

            assertThat(fn).isNotNull();
            assertThat(diagnostics.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("脱糖阶段的缺陷带有 desugar 阶段")
        void testDesugarDefect() {
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            FunDecl decl = p.fun(30, "unknown", p.types.i32(), params(),
                    ret(p.call(FnId.of(99), p.types.i32())));

            MirFunction fn = p.compile(decl, diagnostics);

            assertThat(fn).isNull();
            assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::getStage)
                    .containsExactly(Stage.DESUGAR);
        }

        @Test
        @DisplayName("嵌套过深在脱糖阶段报告规模超限")
        void testNestingTooLarge() {
            TestPrograms shallow = new TestPrograms(new MirOptions().setMaxNestingDepth(3));
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            LocalRef x = shallow.local(0, "x", shallow.types.i32());
            FunDecl decl = shallow.fun(31, "deep", shallow.types.i32(), params(param(0, "x", shallow.types.i32())),
                    ret(shallow.binary(shallow.binary(shallow.binary(shallow.binary(x,
                            BinaryExpr.BinaryOp.ADD, x, shallow.types.i32()),
                            BinaryExpr.BinaryOp.ADD, x, shallow.types.i32()),
                            BinaryExpr.BinaryOp.ADD, x, shallow.types.i32()),
                            BinaryExpr.BinaryOp.ADD, x, shallow.types.i32())));

            assertThat(shallow.compile(decl, diagnostics)).isNull();
            Diagnostic d = diagnostics.getDiagnostics().get(0);
            assertThat(d.getKind()).isEqualTo(Diagnostic.Kind.TOO_LARGE);
            assertThat(d.getStage()).isEqualTo(Stage.DESUGAR);
        }
    }
}
