package com.keellang.ir;

import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.decl.TypedProgram;
import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.CompilerDefectException;
import com.keellang.ir.diag.Diagnostic;
import com.keellang.ir.diag.DiagnosticCollector;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.hir.decl.HirFunction;
import com.keellang.ir.lowering.AstToHirLowering;
import com.keellang.ir.lowering.HirToMirLowering;
import com.keellang.ir.lowering.LoweringContext;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirModule;
import com.keellang.ir.mir.MirPrinter;
import com.keellang.ir.pass.PassContext;
import com.keellang.ir.pass.PassPipeline;
import com.keellang.ir.verify.MirVerifier;
import com.keellang.ir.verify.VerificationReport;
import com.keellang.ir.verify.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MIR 编译入口。
 * <p>
 * 串联完整流程：AST → HIR（脱糖）→ MIR（CFG 构建）→ MIR 优化 → 校验。
 * 函数之间互不依赖，按 {@link MirOptions#getParallelism()} 分发到工作线程；
 * 线程间只共享只读的类型/符号快照。
 * 单个函数的缺陷或超限不影响其他函数，全部转为诊断记录。
 */
public class KeelMirCompiler {

    private static final Logger LOG = Logger.getLogger(KeelMirCompiler.class.getName());

    private final MirOptions options;

    public KeelMirCompiler() {
        this(new MirOptions());
    }

    public KeelMirCompiler(MirOptions options) {
        this.options = options;
    }

    public MirOptions getOptions() {
        return options;
    }

    /**
     * 编译整个程序。输出模块中的函数保持输入顺序，未通过的函数被剔除。
     */
    public CompilationResult compile(TypedProgram program) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        List<FunDecl> decls = program.getFunctions();
        List<MirFunction> compiled = new ArrayList<>(decls.size());

        if (options.getParallelism() <= 1 || decls.size() <= 1) {
            for (FunDecl decl : decls) {
                compiled.add(compileFunction(decl, program.getTypes(), program.getSymbols(), diagnostics));
            }
        } else {
            ExecutorService workers = Executors.newFixedThreadPool(options.getParallelism(), r -> {
                Thread t = new Thread(r, "keel-mir-worker");
                t.setDaemon(true);
                return t;
            });
            try {
                List<Future<MirFunction>> futures = new ArrayList<>(decls.size());
                for (FunDecl decl : decls) {
                    futures.add(workers.submit(
                            () -> compileFunction(decl, program.getTypes(), program.getSymbols(), diagnostics)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    compiled.add(await(futures.get(i), decls.get(i), diagnostics));
                }
            } finally {
                workers.shutdownNow();
            }
        }

        List<MirFunction> accepted = new ArrayList<>(compiled.size());
        for (MirFunction fn : compiled) {
            if (fn != null) accepted.add(fn);
        }
        List<Diagnostic> sorted = diagnostics.getDiagnostics();
        LOG.fine(program.getSourceName() + ": " + accepted.size() + "/" + decls.size()
                + " function(s) compiled, " + sorted.size() + " diagnostic(s)");
        return new CompilationResult(
                new MirModule(program.getSourceName(), program.getTypes(), program.getSymbols(), accepted), sorted);
    }

    private MirFunction await(Future<MirFunction> future, FunDecl decl, DiagnosticCollector diagnostics) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            diagnostics.report(new Diagnostic(Diagnostic.Kind.DEFECT, Stage.DESUGAR, label(decl),
                    Diagnostic.NO_INDEX, Diagnostic.NO_INDEX, "compilation interrupted", decl.getLocation()));
            return null;
        } catch (ExecutionException e) {
            LOG.log(Level.WARNING, "worker failed on " + label(decl), e.getCause());
            diagnostics.report(new Diagnostic(Diagnostic.Kind.DEFECT, Stage.DESUGAR, label(decl),
                    Diagnostic.NO_INDEX, Diagnostic.NO_INDEX, "worker failed: " + e.getCause(), decl.getLocation()));
            return null;
        }
    }

    /**
     * 编译单个函数。失败时把诊断写入 collector 并返回 null。
     */
    public MirFunction compileFunction(FunDecl decl, TypeTable types, SymbolTable symbols,
                                       DiagnosticCollector diagnostics) {
        String label = label(decl);
        Stage stage = Stage.DESUGAR;
        try {
            LoweringContext ctx = new LoweringContext(types, symbols, options, label);
            HirFunction hir = new AstToHirLowering().lower(decl, ctx);
            LOG.fine(label + ": desugared");

            stage = Stage.CFG_BUILD;
            MirFunction mir = new HirToMirLowering(types, symbols, options).lower(hir);
            LOG.fine(label + ": built " + mir.getBlocks().size() + " block(s), " + mir.getLocals().size() + " local(s)");

            if (options.isOptimize()) {
                stage = Stage.OPTIMIZE;
                mir = PassPipeline.createDefault().optimize(mir, new PassContext(types, symbols, options));
                LOG.fine(label + ": optimized to " + mir.getBlocks().size() + " block(s)");
            }
            if (options.isDumpMir()) {
                LOG.fine(MirPrinter.print(mir, types));
            }

            stage = Stage.VERIFY;
            VerificationReport report = new MirVerifier(types, symbols, options).verify(mir);
            if (!report.isAccepted()) {
                for (Violation v : report.getViolations()) {
                    diagnostics.report(new Diagnostic(Diagnostic.Kind.DEFECT, Stage.VERIFY, label,
                            v.getBlock(), v.getInstruction(), v.getKind() + ": " + v.getMessage(),
                            mir.getLocation()));
                }
                LOG.warning(report.toString());
                return null;
            }
            return mir;
        } catch (CompilerDefectException e) {
            LOG.log(Level.WARNING, "compiler defect in " + label, e);
            diagnostics.report(e.toDiagnostic());
        } catch (CompilationTooLargeException e) {
            LOG.warning(label + ": " + e.getMessage());
            diagnostics.report(e.toDiagnostic());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "unexpected failure in " + label, e);
            diagnostics.report(new Diagnostic(Diagnostic.Kind.DEFECT, stage, label,
                    Diagnostic.NO_INDEX, Diagnostic.NO_INDEX, "internal error: " + e, decl.getLocation()));
        }
        return null;
    }

    private static String label(FunDecl decl) {
        return decl.getName() + "#" + (decl.getId() != null ? decl.getId().getIndex() : -1);
    }
}
