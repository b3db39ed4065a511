package com.keellang.cli;

import com.google.gson.JsonParseException;
import com.keellang.cli.json.MirJsonWriter;
import com.keellang.cli.json.TypedProgramReader;
import com.keellang.compiler.ast.decl.TypedProgram;
import com.keellang.ir.CompilationResult;
import com.keellang.ir.KeelMirCompiler;
import com.keellang.ir.MirOptions;
import com.keellang.ir.diag.Diagnostic;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirPrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * compile / verify 子命令的执行器。
 * 返回进程退出码：0 成功，1 有诊断或输入无法读取。
 */
public class MirRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    private final MirOptions options;
    private final PrintStream out;
    private final PrintStream err;

    public MirRunner(MirOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译并输出 MIR（text 或 json），outputPath 为 null 时写到 stdout。
     */
    public int compile(String inputPath, String outputPath, String emit) {
        CompilationResult result = run(inputPath);
        if (result == null) return EXIT_FAILED;

        String rendered = "json".equalsIgnoreCase(emit)
                ? new MirJsonWriter().write(result)
                : renderText(result);
        if (outputPath == null) {
            out.print(rendered);
        } else {
            try {
                Files.write(Paths.get(outputPath), rendered.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                err.println("错误: 无法写入 " + outputPath + " - " + e.getMessage());
                return EXIT_FAILED;
            }
        }
        return finish(result);
    }

    /**
     * 只编译和校验，不输出 MIR。
     */
    public int verify(String inputPath) {
        CompilationResult result = run(inputPath);
        if (result == null) return EXIT_FAILED;
        if (result.isSuccess()) {
            out.println(result.getModule().getFunctions().size() + " function(s) verified");
        }
        return finish(result);
    }

    private CompilationResult run(String inputPath) {
        Path path = Paths.get(inputPath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + inputPath);
            return null;
        }
        TypedProgram program;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            program = new TypedProgramReader().read(reader);
        } catch (IOException e) {
            err.println("错误: 无法读取 " + inputPath + " - " + e.getMessage());
            return null;
        } catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
            err.println("错误: 输入格式无效 - " + e.getMessage());
            return null;
        }
        return new KeelMirCompiler(options).compile(program);
    }

    private String renderText(CompilationResult result) {
        StringBuilder sb = new StringBuilder();
        for (MirFunction fn : result.getModule().getFunctions()) {
            sb.append(MirPrinter.print(fn, result.getModule().getTypes())).append('\n');
        }
        return sb.toString();
    }

    private int finish(CompilationResult result) {
        for (Diagnostic d : result.getDiagnostics()) {
            err.println(d);
        }
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }
}
