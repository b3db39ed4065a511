package com.keellang.cli;

import com.keellang.ir.MirOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：类型化程序 → 校验过的 MIR
 */
@Command(name = "compile", description = "编译类型化程序（JSON）为 MIR")
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "类型检查器输出的 JSON 文件")
    String input;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认 stdout）")
    String output;

    @Option(names = "--emit", defaultValue = "text", description = "输出格式（text, json）")
    String emit;

    @Mixin
    CompileOptions options;

    @Override
    public Integer call() {
        if (!"text".equalsIgnoreCase(emit) && !"json".equalsIgnoreCase(emit)) {
            System.err.println("错误: 未知输出格式 '" + emit + "'（可选: text, json）");
            return MirRunner.EXIT_FAILED;
        }
        LoggingSetup.configure(options.verbose);
        MirOptions mirOptions;
        try {
            mirOptions = options.toMirOptions();
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return MirRunner.EXIT_FAILED;
        }
        return new MirRunner(mirOptions, System.out, System.err).compile(input, output, emit);
    }
}
