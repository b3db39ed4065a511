package com.keellang.cli;

import com.keellang.ir.MirOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli verify 子命令：只编译和校验，报告诊断
 */
@Command(name = "verify", description = "编译并校验，不输出 MIR")
public class VerifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "类型检查器输出的 JSON 文件")
    String input;

    @Mixin
    CompileOptions options;

    @Override
    public Integer call() {
        LoggingSetup.configure(options.verbose);
        MirOptions mirOptions;
        try {
            mirOptions = options.toMirOptions();
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return MirRunner.EXIT_FAILED;
        }
        return new MirRunner(mirOptions, System.out, System.err).verify(input);
    }
}
