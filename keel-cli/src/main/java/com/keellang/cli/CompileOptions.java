package com.keellang.cli;

import com.keellang.ir.MirOptions;
import picocli.CommandLine.Option;

/**
 * compile 与 verify 共用的核心配置选项（picocli mixin）。
 */
public class CompileOptions {

    @Option(names = {"-j", "--jobs"}, defaultValue = "1", description = "并行编译的工作线程数")
    int jobs;

    @Option(names = "--max-blocks", defaultValue = "10000", description = "单个函数的基本块上限")
    int maxBlocks;

    @Option(names = "--max-pass-iterations", defaultValue = "64", description = "优化 pass 迭代上限")
    int maxPassIterations;

    @Option(names = "--max-nesting", defaultValue = "256", description = "表达式/语句嵌套深度上限")
    int maxNesting;

    @Option(names = "--strict-moves", description = "校验移动后使用")
    boolean strictMoves;

    @Option(names = "--no-opt", description = "跳过优化管线")
    boolean noOptimize;

    @Option(names = "--dump-mir", description = "以 FINE 级别记录每个函数的最终 MIR")
    boolean dumpMir;

    @Option(names = {"-v", "--verbose"}, description = "输出各阶段日志")
    boolean verbose;

    MirOptions toMirOptions() {
        return new MirOptions()
                .setParallelism(jobs)
                .setMaxBlocks(maxBlocks)
                .setMaxPassIterations(maxPassIterations)
                .setMaxNestingDepth(maxNesting)
                .setStrictMoves(strictMoves)
                .setOptimize(!noOptimize)
                .setDumpMir(dumpMir);
    }
}
