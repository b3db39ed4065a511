package com.keellang.ir;

/**
 * MIR 管线配置
 */
public class MirOptions {
    private int maxBlocks = 10_000;
    private int maxPassIterations = 64;
    private int maxNestingDepth = 256;
    private boolean strictMoves = false;
    private boolean optimize = true;
    private int parallelism = 1;
    private boolean dumpMir = false;

    public MirOptions() {
    }

    /** 单个函数允许的最大基本块数 */
    public int getMaxBlocks() {
        return maxBlocks;
    }

    public MirOptions setMaxBlocks(int maxBlocks) {
        if (maxBlocks < 1) throw new IllegalArgumentException("maxBlocks must be positive: " + maxBlocks);
        this.maxBlocks = maxBlocks;
        return this;
    }

    /** 不动点迭代的最大轮数 */
    public int getMaxPassIterations() {
        return maxPassIterations;
    }

    public MirOptions setMaxPassIterations(int maxPassIterations) {
        if (maxPassIterations < 1) {
            throw new IllegalArgumentException("maxPassIterations must be positive: " + maxPassIterations);
        }
        this.maxPassIterations = maxPassIterations;
        return this;
    }

    /** 脱糖时允许的最大语法嵌套深度 */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public MirOptions setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    /** 是否在校验阶段检查 move 之后的再次读取 */
    public boolean isStrictMoves() {
        return strictMoves;
    }

    public MirOptions setStrictMoves(boolean strictMoves) {
        this.strictMoves = strictMoves;
        return this;
    }

    public boolean isOptimize() {
        return optimize;
    }

    public MirOptions setOptimize(boolean optimize) {
        this.optimize = optimize;
        return this;
    }

    /** 并行处理函数的工作线程数 */
    public int getParallelism() {
        return parallelism;
    }

    public MirOptions setParallelism(int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        this.parallelism = parallelism;
        return this;
    }

    /** 是否以 FINE 级别记录每个函数的 MIR */
    public boolean isDumpMir() {
        return dumpMir;
    }

    public MirOptions setDumpMir(boolean dumpMir) {
        this.dumpMir = dumpMir;
        return this;
    }
}
