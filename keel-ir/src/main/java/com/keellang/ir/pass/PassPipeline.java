package com.keellang.ir.pass;

import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirPrinter;
import com.keellang.ir.pass.mir.CfgCleanup;
import com.keellang.ir.pass.mir.ConstantFolding;
import com.keellang.ir.pass.mir.CopyPropagation;
import com.keellang.ir.pass.mir.DeadTempElimination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MIR 优化管线。
 * <p>
 * 按顺序执行全部 pass，整轮重复直到函数文本不再变化（不动点），
 * 轮数受 {@code maxPassIterations} 限制。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<MirPass> mirPasses = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addMirPass(new CfgCleanup());
        pipeline.addMirPass(new DeadTempElimination());
        pipeline.addMirPass(new ConstantFolding());
        pipeline.addMirPass(new CopyPropagation());
        // 折叠与传播之后产生的不可达块与无用复制
        pipeline.addMirPass(new CfgCleanup());
        pipeline.addMirPass(new DeadTempElimination());
        return pipeline;
    }

    public void addMirPass(MirPass pass) {
        mirPasses.add(pass);
    }

    public List<MirPass> getMirPasses() {
        return Collections.unmodifiableList(mirPasses);
    }

    /**
     * 优化单个函数，返回新函数；输入不被修改。
     *
     * @throws CompilationTooLargeException 超过迭代上限仍未收敛
     */
    public MirFunction optimize(MirFunction function, PassContext context) {
        int limit = context.getOptions().getMaxPassIterations();
        MirFunction current = function;
        String before = MirPrinter.print(current, null);
        for (int round = 0; ; round++) {
            if (round >= limit) {
                throw new CompilationTooLargeException(Stage.OPTIMIZE, function.getLabel(),
                        "optimization did not reach a fixed point within " + limit + " iterations",
                        function.getLocation());
            }
            for (MirPass pass : mirPasses) {
                current = pass.run(current, context);
                if (LOG.isLoggable(Level.FINEST)) {
                    LOG.finest(function.getLabel() + " after " + pass.getName() + ":\n"
                            + MirPrinter.print(current, context.getTypes()));
                }
            }
            String after = MirPrinter.print(current, null);
            if (after.equals(before)) {
                LOG.fine(function.getLabel() + ": optimization converged after " + (round + 1) + " round(s)");
                return current;
            }
            before = after;
        }
    }
}
