package com.keellang.ir.pass.mir;

import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.pass.PassContext;

/**
 * CFG 清理：删除不可达块、跳过空跳转块、合并直线块，重复直到不动点。
 */
public class CfgCleanup extends FunctionRewritePass {

    private final DeadBlockElimination deadBlocks = new DeadBlockElimination();
    private final JumpThreading threading = new JumpThreading();
    private final BlockMerging merging = new BlockMerging();

    @Override
    public String getName() {
        return "CfgCleanup";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        int limit = context.getOptions().getMaxPassIterations();
        boolean changed = false;
        for (int round = 0; ; round++) {
            if (round >= limit) {
                throw new CompilationTooLargeException(Stage.OPTIMIZE, func.getLabel(),
                        getName() + " did not converge within " + limit + " iterations", func.getLocation());
            }
            boolean roundChanged = deadBlocks.apply(func, context);
            roundChanged |= threading.apply(func, context);
            roundChanged |= merging.apply(func, context);
            if (!roundChanged) break;
            changed = true;
        }
        return changed;
    }
}
