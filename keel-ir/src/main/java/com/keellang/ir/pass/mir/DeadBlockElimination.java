package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.Cfg;
import com.keellang.ir.pass.PassContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * 删除不可达基本块。
 * 从 entry block 开始做可达性分析，移除所有不可达的块。
 */
public class DeadBlockElimination extends FunctionRewritePass {

    @Override
    public String getName() {
        return "DeadBlockElimination";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        List<BasicBlock> blocks = func.getBlocks();
        if (blocks.size() <= 1) return false;

        // 从 entry block 开始 BFS 找可达块
        boolean[] reachable = new boolean[blocks.size()];
        Queue<Integer> worklist = new ArrayDeque<>();
        reachable[0] = true;
        worklist.add(0);

        while (!worklist.isEmpty()) {
            BasicBlock block = blocks.get(worklist.poll());
            if (block.getTerminator() == null) continue;
            for (int successor : block.getTerminator().getSuccessors()) {
                if (successor >= 0 && successor < reachable.length && !reachable[successor]) {
                    reachable[successor] = true;
                    worklist.add(successor);
                }
            }
        }

        List<BasicBlock> kept = new ArrayList<>(blocks.size());
        for (BasicBlock block : blocks) {
            if (reachable[block.getId()]) kept.add(block);
        }
        if (kept.size() == blocks.size()) return false;

        // 移除不可达块
        Cfg.renumber(func, kept);
        return true;
    }
}
