package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.Cfg;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 合并单前驱/单后继基本块。
 * 如果块 A 的唯一后继是块 B，且 B 的唯一前驱是 A，则合并 A 和 B。
 */
public class BlockMerging extends FunctionRewritePass {

    @Override
    public String getName() {
        return "BlockMerging";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        List<BasicBlock> blocks = func.getBlocks();
        if (blocks.size() <= 1) return false;

        int[] predCount = Cfg.predecessorCounts(func);
        boolean[] removed = new boolean[blocks.size()];
        boolean changed = false;

        // 扫描合并，合并后回退索引以重新检查当前块（可能链式合并）
        for (int i = 0; i < blocks.size(); i++) {
            if (removed[i]) continue;
            BasicBlock block = blocks.get(i);
            MirTerminator term = block.getTerminator();
            if (!(term instanceof MirTerminator.Goto)) continue;

            int targetId = ((MirTerminator.Goto) term).getTargetBlockId();
            if (targetId == block.getId() || targetId == 0) continue;
            if (predCount[targetId] != 1 || removed[targetId]) continue;

            // 合并：A 吸收 B 的语句和 terminator
            BasicBlock target = blocks.get(targetId);
            block.getStatements().addAll(target.getStatements());
            block.setTerminator(target.getTerminator());
            removed[targetId] = true;
            changed = true;

            // 回退索引，重新检查当前块（A 的新 terminator 可能继续合并）
            i--;
        }
        if (!changed) return false;

        List<BasicBlock> kept = new ArrayList<>(blocks.size());
        for (BasicBlock block : blocks) {
            if (!removed[block.getId()]) kept.add(block);
        }
        Cfg.renumber(func, kept);
        return true;
    }
}
