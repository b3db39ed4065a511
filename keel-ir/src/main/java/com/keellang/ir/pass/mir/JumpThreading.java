package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.pass.PassContext;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 跳过只含无条件跳转的空块：前驱直接跳到其最终目标。
 * 两个出口相同的条件分支改为无条件跳转。被跳过的块由 {@link DeadBlockElimination} 删除。
 */
public class JumpThreading extends FunctionRewritePass {

    @Override
    public String getName() {
        return "JumpThreading";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        List<BasicBlock> blocks = func.getBlocks();
        boolean changed = false;
        for (BasicBlock block : blocks) {
            MirTerminator term = block.getTerminator();
            if (term == null) continue;
            if (term instanceof MirTerminator.Branch) {
                MirTerminator.Branch br = (MirTerminator.Branch) term;
                if (br.getThenBlock() == br.getElseBlock()) {
                    term = new MirTerminator.Goto(br.getLocation(), br.getThenBlock());
                    changed = true;
                }
            }
            MirTerminator threaded = term.remapTargets(target -> resolve(blocks, target));
            if (threaded != term) changed = true;
            block.setTerminator(threaded);
        }
        return changed;
    }

    private static int resolve(List<BasicBlock> blocks, int target) {
        Set<Integer> visited = new HashSet<>();
        int current = target;
        while (current > 0 && current < blocks.size() && isJumpOnly(blocks.get(current))
                && visited.add(current)) {
            current = ((MirTerminator.Goto) blocks.get(current).getTerminator()).getTargetBlockId();
        }
        return current;
    }

    private static boolean isJumpOnly(BasicBlock block) {
        return block.getStatements().isEmpty()
                && block.getTerminator() instanceof MirTerminator.Goto
                && ((MirTerminator.Goto) block.getTerminator()).getTargetBlockId() != block.getId();
    }
}
