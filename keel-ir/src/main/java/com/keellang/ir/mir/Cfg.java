package com.keellang.ir.mir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CFG 辅助：前驱统计与块重编号。
 */
public final class Cfg {

    private Cfg() {
    }

    /** 每个块的入边数（同一终止指令的重复目标分别计数） */
    public static int[] predecessorCounts(MirFunction fn) {
        int[] counts = new int[fn.getBlocks().size()];
        for (BasicBlock block : fn.getBlocks()) {
            if (block.getTerminator() == null) continue;
            for (int succ : block.getTerminator().getSuccessors()) {
                if (succ >= 0 && succ < counts.length) counts[succ]++;
            }
        }
        return counts;
    }

    /** 每个块的前驱块 ID 列表（去重） */
    public static List<List<Integer>> predecessors(MirFunction fn) {
        int n = fn.getBlocks().size();
        List<List<Integer>> preds = new ArrayList<>(n);
        for (int i = 0; i < n; i++) preds.add(new ArrayList<>());
        for (BasicBlock block : fn.getBlocks()) {
            if (block.getTerminator() == null) continue;
            for (int succ : block.getTerminator().getSuccessors()) {
                if (succ >= 0 && succ < n && !preds.get(succ).contains(block.getId())) {
                    preds.get(succ).add(block.getId());
                }
            }
        }
        return preds;
    }

    /**
     * 以保留下来的块重建块表，块 ID 重新按位置密集编号，并改写所有跳转目标。
     * 被删除的块不得再被任何保留块引用。
     */
    public static void renumber(MirFunction fn, List<BasicBlock> kept) {
        int[] mapping = new int[fn.getBlocks().size()];
        Arrays.fill(mapping, -1);
        for (int i = 0; i < kept.size(); i++) {
            mapping[kept.get(i).getId()] = i;
        }
        List<BasicBlock> renumbered = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            BasicBlock block = kept.get(i).copy(i);
            if (block.getTerminator() != null) {
                block.setTerminator(block.getTerminator().remapTargets(old -> {
                    int mapped = old >= 0 && old < mapping.length ? mapping[old] : -1;
                    if (mapped < 0) {
                        throw new IllegalStateException("B" + old + " removed while still referenced");
                    }
                    return mapped;
                }));
            }
            renumbered.add(block);
        }
        fn.replaceBlocks(renumbered);
    }
}
