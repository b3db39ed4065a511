package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirLocal;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.Rvalue;
import com.keellang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

/**
 * 删除从未被读取的局部变量及只写入它们的语句。
 * <p>
 * 返回槽与参数始终保留。调用即使结果无人读取也保留（改为 eval），
 * 无副作用的赋值直接删除。最后把存活的局部变量重新密集编号。
 */
public class DeadTempElimination extends FunctionRewritePass {

    @Override
    public String getName() {
        return "DeadTempElimination";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        boolean changed = false;
        boolean removed;
        do {
            removed = false;
            int[] reads = countReads(func);
            for (BasicBlock block : func.getBlocks()) {
                ListIterator<MirStatement> it = block.getStatements().listIterator();
                while (it.hasNext()) {
                    MirStatement stmt = it.next();
                    if (!(stmt instanceof MirStatement.Assign)) continue;
                    MirStatement.Assign assign = (MirStatement.Assign) stmt;
                    int dest = assign.getDestination().getLocal();
                    if (!isRemovable(func, dest) || reads[dest] > 0 || assign.getDestination().hasDeref()) {
                        continue;
                    }
                    if (assign.getValue() instanceof Rvalue.Call) {
                        it.set(new MirStatement.Eval(assign.getLocation(), (Rvalue.Call) assign.getValue()));
                    } else {
                        it.remove();
                    }
                    removed = true;
                }
            }
            changed |= removed;
        } while (removed);

        return compactLocals(func) || changed;
    }

    private static boolean isRemovable(MirFunction func, int local) {
        return local > func.getArgCount() && local < func.getLocals().size();
    }

    static int[] countReads(MirFunction func) {
        int n = func.getLocals().size();
        int[] reads = new int[n];
        for (BasicBlock block : func.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                stmt.forEachReadLocal(l -> {
                    if (l >= 0 && l < n) reads[l]++;
                });
            }
            if (block.getTerminator() != null) {
                block.getTerminator().forEachReadLocal(l -> {
                    if (l >= 0 && l < n) reads[l]++;
                });
            }
        }
        return reads;
    }

    /**
     * 删除不再被任何语句引用（读或写）的局部变量并重新编号。
     */
    private static boolean compactLocals(MirFunction func) {
        int n = func.getLocals().size();
        boolean[] used = new boolean[n];
        for (int i = 0; i <= func.getArgCount() && i < n; i++) used[i] = true;
        for (BasicBlock block : func.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                stmt.forEachReadLocal(l -> {
                    if (l >= 0 && l < n) used[l] = true;
                });
                if (stmt instanceof MirStatement.Assign) {
                    int dest = ((MirStatement.Assign) stmt).getDestination().getLocal();
                    if (dest >= 0 && dest < n) used[dest] = true;
                }
            }
            if (block.getTerminator() != null) {
                block.getTerminator().forEachReadLocal(l -> {
                    if (l >= 0 && l < n) used[l] = true;
                });
            }
        }

        int[] mapping = new int[n];
        List<MirLocal> kept = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (used[i]) {
                mapping[i] = kept.size();
                kept.add(func.getLocal(i).withIndex(kept.size()));
            } else {
                mapping[i] = -1;
            }
        }
        if (kept.size() == n) return false;

        func.replaceLocals(kept);
        for (BasicBlock block : func.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                stmts.set(i, stmts.get(i).remapLocals(l -> mapping[l]));
            }
            if (block.getTerminator() != null) {
                block.setTerminator(block.getTerminator().remapLocals(l -> mapping[l]));
            }
        }
        return true;
    }
}
