package com.keellang.ir.pass.mir;

import com.keellang.compiler.types.Regime;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirLocal;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.Rvalue;
import com.keellang.ir.pass.PassContext;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 块内复制传播：{@code _d = copy _s} 之后、任一方被改写/移动/借用之前，
 * 对 {@code _d} 的复制读取改为直接读取 {@code _s}。
 * <p>
 * 只改写 copy 操作数，move 操作数保持不变。
 */
public class CopyPropagation extends FunctionRewritePass {

    @Override
    public String getName() {
        return "CopyPropagation";
    }

    @Override
    public boolean apply(MirFunction func, PassContext context) {
        boolean changed = false;
        for (BasicBlock block : func.getBlocks()) {
            changed |= propagateInBlock(func, block);
        }
        return changed;
    }

    private boolean propagateInBlock(MirFunction func, BasicBlock block) {
        Map<Integer, Integer> copies = new HashMap<>();
        UnaryOperator<Operand> mapper = op -> {
            if (!(op instanceof Operand.Copy) || copies.isEmpty()) return op;
            Place place = op.getPlace();
            Place mapped = place.remapLocals(l -> copies.getOrDefault(l, l));
            return mapped == place ? op : Operand.copy(mapped);
        };

        boolean changed = false;
        List<MirStatement> stmts = block.getStatements();
        for (int i = 0; i < stmts.size(); i++) {
            MirStatement stmt = stmts.get(i);
            MirStatement rewritten = mapStatementOperands(stmt, mapper);
            if (rewritten != stmt) {
                stmts.set(i, rewritten);
                changed = true;
            }
            invalidate(copies, rewritten);
            if (rewritten instanceof MirStatement.Assign) {
                record(func, copies, (MirStatement.Assign) rewritten);
            }
        }

        MirTerminator term = block.getTerminator();
        if (term != null) {
            MirTerminator mapped = term.mapOperands(mapper);
            if (mapped != term) {
                block.setTerminator(mapped);
                changed = true;
            }
        }
        return changed;
    }

    /** 语句移动、借用或直接改写的局部变量使相关复制关系失效 */
    private static void invalidate(Map<Integer, Integer> copies, MirStatement stmt) {
        for (Operand op : stmt.getOperands()) {
            if (op instanceof Operand.Move) kill(copies, op.getPlace().getLocal());
        }
        if (stmt instanceof MirStatement.Assign) {
            MirStatement.Assign assign = (MirStatement.Assign) stmt;
            if (assign.getValue() instanceof Rvalue.Borrow) {
                kill(copies, ((Rvalue.Borrow) assign.getValue()).getPlace().getLocal());
            }
            if (!assign.getDestination().hasDeref()) {
                kill(copies, assign.getDestination().getLocal());
            }
        }
    }

    private static void kill(Map<Integer, Integer> copies, int local) {
        copies.remove(local);
        Iterator<Map.Entry<Integer, Integer>> it = copies.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() == local) it.remove();
        }
    }

    private static void record(MirFunction func, Map<Integer, Integer> copies, MirStatement.Assign assign) {
        Place dest = assign.getDestination();
        if (!dest.isLocal() || !(assign.getValue() instanceof Rvalue.Use)) return;
        Operand op = ((Rvalue.Use) assign.getValue()).getOperand();
        if (!(op instanceof Operand.Copy) || !op.getPlace().isLocal()) return;
        int d = dest.getLocal();
        int s = op.getPlace().getLocal();
        if (d == s) return;
        MirLocal dl = func.getLocal(d);
        MirLocal sl = func.getLocal(s);
        if (dl.getKind() == LocalKind.RETURN) return;
        if (dl.getRegime() == Regime.BORROW || sl.getRegime() == Regime.BORROW) return;
        if (!dl.getType().equals(sl.getType())) return;
        copies.put(d, s);
    }
}
