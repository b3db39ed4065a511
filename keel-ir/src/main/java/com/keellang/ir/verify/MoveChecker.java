package com.keellang.ir.verify;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.Rvalue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * 移动后使用检查。
 * <p>
 * 前向数据流：每个块入口的"可能已移动"集合是所有前驱出口集合的并集。
 * {@code move _x} 把 {@code _x} 加入集合，对 {@code _x} 的整体赋值把它移出。
 * 只跟踪整体移动的局部变量。
 */
class MoveChecker {

    private final MirFunction fn;

    MoveChecker(MirFunction fn) {
        this.fn = fn;
    }

    List<Violation> check() {
        List<BasicBlock> blocks = fn.getBlocks();
        BitSet[] in = new BitSet[blocks.size()];
        in[0] = new BitSet();
        Deque<Integer> worklist = new ArrayDeque<>();
        worklist.add(0);
        while (!worklist.isEmpty()) {
            int b = worklist.poll();
            BitSet out = (BitSet) in[b].clone();
            BasicBlock block = blocks.get(b);
            for (MirStatement stmt : block.getStatements()) {
                transfer(stmt, out, null, b, 0);
            }
            for (int succ : block.getTerminator().getSuccessors()) {
                if (in[succ] == null) {
                    in[succ] = (BitSet) out.clone();
                    worklist.add(succ);
                } else {
                    BitSet merged = (BitSet) in[succ].clone();
                    merged.or(out);
                    if (!merged.equals(in[succ])) {
                        in[succ] = merged;
                        if (!worklist.contains(succ)) worklist.add(succ);
                    }
                }
            }
        }

        List<Violation> violations = new ArrayList<>();
        for (int b = 0; b < blocks.size(); b++) {
            if (in[b] == null) continue;    // 不可达
            BitSet state = (BitSet) in[b].clone();
            List<MirStatement> stmts = blocks.get(b).getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                transfer(stmts.get(i), state, violations, b, i);
            }
            MirTerminator term = blocks.get(b).getTerminator();
            for (Operand op : term.getOperands()) {
                if (op.getPlace() != null) readPlace(op.getPlace(), state, violations, b, stmts.size());
            }
        }
        return violations;
    }

    private void transfer(MirStatement stmt, BitSet moved, List<Violation> sink, int b, int i) {
        if (stmt instanceof MirStatement.Assign) {
            MirStatement.Assign assign = (MirStatement.Assign) stmt;
            if (assign.getValue() instanceof Rvalue.Borrow) {
                readPlace(((Rvalue.Borrow) assign.getValue()).getPlace(), moved, sink, b, i);
            }
        }
        for (Operand op : stmt.getOperands()) {
            Place place = op.getPlace();
            if (place == null) continue;
            readPlace(place, moved, sink, b, i);
            if (op instanceof Operand.Move && place.isLocal()) {
                moved.set(place.getLocal());
            }
        }
        if (stmt instanceof MirStatement.Assign) {
            Place dest = ((MirStatement.Assign) stmt).getDestination();
            dest.forEachDestinationReadLocal(l -> report(l, moved, sink, b, i));
            if (dest.isLocal()) {
                moved.clear(dest.getLocal());
            }
        }
    }

    private void readPlace(Place place, BitSet moved, List<Violation> sink, int b, int i) {
        place.forEachReadLocal(l -> report(l, moved, sink, b, i));
    }

    private void report(int local, BitSet moved, List<Violation> sink, int b, int i) {
        if (sink != null && moved.get(local)) {
            sink.add(new Violation(ViolationKind.USE_AFTER_MOVE, b, i,
                    "_" + local + " may have been moved before this use"));
        }
    }
}
