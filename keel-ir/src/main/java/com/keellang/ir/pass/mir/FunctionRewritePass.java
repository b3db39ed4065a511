package com.keellang.ir.pass.mir;

import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Rvalue;
import com.keellang.ir.pass.MirPass;
import com.keellang.ir.pass.PassContext;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 在函数副本上原地改写的 pass 基类。
 */
public abstract class FunctionRewritePass implements MirPass {

    @Override
    public MirFunction run(MirFunction function, PassContext context) {
        MirFunction copy = function.copy();
        apply(copy, context);
        return copy;
    }

    /**
     * 原地改写，返回是否有变化。
     */
    public abstract boolean apply(MirFunction function, PassContext context);

    /**
     * 用 mapper 替换函数中所有语句与终止指令读取的操作数。
     */
    protected static boolean rewriteOperands(MirFunction func, UnaryOperator<Operand> mapper) {
        boolean changed = false;
        for (BasicBlock block : func.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                MirStatement stmt = stmts.get(i);
                MirStatement rewritten = mapStatementOperands(stmt, mapper);
                if (rewritten != stmt) {
                    stmts.set(i, rewritten);
                    changed = true;
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
        }
        return changed;
    }

    /** 目标 place 与借用位置不经过 mapper */
    protected static MirStatement mapStatementOperands(MirStatement stmt, UnaryOperator<Operand> mapper) {
        if (stmt instanceof MirStatement.Assign) {
            MirStatement.Assign assign = (MirStatement.Assign) stmt;
            return assign.withValue(assign.getValue().mapOperands(mapper));
        }
        if (stmt instanceof MirStatement.Eval) {
            MirStatement.Eval eval = (MirStatement.Eval) stmt;
            Rvalue.Call call = eval.getCall().mapOperands(mapper);
            return call == eval.getCall() ? stmt : new MirStatement.Eval(stmt.getLocation(), call);
        }
        if (stmt instanceof MirStatement.Check) {
            MirStatement.Check check = (MirStatement.Check) stmt;
            return check.withOperand(mapper.apply(check.getOperand()));
        }
        return stmt;
    }
}
