package com.keellang.ir.pass.mir;

import com.keellang.compiler.types.TypeId;
import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.ConstValue;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirLocal;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.PlaceTypes;
import com.keellang.ir.mir.Rvalue;
import com.keellang.ir.pass.PassContext;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 常量折叠与常量传播。
 * <ul>
 *   <li>两个常量操作数的一元/二元运算折叠为单个常量</li>
 *   <li>只被赋值一次且赋值为常量的局部变量，其复制读取替换为该常量</li>
 *   <li>条件为常量的分支改为无条件跳转</li>
 * </ul>
 * 被借用或被移动过的局部变量不参与传播。
 */
public class ConstantFolding extends FunctionRewritePass {

    @Override
    public String getName() {
        return "ConstantFolding";
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
            boolean roundChanged = propagate(func);
            roundChanged |= fold(func, context);
            roundChanged |= foldBranches(func);
            if (!roundChanged) break;
            changed = true;
        }
        return changed;
    }

    // ========== 传播 ==========

    private boolean propagate(MirFunction func) {
        int n = func.getLocals().size();
        int[] defs = new int[n];
        Operand[] constants = new Operand[n];
        boolean[] blocked = new boolean[n];

        for (BasicBlock block : func.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                for (Operand op : stmt.getOperands()) {
                    if (op instanceof Operand.Move) blocked[op.getPlace().getLocal()] = true;
                }
                if (!(stmt instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                Place dest = assign.getDestination();
                defs[dest.getLocal()]++;
                if (assign.getValue() instanceof Rvalue.Borrow) {
                    blocked[((Rvalue.Borrow) assign.getValue()).getPlace().getLocal()] = true;
                }
                Rvalue value = assign.getValue();
                if (dest.isLocal() && value instanceof Rvalue.Use
                        && ((Rvalue.Use) value).getOperand().isConstant()) {
                    constants[dest.getLocal()] = ((Rvalue.Use) value).getOperand();
                } else {
                    blocked[dest.getLocal()] = true;
                }
            }
        }

        Operand[] replacement = new Operand[n];
        boolean any = false;
        for (int i = 0; i < n; i++) {
            MirLocal local = func.getLocal(i);
            if (defs[i] == 1 && constants[i] != null && !blocked[i]
                    && local.getKind() != LocalKind.RETURN && local.getKind() != LocalKind.ARG
                    && !local.isBorrow()) {
                replacement[i] = constants[i];
                any = true;
            }
        }
        if (!any) return false;

        UnaryOperator<Operand> mapper = op -> {
            if (op instanceof Operand.Copy && op.getPlace().isLocal()) {
                Operand constant = replacement[op.getPlace().getLocal()];
                if (constant != null) return constant;
            }
            return op;
        };
        return rewriteOperands(func, mapper);
    }

    // ========== 折叠 ==========

    private boolean fold(MirFunction func, PassContext context) {
        boolean changed = false;
        for (BasicBlock block : func.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                ConstValue folded = evaluate(assign.getValue());
                if (folded == null) continue;
                TypeId type = PlaceTypes.typeOf(assign.getDestination(), func, context.getTypes());
                stmts.set(i, assign.withValue(Rvalue.use(Operand.constant(folded, type))));
                changed = true;
            }
        }
        return changed;
    }

    private static ConstValue evaluate(Rvalue value) {
        if (value instanceof Rvalue.Binary) {
            Rvalue.Binary b = (Rvalue.Binary) value;
            if (b.getLeft() instanceof Operand.Constant && b.getRight() instanceof Operand.Constant) {
                return ConstEvaluator.binary(b.getOp(),
                        ((Operand.Constant) b.getLeft()).getValue(),
                        ((Operand.Constant) b.getRight()).getValue());
            }
        } else if (value instanceof Rvalue.Unary) {
            Rvalue.Unary u = (Rvalue.Unary) value;
            if (u.getOperand() instanceof Operand.Constant) {
                return ConstEvaluator.unary(u.getOp(), ((Operand.Constant) u.getOperand()).getValue());
            }
        }
        return null;
    }

    private boolean foldBranches(MirFunction func) {
        boolean changed = false;
        for (BasicBlock block : func.getBlocks()) {
            if (!(block.getTerminator() instanceof MirTerminator.Branch)) continue;
            MirTerminator.Branch br = (MirTerminator.Branch) block.getTerminator();
            if (!(br.getCondition() instanceof Operand.Constant)) continue;
            ConstValue cond = ((Operand.Constant) br.getCondition()).getValue();
            if (cond.getKind() != ConstValue.ConstKind.BOOL) continue;
            int target = cond.asBool() ? br.getThenBlock() : br.getElseBlock();
            block.setTerminator(new MirTerminator.Goto(br.getLocation(), target));
            changed = true;
        }
        return changed;
    }
}
