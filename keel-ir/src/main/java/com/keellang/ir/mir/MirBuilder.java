package com.keellang.ir.mir;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;
import com.keellang.ir.diag.CompilationTooLargeException;
import com.keellang.ir.diag.Stage;

import java.util.List;

/**
 * MIR 构建辅助类。
 * 封装创建语句、基本块、局部变量的便捷方法。
 * 当前块已终止时，后续发射的语句自动落入一个新的（不可达）块。
 */
public class MirBuilder {

    private final MirFunction function;
    private final int maxBlocks;
    private BasicBlock currentBlock;

    public MirBuilder(MirFunction function, int maxBlocks) {
        this.function = function;
        this.maxBlocks = maxBlocks;
        this.currentBlock = newBlock(); // entry block
    }

    public MirFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock() {
        if (function.getBlocks().size() >= maxBlocks) {
            throw new CompilationTooLargeException(Stage.CFG_BUILD, function.getLabel(),
                    "function exceeds " + maxBlocks + " basic blocks", function.getLocation());
        }
        return function.newBlock();
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    public boolean isTerminated() {
        return currentBlock.hasTerminator();
    }

    // ========== 局部变量 ==========

    public int newLocal(String name, TypeId type, Regime regime, SourceLocation loc) {
        return function.newLocal(type, regime, LocalKind.USER, name, loc);
    }

    public int newTemp(TypeId type, Regime regime, SourceLocation loc) {
        return function.newLocal(type, regime, LocalKind.TEMP, null, loc);
    }

    // ========== 语句发射 ==========

    private BasicBlock openBlock() {
        if (currentBlock.hasTerminator()) {
            currentBlock = newBlock();
        }
        return currentBlock;
    }

    private void emit(MirStatement stmt) {
        openBlock().addStatement(stmt);
    }

    public void emitAssign(Place dest, Rvalue value, SourceLocation loc) {
        emit(new MirStatement.Assign(loc, dest, value));
    }

    /** 写入新临时变量并返回其编号 */
    public int emitTemp(Rvalue value, TypeId type, Regime regime, SourceLocation loc) {
        int temp = newTemp(type, regime, loc);
        emitAssign(Place.local(temp), value, loc);
        return temp;
    }

    public void emitEval(Rvalue.Call call, SourceLocation loc) {
        emit(new MirStatement.Eval(loc, call));
    }

    public void emitNullCheck(Operand handle, SourceLocation loc) {
        emit(MirStatement.Check.notNull(loc, handle));
    }

    public void emitBoundsCheck(Operand index, int length, SourceLocation loc) {
        emit(MirStatement.Check.bounds(loc, index, length));
    }

    // ========== 终止指令 ==========

    private void terminate(MirTerminator terminator) {
        openBlock().setTerminator(terminator);
    }

    public void emitGoto(int targetBlockId, SourceLocation loc) {
        terminate(new MirTerminator.Goto(loc, targetBlockId));
    }

    public void emitBranch(Operand condition, int thenBlock, int elseBlock, SourceLocation loc) {
        terminate(new MirTerminator.Branch(loc, condition, thenBlock, elseBlock));
    }

    public void emitSwitch(Operand key, List<Long> values, List<Integer> targets, int defaultBlock,
                           SourceLocation loc) {
        terminate(new MirTerminator.Switch(loc, key, values, targets, defaultBlock));
    }

    public void emitReturn(SourceLocation loc) {
        terminate(new MirTerminator.Return(loc));
    }

    public void emitTrap(String reason, SourceLocation loc) {
        terminate(new MirTerminator.Trap(loc, reason));
    }
}
