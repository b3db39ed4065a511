package com.keellang.ir.mir;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 函数（包含 CFG）。
 * <p>
 * 局部变量表：_0 为返回槽，_1.._n 为参数，其后为用户变量与临时变量。
 * 块表下标即块 ID，入口块固定为 B0。
 */
public class MirFunction {

    private final FnId id;
    private final String name;
    private final MirSignature signature;
    private final SourceLocation location;
    private final List<BasicBlock> blocks;
    private final List<MirLocal> locals;

    public MirFunction(FnId id, String name, MirSignature signature, SourceLocation location) {
        this.id = id;
        this.name = name;
        this.signature = signature;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.blocks = new ArrayList<>();
        this.locals = new ArrayList<>();
    }

    public FnId getId() { return id; }
    public String getName() { return name; }
    public MirSignature getSignature() { return signature; }
    public SourceLocation getLocation() { return location; }
    public List<BasicBlock> getBlocks() { return blocks; }
    public List<MirLocal> getLocals() { return locals; }

    /** 诊断中使用的函数标识 */
    public String getLabel() {
        return name + "#" + id.getIndex();
    }

    public int getArgCount() {
        return signature.getParamCount();
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public BasicBlock getBlock(int id) {
        return blocks.get(id);
    }

    public MirLocal getLocal(int index) {
        return locals.get(index);
    }

    public BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(blocks.size());
        blocks.add(block);
        return block;
    }

    public int newLocal(TypeId type, Regime regime, LocalKind kind, String name, SourceLocation location) {
        int index = locals.size();
        locals.add(new MirLocal(index, type, regime, kind, name, location));
        return index;
    }

    /** 整体替换块表（块 ID 必须与下标一致） */
    public void replaceBlocks(List<BasicBlock> newBlocks) {
        blocks.clear();
        blocks.addAll(newBlocks);
    }

    public void replaceLocals(List<MirLocal> newLocals) {
        locals.clear();
        locals.addAll(newLocals);
    }

    /** 深拷贝块结构；语句、终止指令与局部变量不可变，直接共享 */
    public MirFunction copy() {
        MirFunction fn = new MirFunction(id, name, signature, location);
        fn.locals.addAll(locals);
        for (BasicBlock block : blocks) {
            fn.blocks.add(block.copy(block.getId()));
        }
        return fn;
    }

    @Override
    public String toString() {
        return MirPrinter.print(this, null);
    }
}
