package com.keellang.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 基本块。ID 即其在函数块表中的下标。
 */
public class BasicBlock {

    private final int id;
    private final List<MirStatement> statements;
    private MirTerminator terminator;

    public BasicBlock(int id) {
        this.id = id;
        this.statements = new ArrayList<>();
    }

    public int getId() { return id; }

    public List<MirStatement> getStatements() { return statements; }

    public void addStatement(MirStatement statement) {
        statements.add(statement);
    }

    public MirTerminator getTerminator() { return terminator; }

    public void setTerminator(MirTerminator terminator) {
        this.terminator = terminator;
    }

    public boolean hasTerminator() {
        return terminator != null;
    }

    /** 复制为新 ID 的块（语句对象不可变，可共享） */
    public BasicBlock copy(int newId) {
        BasicBlock block = new BasicBlock(newId);
        block.statements.addAll(statements);
        block.terminator = terminator;
        return block;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("B").append(id).append(":\n");
        for (MirStatement stmt : statements) {
            sb.append("  ").append(stmt).append('\n');
        }
        if (terminator != null) {
            sb.append("  ").append(terminator).append('\n');
        }
        return sb.toString();
    }
}
