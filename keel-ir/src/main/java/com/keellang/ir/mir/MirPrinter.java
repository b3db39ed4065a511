package com.keellang.ir.mir;

import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeTable;

/**
 * MIR 文本输出。输出是确定性的，也用于比较两次优化结果是否一致。
 */
public final class MirPrinter {

    private MirPrinter() {
    }

    /**
     * @param types 类型表；为 null 时直接打印类型句柄
     */
    public static String print(MirFunction fn, TypeTable types) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(fn.getName()).append('(');
        for (int i = 1; i <= fn.getArgCount(); i++) {
            if (i > 1) sb.append(", ");
            sb.append('_').append(i).append(": ").append(typeName(fn.getLocal(i).getType(), types));
        }
        sb.append(") -> ").append(typeName(fn.getSignature().getReturnType(), types)).append(" {\n");
        for (MirLocal local : fn.getLocals()) {
            sb.append("    let _").append(local.getIndex()).append(": ")
                    .append(typeName(local.getType(), types));
            sb.append("; // ").append(local.getKind().name().toLowerCase())
                    .append(' ').append(local.getRegime().name().toLowerCase());
            if (local.getName() != null) sb.append(' ').append(local.getName());
            sb.append('\n');
        }
        for (BasicBlock block : fn.getBlocks()) {
            sb.append('\n').append("    B").append(block.getId()).append(": {\n");
            for (MirStatement stmt : block.getStatements()) {
                sb.append("        ").append(stmt).append(";\n");
            }
            sb.append("        ")
                    .append(block.getTerminator() != null ? block.getTerminator().toString() : "<no terminator>")
                    .append(";\n");
            sb.append("    }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String typeName(TypeId type, TypeTable types) {
        return types != null ? types.display(type) : String.valueOf(type);
    }
}
