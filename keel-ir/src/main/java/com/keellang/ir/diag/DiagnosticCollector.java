package com.keellang.ir.diag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 诊断汇总器。多个工作线程并发写入，读取时按函数/阶段/位置排序，
 * 保证同一输入每次得到相同的诊断顺序。
 */
public class DiagnosticCollector {

    private static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::getFunction, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Diagnostic::getStage)
            .thenComparingInt(Diagnostic::getBlock)
            .thenComparingInt(Diagnostic::getInstruction)
            .thenComparing(Diagnostic::getMessage);

    private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(List<Diagnostic> list) {
        diagnostics.addAll(list);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> result = new ArrayList<>(diagnostics);
        result.sort(ORDER);
        return result;
    }
}
