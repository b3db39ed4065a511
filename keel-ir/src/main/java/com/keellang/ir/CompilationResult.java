package com.keellang.ir;

import com.keellang.ir.diag.Diagnostic;
import com.keellang.ir.mir.MirModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译结果：MIR 模块（只含通过校验的函数）与全部诊断。
 */
public class CompilationResult {

    private final MirModule module;
    private final List<Diagnostic> diagnostics;

    public CompilationResult(MirModule module, List<Diagnostic> diagnostics) {
        this.module = module;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public MirModule getModule() { return module; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
