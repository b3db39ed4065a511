package com.keellang.ir.diag;

/**
 * 管线阶段（用于诊断定位）。
 */
public enum Stage {
    DESUGAR("desugar"),
    CFG_BUILD("cfg-build"),
    OPTIMIZE("optimize"),
    VERIFY("verify");

    private final String displayName;

    Stage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
