package com.keellang.ir.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果。没有任何违规时函数被接受。
 */
public final class VerificationReport {

    private final String function;
    private final List<Violation> violations;

    public VerificationReport(String function, List<Violation> violations) {
        this.function = function;
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public String getFunction() { return function; }
    public List<Violation> getViolations() { return violations; }

    public boolean isAccepted() {
        return violations.isEmpty();
    }

    public boolean has(ViolationKind kind) {
        for (Violation v : violations) {
            if (v.getKind() == kind) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        if (isAccepted()) return function + ": accepted";
        StringBuilder sb = new StringBuilder(function).append(": rejected");
        for (Violation v : violations) {
            sb.append("\n  ").append(v);
        }
        return sb.toString();
    }
}
