package com.keellang.ir.verify;

import com.keellang.compiler.symbols.FnSignature;
import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeKind;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.MirOptions;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirLocal;
import com.keellang.ir.mir.MirSignature;
import com.keellang.ir.mir.MirStatement;
import com.keellang.ir.mir.MirTerminator;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.PlaceTypes;
import com.keellang.ir.mir.Rvalue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * MIR 校验器。只读，不修改输入函数。
 * <p>
 * 检查顺序：
 * <ol>
 *   <li>结构：终止指令、跳转目标、入口块无前驱</li>
 *   <li>局部变量：声明、制式与签名一致</li>
 *   <li>类型：每条赋值、调用、检查、分支的操作数类型</li>
 *   <li>借用：合成借用只在紧随其后的调用中被读取一次，参数借用只能解引用或直接转交</li>
 *   <li>释放：释放调用的操作数必须是手动句柄</li>
 *   <li>移动（严格模式）：不读取可能已被移动的局部变量</li>
 * </ol>
 * 一次校验收集全部违规，不在第一条处停止。实例无状态，可被多个工作线程共享。
 */
public class MirVerifier {

    private final TypeTable types;
    private final SymbolTable symbols;
    private final MirOptions options;

    public MirVerifier(TypeTable types, SymbolTable symbols, MirOptions options) {
        this.types = types;
        this.symbols = symbols;
        this.options = options;
    }

    public VerificationReport verify(MirFunction function) {
        Run run = new Run(function);
        boolean structureOk = run.checkStructure();
        boolean localsOk = run.checkLocals();
        if (localsOk) {
            run.checkTypes();
            run.checkBorrows();
            run.checkReleases();
            if (structureOk && options.isStrictMoves()) {
                run.violations.addAll(new MoveChecker(function).check());
            }
        }
        return new VerificationReport(function.getLabel(), run.violations);
    }

    /** 局部变量在一条指令中的出现方式 */
    enum UseRole {
        /** 直接作为调用实参（裸局部变量） */
        CALL_ARG,
        /** 作为以解引用开头的 place 的基变量 */
        DEREF,
        /** 整体被赋值 */
        WRITE,
        OTHER
    }

    /**
     * 单次校验的状态。
     */
    private final class Run {
        final MirFunction fn;
        final List<Violation> violations = new ArrayList<>();

        Run(MirFunction fn) {
            this.fn = fn;
        }

        void report(ViolationKind kind, int block, int instruction, String message) {
            violations.add(new Violation(kind, block, instruction, message));
        }

        // ========== 结构 ==========

        boolean checkStructure() {
            int before = violations.size();
            List<BasicBlock> blocks = fn.getBlocks();
            if (blocks.isEmpty()) {
                report(ViolationKind.MISSING_TERMINATOR, Violation.NO_INDEX, Violation.NO_INDEX,
                        "function has no entry block");
                return false;
            }
            for (int b = 0; b < blocks.size(); b++) {
                BasicBlock block = blocks.get(b);
                int termIndex = block.getStatements().size();
                if (block.getId() != b) {
                    report(ViolationKind.INVALID_TARGET, b, Violation.NO_INDEX,
                            "block at position " + b + " has id B" + block.getId());
                }
                MirTerminator term = block.getTerminator();
                if (term == null) {
                    report(ViolationKind.MISSING_TERMINATOR, b, termIndex, "block has no terminator");
                    continue;
                }
                for (int target : term.getSuccessors()) {
                    if (target < 0 || target >= blocks.size()) {
                        report(ViolationKind.INVALID_TARGET, b, termIndex, "jump to nonexistent block B" + target);
                    } else if (target == 0) {
                        report(ViolationKind.ENTRY_HAS_PREDECESSOR, b, termIndex, "jump back to entry block B0");
                    }
                }
            }
            return violations.size() == before;
        }

        // ========== 局部变量 ==========

        boolean checkLocals() {
            int before = violations.size();
            List<MirLocal> locals = fn.getLocals();
            MirSignature sig = fn.getSignature();
            for (int i = 0; i < locals.size(); i++) {
                MirLocal local = locals.get(i);
                if (local.getIndex() != i) {
                    report(ViolationKind.UNDECLARED_LOCAL, Violation.NO_INDEX, Violation.NO_INDEX,
                            "local at position " + i + " is numbered _" + local.getIndex());
                }
                if (!types.contains(local.getType())) {
                    report(ViolationKind.TYPE_MISMATCH, Violation.NO_INDEX, Violation.NO_INDEX,
                            "local _" + i + " has unknown type " + local.getType());
                    continue;
                }
                if (types.regimeOf(local.getType()) != local.getRegime()) {
                    report(ViolationKind.REGIME_MISMATCH, Violation.NO_INDEX, Violation.NO_INDEX,
                            "local _" + i + " declared " + local.getRegime() + " but its type "
                                    + types.display(local.getType()) + " is " + types.regimeOf(local.getType()));
                }
            }
            if (locals.size() <= sig.getParamCount()) {
                report(ViolationKind.UNDECLARED_LOCAL, Violation.NO_INDEX, Violation.NO_INDEX,
                        "local table lacks the return slot or parameters");
                return false;
            }
            if (locals.get(0).getKind() != LocalKind.RETURN || !locals.get(0).getType().equals(sig.getReturnType())) {
                report(ViolationKind.TYPE_MISMATCH, Violation.NO_INDEX, Violation.NO_INDEX,
                        "_0 is not a return slot of type " + sig.getReturnType());
            }
            for (int p = 0; p < sig.getParamCount(); p++) {
                MirLocal arg = locals.get(p + 1);
                if (arg.getKind() != LocalKind.ARG || !arg.getType().equals(sig.getParamTypes().get(p))) {
                    report(ViolationKind.TYPE_MISMATCH, Violation.NO_INDEX, Violation.NO_INDEX,
                            "_" + (p + 1) + " does not match parameter " + p + " of the signature");
                }
            }

            int n = locals.size();
            List<BasicBlock> blocks = fn.getBlocks();
            for (int b = 0; b < blocks.size(); b++) {
                BasicBlock block = blocks.get(b);
                List<MirStatement> stmts = block.getStatements();
                for (int i = 0; i < stmts.size(); i++) {
                    checkDeclared(stmts.get(i), n, b, i);
                }
                if (block.getTerminator() != null) {
                    final int bb = b;
                    final int ti = stmts.size();
                    block.getTerminator().forEachReadLocal(l -> {
                        if (l < 0 || l >= n) report(ViolationKind.UNDECLARED_LOCAL, bb, ti, "undeclared local _" + l);
                    });
                }
            }
            return violations.size() == before;
        }

        private void checkDeclared(MirStatement stmt, int n, int b, int i) {
            IntConsumer check = l -> {
                if (l < 0 || l >= n) report(ViolationKind.UNDECLARED_LOCAL, b, i, "undeclared local _" + l);
            };
            stmt.forEachReadLocal(check);
            if (stmt instanceof MirStatement.Assign) {
                check.accept(((MirStatement.Assign) stmt).getDestination().getLocal());
            }
        }

        // ========== 类型 ==========

        void checkTypes() {
            List<BasicBlock> blocks = fn.getBlocks();
            for (int b = 0; b < blocks.size(); b++) {
                BasicBlock block = blocks.get(b);
                List<MirStatement> stmts = block.getStatements();
                for (int i = 0; i < stmts.size(); i++) {
                    try {
                        checkStatementTypes(stmts.get(i), b, i);
                    } catch (IllegalArgumentException e) {
                        report(ViolationKind.TYPE_MISMATCH, b, i, e.getMessage());
                    }
                }
                if (block.getTerminator() != null) {
                    try {
                        checkTerminatorTypes(block.getTerminator(), b, stmts.size());
                    } catch (IllegalArgumentException e) {
                        report(ViolationKind.TYPE_MISMATCH, b, stmts.size(), e.getMessage());
                    }
                }
            }
        }

        private void checkStatementTypes(MirStatement stmt, int b, int i) {
            if (stmt instanceof MirStatement.Assign) {
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                TypeId dest = PlaceTypes.typeOf(assign.getDestination(), fn, types);
                checkRvalue(assign.getValue(), dest, b, i);
            } else if (stmt instanceof MirStatement.Eval) {
                checkCall(((MirStatement.Eval) stmt).getCall(), null, b, i);
            } else if (stmt instanceof MirStatement.Check) {
                MirStatement.Check check = (MirStatement.Check) stmt;
                TypeKind kind = types.kindOf(typeOf(check.getOperand()));
                if (check.getKind() == MirStatement.Check.CheckKind.NULL) {
                    if (!kind.isPointer() || !kind.getRegime().isHandle()) {
                        report(ViolationKind.TYPE_MISMATCH, b, i, "null check on non-handle " + kind);
                    }
                } else if (!kind.isInteger()) {
                    report(ViolationKind.TYPE_MISMATCH, b, i, "bounds check on non-integer " + kind);
                } else if (check.getLength() < 0) {
                    report(ViolationKind.TYPE_MISMATCH, b, i, "bounds check with negative length");
                }
            }
        }

        private void checkRvalue(Rvalue value, TypeId dest, int b, int i) {
            if (value instanceof Rvalue.Use) {
                expect(typeOf(((Rvalue.Use) value).getOperand()), dest, b, i, "assigned value");
            } else if (value instanceof Rvalue.Unary) {
                Rvalue.Unary u = (Rvalue.Unary) value;
                expect(typeOf(u.getOperand()), dest, b, i, u.getOp() + " operand");
            } else if (value instanceof Rvalue.Binary) {
                Rvalue.Binary bin = (Rvalue.Binary) value;
                TypeId left = typeOf(bin.getLeft());
                TypeId right = typeOf(bin.getRight());
                switch (bin.getOp()) {
                    case SHL:
                    case SHR:
                        expect(left, dest, b, i, bin.getOp() + " left operand");
                        if (!types.kindOf(right).isInteger()) {
                            report(ViolationKind.TYPE_MISMATCH, b, i, "shift amount is not an integer");
                        }
                        break;
                    default:
                        expect(right, left, b, i, bin.getOp() + " right operand");
                        expect(bin.getOp().isComparison() ? types.bool() : left, dest, b, i, bin.getOp() + " result");
                        break;
                }
            } else if (value instanceof Rvalue.Call) {
                checkCall((Rvalue.Call) value, dest, b, i);
            } else if (value instanceof Rvalue.Aggregate) {
                Rvalue.Aggregate agg = (Rvalue.Aggregate) value;
                expect(agg.getType(), dest, b, i, "aggregate");
                if (types.kindOf(agg.getType()) != TypeKind.STRUCT
                        || types.structFields(agg.getType()).size() != agg.getFields().size()) {
                    report(ViolationKind.TYPE_MISMATCH, b, i, "aggregate field count does not match "
                            + types.display(agg.getType()));
                    return;
                }
                for (int f = 0; f < agg.getFields().size(); f++) {
                    expect(typeOf(agg.getFields().get(f)), types.fieldType(agg.getType(), f), b, i, "field " + f);
                }
            } else if (value instanceof Rvalue.Borrow) {
                if (types.kindOf(dest) != TypeKind.BORROW) {
                    report(ViolationKind.BORROW_ESCAPE, b, i, "borrow stored into non-borrow place of type "
                            + types.display(dest));
                    return;
                }
                TypeId place = PlaceTypes.typeOf(((Rvalue.Borrow) value).getPlace(), fn, types);
                expect(place, types.pointee(dest), b, i, "borrowed place");
            }
        }

        private void checkCall(Rvalue.Call call, TypeId dest, int b, int i) {
            FnSignature sig = symbols.function(call.getFunction());
            if (sig == null) {
                report(ViolationKind.TYPE_MISMATCH, b, i, "call to undeclared function " + call.getFunction());
                return;
            }
            if (sig.getParamTypes().size() != call.getArgs().size()) {
                report(ViolationKind.TYPE_MISMATCH, b, i, sig.getName() + " expects " + sig.getParamTypes().size()
                        + " argument(s), got " + call.getArgs().size());
                return;
            }
            for (int a = 0; a < call.getArgs().size(); a++) {
                expect(typeOf(call.getArgs().get(a)), sig.getParamTypes().get(a), b, i,
                        sig.getName() + " argument " + a);
            }
            if (dest != null) {
                expect(sig.getReturnType(), dest, b, i, sig.getName() + " result");
            }
        }

        private void checkTerminatorTypes(MirTerminator term, int b, int i) {
            if (term instanceof MirTerminator.Branch) {
                expect(typeOf(((MirTerminator.Branch) term).getCondition()), types.bool(), b, i, "branch condition");
            } else if (term instanceof MirTerminator.Switch) {
                TypeId key = typeOf(((MirTerminator.Switch) term).getKey());
                if (!types.kindOf(key).isInteger()) {
                    report(ViolationKind.TYPE_MISMATCH, b, i, "switch on non-integer " + types.display(key));
                }
            }
        }

        private TypeId typeOf(Operand operand) {
            TypeId type = PlaceTypes.typeOf(operand, fn, types);
            if (!types.contains(type)) {
                throw new IllegalArgumentException("operand " + operand + " has unknown type " + type);
            }
            return type;
        }

        private void expect(TypeId actual, TypeId expected, int b, int i, String what) {
            if (!actual.equals(expected)) {
                report(ViolationKind.TYPE_MISMATCH, b, i, what + " has type " + types.display(actual)
                        + ", expected " + types.display(expected));
            }
        }

        // ========== 借用 ==========

        void checkBorrows() {
            for (MirLocal local : fn.getLocals()) {
                if (!local.isBorrow()) continue;
                switch (local.getKind()) {
                    case RETURN:
                        report(ViolationKind.BORROW_ESCAPE, Violation.NO_INDEX, Violation.NO_INDEX,
                                "function returns a borrow");
                        break;
                    case USER:
                        report(ViolationKind.BORROW_ESCAPE, Violation.NO_INDEX, Violation.NO_INDEX,
                                "named local _" + local.getIndex() + " holds a borrow");
                        break;
                    case ARG:
                        checkBorrowArg(local.getIndex());
                        break;
                    default:
                        checkBorrowTemp(local.getIndex());
                        break;
                }
            }
        }

        private void checkBorrowArg(int local) {
            forEachUse(local, (b, i, role) -> {
                if (role == UseRole.WRITE || role == UseRole.OTHER) {
                    report(ViolationKind.BORROW_ESCAPE, b, i, "borrow parameter _" + local
                            + (role == UseRole.WRITE ? " is overwritten" : " is copied out of its call window"));
                }
            });
        }

        private void checkBorrowTemp(int local) {
            List<int[]> defs = new ArrayList<>();
            List<int[]> reads = new ArrayList<>();
            forEachUse(local, (b, i, role) -> {
                int[] at = {b, i, role.ordinal()};
                if (role == UseRole.WRITE) defs.add(at); else reads.add(at);
            });
            if (defs.size() != 1) {
                int[] at = defs.isEmpty() ? null : defs.get(1);
                report(ViolationKind.BORROW_ESCAPE, at != null ? at[0] : Violation.NO_INDEX,
                        at != null ? at[1] : Violation.NO_INDEX,
                        "borrow temporary _" + local + " is assigned " + defs.size() + " times");
                return;
            }
            int[] def = defs.get(0);
            MirStatement defStmt = fn.getBlock(def[0]).getStatements().get(def[1]);
            if (!(((MirStatement.Assign) defStmt).getValue() instanceof Rvalue.Borrow)) {
                report(ViolationKind.BORROW_ESCAPE, def[0], def[1],
                        "borrow temporary _" + local + " is not produced by a borrow");
            }
            boolean consumed = false;
            for (int[] read : reads) {
                boolean inWindow = read[0] == def[0] && read[1] == def[1] + 1
                        && read[2] == UseRole.CALL_ARG.ordinal()
                        && read[1] < fn.getBlock(read[0]).getStatements().size();
                if (inWindow && !consumed) {
                    consumed = true;
                } else {
                    report(ViolationKind.BORROW_ESCAPE, read[0], read[1],
                            "borrow temporary _" + local + " is read outside its call");
                }
            }
            if (!consumed) {
                report(ViolationKind.BORROW_ESCAPE, def[0], def[1],
                        "borrow temporary _" + local + " is not consumed by the following call");
            }
        }

        private void forEachUse(int local, UseSink sink) {
            List<BasicBlock> blocks = fn.getBlocks();
            for (int b = 0; b < blocks.size(); b++) {
                List<MirStatement> stmts = blocks.get(b).getStatements();
                for (int i = 0; i < stmts.size(); i++) {
                    final int bb = b;
                    final int ii = i;
                    scanStatement(stmts.get(i), local, role -> sink.accept(bb, ii, role));
                }
                MirTerminator term = blocks.get(b).getTerminator();
                if (term != null) {
                    final int bb = b;
                    final int ti = stmts.size();
                    for (Operand op : term.getOperands()) {
                        if (op.getPlace() != null) scanRead(op.getPlace(), local, role -> sink.accept(bb, ti, role));
                    }
                }
            }
        }

        private void scanStatement(MirStatement stmt, int local, RoleSink sink) {
            if (stmt instanceof MirStatement.Assign) {
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                Rvalue value = assign.getValue();
                if (value instanceof Rvalue.Call) {
                    scanArgs(((Rvalue.Call) value).getArgs(), local, sink);
                } else if (value instanceof Rvalue.Borrow) {
                    scanRead(((Rvalue.Borrow) value).getPlace(), local, sink);
                } else {
                    for (Operand op : value.getOperands()) {
                        if (op.getPlace() != null) scanRead(op.getPlace(), local, sink);
                    }
                }
                Place dest = assign.getDestination();
                if (dest.hasDeref()) {
                    scanRead(dest, local, sink);
                } else {
                    if (dest.getLocal() == local) sink.accept(UseRole.WRITE);
                    dest.forEachIndexLocal(l -> {
                        if (l == local) sink.accept(UseRole.OTHER);
                    });
                }
            } else if (stmt instanceof MirStatement.Eval) {
                scanArgs(((MirStatement.Eval) stmt).getCall().getArgs(), local, sink);
            } else {
                for (Operand op : stmt.getOperands()) {
                    if (op.getPlace() != null) scanRead(op.getPlace(), local, sink);
                }
            }
        }

        private void scanArgs(List<Operand> args, int local, RoleSink sink) {
            for (Operand arg : args) {
                Place place = arg.getPlace();
                if (place == null) continue;
                if (place.isLocal()) {
                    if (place.getLocal() == local) sink.accept(UseRole.CALL_ARG);
                } else {
                    scanRead(place, local, sink);
                }
            }
        }

        private void scanRead(Place place, int local, RoleSink sink) {
            if (place.getLocal() == local) {
                sink.accept(place.startsWithDeref() ? UseRole.DEREF : UseRole.OTHER);
            }
            place.forEachIndexLocal(l -> {
                if (l == local) sink.accept(UseRole.OTHER);
            });
        }

        // ========== 释放 ==========

        void checkReleases() {
            List<BasicBlock> blocks = fn.getBlocks();
            for (int b = 0; b < blocks.size(); b++) {
                List<MirStatement> stmts = blocks.get(b).getStatements();
                for (int i = 0; i < stmts.size(); i++) {
                    Rvalue.Call call = callOf(stmts.get(i));
                    if (call == null) continue;
                    FnSignature sig = symbols.function(call.getFunction());
                    if (sig == null || !sig.isRelease()) continue;
                    for (Operand arg : call.getArgs()) {
                        TypeId type;
                        try {
                            type = PlaceTypes.typeOf(arg, fn, types);
                        } catch (IllegalArgumentException e) {
                            continue;   // 已在类型检查中报告
                        }
                        Regime regime = types.contains(type) ? types.regimeOf(type) : null;
                        if (regime != Regime.MANUAL_HANDLE) {
                            report(ViolationKind.REGIME_MISMATCH, b, i, sig.getName() + " releases " + arg
                                    + " of regime " + regime + ", expected MANUAL_HANDLE");
                        }
                    }
                }
            }
        }

        private Rvalue.Call callOf(MirStatement stmt) {
            if (stmt instanceof MirStatement.Eval) {
                return ((MirStatement.Eval) stmt).getCall();
            }
            if (stmt instanceof MirStatement.Assign && ((MirStatement.Assign) stmt).getValue() instanceof Rvalue.Call) {
                return (Rvalue.Call) ((MirStatement.Assign) stmt).getValue();
            }
            return null;
        }
    }

    @FunctionalInterface
    private interface RoleSink {
        void accept(UseRole role);
    }

    @FunctionalInterface
    private interface UseSink {
        void accept(int block, int instruction, UseRole role);
    }
}
