package com.keellang.ir.lowering;

import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.decl.Parameter;
import com.keellang.compiler.ast.expr.*;
import com.keellang.compiler.ast.stmt.*;
import com.keellang.compiler.symbols.SymbolTable;
import com.keellang.compiler.types.LocalId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeDesc;
import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeKind;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.MirOptions;
import com.keellang.ir.diag.CompilerDefectException;
import com.keellang.ir.diag.Stage;
import com.keellang.ir.hir.HirNode;
import com.keellang.ir.hir.HirVisitor;
import com.keellang.ir.hir.decl.HirFunction;
import com.keellang.ir.hir.expr.HirBorrow;
import com.keellang.ir.hir.expr.HirTargetRead;
import com.keellang.ir.hir.stmt.HirLoop;
import com.keellang.ir.mir.BasicBlock;
import com.keellang.ir.mir.BinaryOp;
import com.keellang.ir.mir.ConstValue;
import com.keellang.ir.mir.LocalKind;
import com.keellang.ir.mir.MirBuilder;
import com.keellang.ir.mir.MirFunction;
import com.keellang.ir.mir.MirSignature;
import com.keellang.ir.mir.Operand;
import com.keellang.ir.mir.Place;
import com.keellang.ir.mir.Rvalue;
import com.keellang.ir.mir.UnaryOp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HIR → MIR 降级（CFG 构建）。
 * <p>
 * 新块只在两种情况下产生：终止指令之后，或作为显式跳转目标（循环头、else、汇合点、循环出口）。
 * 构建阶段允许产生冗余块与临时变量，由优化管线清理。
 * 每个函数使用一个新实例。
 */
public class HirToMirLowering implements HirVisitor<Object, MirBuilder> {

    private final TypeTable types;
    private final SymbolTable symbols;
    private final MirOptions options;

    private final Deque<LoopContext> loopStack = new ArrayDeque<>();
    private final Map<LocalId, Integer> localMap = new HashMap<>();
    private String function = "?";
    private Place assignTarget;   // 正在求值右侧的赋值目标，可为 null

    private static final class LoopContext {
        final String label;         // nullable
        final int continueBlockId;  // continue 跳转目标（循环头或更新块）
        final int exitBlockId;      // break 跳转目标
        LoopContext(String label, int continueBlockId, int exitBlockId) {
            this.label = label;
            this.continueBlockId = continueBlockId;
            this.exitBlockId = exitBlockId;
        }
    }

    public HirToMirLowering(TypeTable types, SymbolTable symbols, MirOptions options) {
        this.types = types;
        this.symbols = symbols;
        this.options = options;
    }

    // ========== 公共入口 ==========

    public MirFunction lower(HirFunction fn) {
        return (MirFunction) fn.accept(this, null);
    }

    @Override
    public Object visitFunction(HirFunction fn, MirBuilder unused) {
        function = fn.getLabel();
        loopStack.clear();
        assignTarget = null;
        localMap.clear();
        SourceLocation loc = fn.getLocation();

        List<TypeId> paramTypes = new ArrayList<>();
        List<Regime> paramRegimes = new ArrayList<>();
        for (Parameter p : fn.getParams()) {
            paramTypes.add(p.getType());
            paramRegimes.add(types.regimeOf(p.getType()));
        }
        MirSignature signature = new MirSignature(paramTypes, paramRegimes,
                fn.getReturnType(), types.regimeOf(fn.getReturnType()));
        MirFunction mir = new MirFunction(fn.getId(), fn.getName(), signature, loc);

        // _0 返回槽，_1.._n 参数
        mir.newLocal(fn.getReturnType(), signature.getReturnRegime(), LocalKind.RETURN, null, loc);
        for (Parameter p : fn.getParams()) {
            int index = mir.newLocal(p.getType(), types.regimeOf(p.getType()), LocalKind.ARG,
                    p.getName(), p.getLocation());
            localMap.put(p.getLocal(), index);
        }

        MirBuilder builder = new MirBuilder(mir, options.getMaxBlocks());
        lowerStmt(fn.getBody(), builder);
        if (!builder.isTerminated()) {
            if (types.kindOf(fn.getReturnType()) == TypeKind.UNIT) {
                builder.emitReturn(loc);
            } else {
                builder.emitTrap("missing return", loc);
            }
        }
        return mir;
    }

    // ========== 语句 ==========

    private void lowerStmt(Statement stmt, MirBuilder builder) {
        if (stmt == null) return;
        if (stmt instanceof HirNode) {
            ((HirNode) stmt).accept(this, builder);
        } else if (stmt instanceof Block) {
            for (Statement s : ((Block) stmt).getStatements()) {
                lowerStmt(s, builder);
            }
        } else if (stmt instanceof ExpressionStmt) {
            lowerEffect(((ExpressionStmt) stmt).getExpression(), builder);
        } else if (stmt instanceof LetStmt) {
            lowerLet((LetStmt) stmt, builder);
        } else if (stmt instanceof IfStmt) {
            lowerIf((IfStmt) stmt, builder);
        } else if (stmt instanceof BreakStmt) {
            lowerBreakContinue(true, ((BreakStmt) stmt).getLabel(), stmt.getLocation(), builder);
        } else if (stmt instanceof ContinueStmt) {
            lowerBreakContinue(false, ((ContinueStmt) stmt).getLabel(), stmt.getLocation(), builder);
        } else if (stmt instanceof ReturnStmt) {
            lowerReturn((ReturnStmt) stmt, builder);
        } else {
            throw defect("unsupported statement " + stmt.getClass().getSimpleName(), stmt.getLocation());
        }
    }

    private void lowerLet(LetStmt stmt, MirBuilder builder) {
        int index = builder.newLocal(stmt.getName(), stmt.getType(), types.regimeOf(stmt.getType()),
                stmt.getLocation());
        localMap.put(stmt.getLocal(), index);
        if (stmt.hasInitializer()) {
            Rvalue value = lowerRvalue(stmt.getInitializer(), builder);
            builder.emitAssign(Place.local(index), value, stmt.getLocation());
        }
    }

    private void lowerReturn(ReturnStmt stmt, MirBuilder builder) {
        if (stmt.hasValue()) {
            Rvalue value = lowerRvalue(stmt.getValue(), builder);
            builder.emitAssign(Place.local(0), value, stmt.getLocation());
        }
        builder.emitReturn(stmt.getLocation());
    }

    /**
     * if → then, else, join blocks
     */
    private void lowerIf(IfStmt stmt, MirBuilder builder) {
        SourceLocation loc = stmt.getLocation();
        Operand cond = lowerOperand(stmt.getCondition(), builder);

        BasicBlock thenBlock = builder.newBlock();
        BasicBlock elseBlock = builder.newBlock();
        BasicBlock joinBlock = builder.newBlock();
        builder.emitBranch(cond, thenBlock.getId(), elseBlock.getId(), loc);

        builder.switchToBlock(thenBlock);
        lowerStmt(stmt.getThenBranch(), builder);
        if (!builder.isTerminated()) {
            builder.emitGoto(joinBlock.getId(), loc);
        }

        builder.switchToBlock(elseBlock);
        lowerStmt(stmt.getElseBranch(), builder);
        if (!builder.isTerminated()) {
            builder.emitGoto(joinBlock.getId(), loc);
        }

        builder.switchToBlock(joinBlock);
    }

    /**
     * while/for → header, body, [update,] exit blocks
     */
    @Override
    public Object visitLoop(HirLoop node, MirBuilder builder) {
        SourceLocation loc = node.getLocation();

        BasicBlock headerBlock = builder.newBlock();
        BasicBlock bodyBlock = builder.newBlock();
        BasicBlock updateBlock = node.hasUpdate() ? builder.newBlock() : null;
        BasicBlock exitBlock = builder.newBlock();
        int continueTarget = updateBlock != null ? updateBlock.getId() : headerBlock.getId();

        builder.emitGoto(headerBlock.getId(), loc);

        builder.switchToBlock(headerBlock);
        Operand cond = lowerOperand(node.getCondition(), builder);
        builder.emitBranch(cond, bodyBlock.getId(), exitBlock.getId(), loc);

        loopStack.push(new LoopContext(node.getLabel(), continueTarget, exitBlock.getId()));
        try {
            builder.switchToBlock(bodyBlock);
            lowerStmt(node.getBody(), builder);
            if (!builder.isTerminated()) {
                builder.emitGoto(continueTarget, loc);
            }
        } finally {
            loopStack.pop();
        }

        if (updateBlock != null) {
            builder.switchToBlock(updateBlock);
            lowerEffect(node.getUpdate(), builder);
            if (!builder.isTerminated()) {
                builder.emitGoto(headerBlock.getId(), loc);
            }
        }

        builder.switchToBlock(exitBlock);
        return null;
    }

    private void lowerBreakContinue(boolean isBreak, String label, SourceLocation location, MirBuilder builder) {
        LoopContext target = null;
        if (label != null) {
            // 标签跳转：查找匹配 label 的循环
            for (LoopContext ctx : loopStack) {
                if (label.equals(ctx.label)) {
                    target = ctx;
                    break;
                }
            }
        } else {
            // 无标签：最内层循环
            target = loopStack.peek();
        }
        if (target == null) {
            throw defect((isBreak ? "break" : "continue")
                    + (label != null ? " to unknown label " + label : " outside of a loop"), location);
        }
        builder.emitGoto(isBreak ? target.exitBlockId : target.continueBlockId, location);
    }

    // ========== 表达式 ==========

    /**
     * 只为副作用求值的表达式。丢弃结果的调用发射为 eval。
     */
    private void lowerEffect(Expression expr, MirBuilder builder) {
        if (expr instanceof CallExpr) {
            builder.emitEval(lowerCall((CallExpr) expr, builder), expr.getLocation());
        } else if (expr instanceof AssignExpr) {
            lowerAssign((AssignExpr) expr, builder);
        } else {
            lowerOperand(expr, builder);
        }
    }

    private void lowerAssign(AssignExpr expr, MirBuilder builder) {
        if (expr.isCompound()) {
            throw defect("compound assignment survived desugaring", expr.getLocation());
        }
        Place dest = lowerPlace(expr.getTarget(), builder);
        Place outer = assignTarget;
        assignTarget = dest;
        Rvalue value;
        try {
            value = lowerRvalue(expr.getValue(), builder);
        } finally {
            assignTarget = outer;
        }
        builder.emitAssign(dest, value, expr.getLocation());
    }

    private Rvalue lowerRvalue(Expression expr, MirBuilder builder) {
        if (expr instanceof Literal) {
            return Rvalue.use(constant((Literal) expr));
        }
        if (expr.isPlace()) {
            return Rvalue.use(Operand.copy(lowerPlace(expr, builder)));
        }
        if (expr instanceof MoveExpr) {
            return Rvalue.use(Operand.move(lowerPlace(((MoveExpr) expr).getOperand(), builder)));
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr u = (UnaryExpr) expr;
            return Rvalue.unary(UnaryOp.valueOf(u.getOperator().name()), lowerOperand(u.getOperand(), builder));
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr b = (BinaryExpr) expr;
            if (b.getOperator().isShortCircuit()) {
                return Rvalue.use(lowerShortCircuit(b, builder));
            }
            Operand left = lowerOperand(b.getLeft(), builder);
            Operand right = lowerOperand(b.getRight(), builder);
            return Rvalue.binary(BinaryOp.valueOf(b.getOperator().name()), left, right);
        }
        if (expr instanceof CallExpr) {
            return lowerCall((CallExpr) expr, builder);
        }
        if (expr instanceof StructLiteral) {
            List<Operand> fields = new ArrayList<>();
            for (Expression e : ((StructLiteral) expr).getFieldValues()) {
                fields.add(lowerOperand(e, builder));
            }
            return Rvalue.aggregate(expr.getType(), fields);
        }
        if (expr instanceof AssignExpr) {
            lowerAssign((AssignExpr) expr, builder);
            return Rvalue.use(Operand.constant(ConstValue.UNIT, types.unit()));
        }
        if (expr instanceof ConditionalExpr) {
            return Rvalue.use(lowerConditional((ConditionalExpr) expr, builder));
        }
        if (expr instanceof HirNode) {
            ((HirNode) expr).accept(this, builder);
        }
        throw defect("unsupported expression " + expr.getClass().getSimpleName(), expr.getLocation());
    }

    private Operand lowerOperand(Expression expr, MirBuilder builder) {
        if (expr instanceof Literal) {
            return constant((Literal) expr);
        }
        if (expr.isPlace()) {
            return Operand.copy(lowerPlace(expr, builder));
        }
        if (expr instanceof MoveExpr) {
            return Operand.move(lowerPlace(((MoveExpr) expr).getOperand(), builder));
        }
        if (expr instanceof BinaryExpr && ((BinaryExpr) expr).getOperator().isShortCircuit()) {
            return lowerShortCircuit((BinaryExpr) expr, builder);
        }
        if (expr instanceof ConditionalExpr) {
            return lowerConditional((ConditionalExpr) expr, builder);
        }
        Rvalue value = lowerRvalue(expr, builder);
        int temp = builder.emitTemp(value, expr.getType(), expr.getRegime(), expr.getLocation());
        return Operand.copy(Place.local(temp));
    }

    /**
     * 调用：先求值各实参，最后发射借用语句，使借用紧邻调用语句。
     */
    private Rvalue.Call lowerCall(CallExpr call, MirBuilder builder) {
        if (symbols.function(call.getFunction()) == null) {
            throw defect("unresolved function " + call.getFunction(), call.getLocation());
        }
        List<Operand> args = new ArrayList<>(call.getArgs().size());
        HirBorrow borrow = null;
        Place borrowed = null;
        int borrowIndex = -1;
        for (Expression arg : call.getArgs()) {
            if (arg instanceof HirBorrow) {
                if (borrow != null) {
                    throw defect("call takes more than one synthesized borrow", arg.getLocation());
                }
                borrow = (HirBorrow) arg;
                borrowed = lowerPlace(borrow.getPlace(), builder);
                borrowIndex = args.size();
                args.add(null);
            } else {
                args.add(lowerOperand(arg, builder));
            }
        }
        if (borrow != null) {
            int temp = builder.emitTemp(Rvalue.borrow(borrowed), borrow.getType(), Regime.BORROW,
                    borrow.getLocation());
            args.set(borrowIndex, Operand.move(Place.local(temp)));
        }
        return Rvalue.call(call.getFunction(), args);
    }

    /**
     * a && b / a || b：结果临时变量先写入短路常量，右操作数块覆盖它后跳到汇合块。
     */
    private Operand lowerShortCircuit(BinaryExpr expr, MirBuilder builder) {
        SourceLocation loc = expr.getLocation();
        boolean isAnd = expr.getOperator() == BinaryExpr.BinaryOp.AND;
        int result = builder.newTemp(expr.getType(), Regime.VALUE, loc);

        Operand left = lowerOperand(expr.getLeft(), builder);
        builder.emitAssign(Place.local(result),
                Rvalue.use(Operand.constant(ConstValue.ofBool(!isAnd), expr.getType())), loc);

        BasicBlock rhsBlock = builder.newBlock();
        BasicBlock joinBlock = builder.newBlock();
        if (isAnd) {
            builder.emitBranch(left, rhsBlock.getId(), joinBlock.getId(), loc);
        } else {
            builder.emitBranch(left, joinBlock.getId(), rhsBlock.getId(), loc);
        }

        builder.switchToBlock(rhsBlock);
        Operand right = lowerOperand(expr.getRight(), builder);
        builder.emitAssign(Place.local(result), Rvalue.use(right), loc);
        builder.emitGoto(joinBlock.getId(), loc);

        builder.switchToBlock(joinBlock);
        return Operand.copy(Place.local(result));
    }

    /**
     * c ? a : b → then, else, join blocks 共享结果临时变量
     */
    private Operand lowerConditional(ConditionalExpr expr, MirBuilder builder) {
        SourceLocation loc = expr.getLocation();
        int result = builder.newTemp(expr.getType(), expr.getRegime(), loc);
        Operand cond = lowerOperand(expr.getCondition(), builder);

        BasicBlock thenBlock = builder.newBlock();
        BasicBlock elseBlock = builder.newBlock();
        BasicBlock joinBlock = builder.newBlock();
        builder.emitBranch(cond, thenBlock.getId(), elseBlock.getId(), loc);

        builder.switchToBlock(thenBlock);
        builder.emitAssign(Place.local(result), lowerRvalue(expr.getThenExpr(), builder), loc);
        builder.emitGoto(joinBlock.getId(), loc);

        builder.switchToBlock(elseBlock);
        builder.emitAssign(Place.local(result), lowerRvalue(expr.getElseExpr(), builder), loc);
        builder.emitGoto(joinBlock.getId(), loc);

        builder.switchToBlock(joinBlock);
        return Operand.copy(Place.local(result));
    }

    // ========== Place ==========

    /**
     * 表达式 → place。非 place 表达式先写入临时变量。
     */
    private Place lowerPlace(Expression expr, MirBuilder builder) {
        SourceLocation loc = expr.getLocation();
        if (expr instanceof HirTargetRead) {
            return (Place) ((HirTargetRead) expr).accept(this, builder);
        }
        if (expr instanceof LocalRef) {
            LocalRef ref = (LocalRef) expr;
            Integer index = localMap.get(ref.getLocal());
            if (index == null) {
                throw defect("reference to undeclared local " + ref.getName() + " (" + ref.getLocal() + ")", loc);
            }
            return Place.local(index);
        }
        if (expr instanceof FieldAccess) {
            FieldAccess fa = (FieldAccess) expr;
            Expression target = fa.getTarget();
            Place base = autoDeref(lowerPlace(target, builder), target.getType(), loc, builder);
            TypeId structType = types.kindOf(target.getType()).isPointer()
                    ? types.pointee(target.getType()) : target.getType();
            if (types.kindOf(structType) != TypeKind.STRUCT
                    || types.fieldIndex(structType, fa.getField()) != fa.getFieldIndex()) {
                throw defect("field " + fa.getField() + " at index " + fa.getFieldIndex()
                        + " does not belong to " + types.display(structType), loc);
            }
            return base.field(fa.getFieldIndex());
        }
        if (expr instanceof DerefExpr) {
            Expression operand = ((DerefExpr) expr).getOperand();
            if (!types.kindOf(operand.getType()).isPointer()) {
                throw defect("deref of non-pointer type " + types.display(operand.getType()), loc);
            }
            return autoDeref(lowerPlace(operand, builder), operand.getType(), loc, builder);
        }
        if (expr instanceof IndexExpr) {
            IndexExpr ix = (IndexExpr) expr;
            Expression target = ix.getTarget();
            Place base = autoDeref(lowerPlace(target, builder), target.getType(), loc, builder);
            TypeId arrayType = types.kindOf(target.getType()).isPointer()
                    ? types.pointee(target.getType()) : target.getType();
            TypeDesc array = types.get(arrayType);
            if (array.getKind() != TypeKind.ARRAY) {
                throw defect("index of non-array type " + types.display(arrayType), loc);
            }
            Operand index = lowerOperand(ix.getIndex(), builder);
            int indexLocal = builder.emitTemp(Rvalue.use(index), ix.getIndex().getType(), Regime.VALUE,
                    ix.getIndex().getLocation());
            builder.emitBoundsCheck(Operand.copy(Place.local(indexLocal)), array.getLength(), loc);
            return base.index(indexLocal);
        }
        // 非 place：溢出到临时变量
        Rvalue value = lowerRvalue(expr, builder);
        return Place.local(builder.emitTemp(value, expr.getType(), expr.getRegime(), loc));
    }

    /**
     * 通过句柄或借用访问时插入显式解引用；句柄解引用前插入空检查。
     */
    private Place autoDeref(Place base, TypeId baseType, SourceLocation loc, MirBuilder builder) {
        TypeKind kind = types.kindOf(baseType);
        if (!kind.isPointer()) {
            return base;
        }
        if (kind.getRegime().isHandle()) {
            builder.emitNullCheck(Operand.copy(base), loc);
        }
        return base.deref();
    }

    private Operand constant(Literal literal) {
        Object v = literal.getValue();
        ConstValue value;
        switch (literal.getKind()) {
            case UNIT:
                value = ConstValue.UNIT;
                break;
            case BOOL:
                value = ConstValue.ofBool((Boolean) requireValue(literal));
                break;
            case I32:
                value = ConstValue.ofI32(((Number) requireValue(literal)).intValue());
                break;
            case I64:
                value = ConstValue.ofI64(((Number) requireValue(literal)).longValue());
                break;
            case F32:
                value = ConstValue.ofF32(((Number) requireValue(literal)).floatValue());
                break;
            case F64:
                value = ConstValue.ofF64(((Number) requireValue(literal)).doubleValue());
                break;
            case STRING:
                value = ConstValue.ofString(String.valueOf(requireValue(literal)));
                break;
            default:
                throw defect("unsupported literal kind " + literal.getKind(), literal.getLocation());
        }
        return Operand.constant(value, literal.getType());
    }

    private Object requireValue(Literal literal) {
        if (literal.getValue() == null) {
            throw defect(literal.getKind() + " literal without value", literal.getLocation());
        }
        return literal.getValue();
    }

    @Override
    public Object visitBorrow(HirBorrow node, MirBuilder builder) {
        throw defect("borrow used outside of a call argument", node.getLocation());
    }

    @Override
    public Object visitTargetRead(HirTargetRead node, MirBuilder builder) {
        if (assignTarget == null) {
            throw defect("assignment target read outside of an assignment", node.getLocation());
        }
        return assignTarget;
    }

    private CompilerDefectException defect(String message, SourceLocation loc) {
        return new CompilerDefectException(Stage.CFG_BUILD, function, message, loc);
    }
}
