package com.keellang.ir.lowering;

import com.keellang.compiler.ast.AstNode;
import com.keellang.compiler.ast.AstVisitor;
import com.keellang.compiler.ast.SourceLocation;
import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.decl.Parameter;
import com.keellang.compiler.ast.expr.*;
import com.keellang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.keellang.compiler.ast.stmt.*;
import com.keellang.compiler.symbols.FnSignature;
import com.keellang.compiler.symbols.Intrinsic;
import com.keellang.compiler.types.FnId;
import com.keellang.compiler.types.Regime;
import com.keellang.compiler.types.TypeId;
import com.keellang.compiler.types.TypeKind;
import com.keellang.compiler.types.TypeTable;
import com.keellang.ir.hir.decl.HirFunction;
import com.keellang.ir.hir.expr.HirBorrow;
import com.keellang.ir.hir.expr.HirTargetRead;
import com.keellang.ir.hir.stmt.HirLoop;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已类型化 AST → HIR 降级（脱糖）。
 * <p>
 * 方法调用改写为普通调用并显式插入接收者借用；复合赋值、for 循环、
 * 字符串插值改写为基本形式。同时校验上游的类型/制式标注，缺失即视为编译器缺陷。
 * 输出节点保留原节点的源码位置。
 */
public class AstToHirLowering implements AstVisitor<AstNode, LoweringContext> {

    // ========== 公共入口 ==========

    /**
     * 将一个函数声明降级为 HIR 函数。
     */
    public HirFunction lower(FunDecl fn, LoweringContext ctx) {
        return (HirFunction) fn.accept(this, ctx);
    }

    // ========== 辅助方法 ==========

    private Expression lowerExpr(Expression expr, LoweringContext ctx) {
        if (expr == null) return null;
        ctx.enter(expr.getLocation());
        try {
            checkAnnotations(expr, ctx);
            AstNode lowered = expr.accept(this, ctx);
            if (!(lowered instanceof Expression)) {
                throw ctx.defect("unsupported expression " + expr.getClass().getSimpleName(), expr.getLocation());
            }
            return (Expression) lowered;
        } finally {
            ctx.exit();
        }
    }

    private Statement lowerStmt(Statement stmt, LoweringContext ctx) {
        if (stmt == null) return null;
        ctx.enter(stmt.getLocation());
        try {
            AstNode lowered = stmt.accept(this, ctx);
            if (!(lowered instanceof Statement)) {
                throw ctx.defect("unsupported statement " + stmt.getClass().getSimpleName(), stmt.getLocation());
            }
            return (Statement) lowered;
        } finally {
            ctx.exit();
        }
    }

    private List<Expression> lowerExprs(List<? extends Expression> exprs, LoweringContext ctx) {
        if (exprs == null || exprs.isEmpty()) return Collections.emptyList();
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression e : exprs) result.add(lowerExpr(e, ctx));
        return result;
    }

    private List<Statement> lowerStmts(List<? extends Statement> stmts, LoweringContext ctx) {
        if (stmts == null || stmts.isEmpty()) return Collections.emptyList();
        List<Statement> result = new ArrayList<>(stmts.size());
        for (Statement s : stmts) result.add(lowerStmt(s, ctx));
        return result;
    }

    /**
     * 每个表达式必须携带已驻留的类型，且制式与类型表一致。
     */
    private void checkAnnotations(Expression expr, LoweringContext ctx) {
        TypeId type = expr.getType();
        Regime regime = expr.getRegime();
        if (type == null || regime == null) {
            throw ctx.defect(expr.getClass().getSimpleName() + " lacks type/regime annotation", expr.getLocation());
        }
        if (!ctx.getTypes().contains(type)) {
            throw ctx.defect("unknown type id " + type, expr.getLocation());
        }
        Regime expected = ctx.getTypes().regimeOf(type);
        if (expected != regime) {
            throw ctx.defect("regime " + regime + " disagrees with type " + ctx.getTypes().display(type)
                    + " (" + expected + ")", expr.getLocation());
        }
    }

    private void checkType(TypeId type, SourceLocation loc, LoweringContext ctx) {
        if (type == null || !ctx.getTypes().contains(type)) {
            throw ctx.defect("missing or unknown type id " + type, loc);
        }
    }

    private FnSignature resolve(FnId fn, SourceLocation loc, LoweringContext ctx) {
        if (fn == null) throw ctx.defect("call lacks function id", loc);
        FnSignature sig = ctx.getSymbols().function(fn);
        if (sig == null) throw ctx.defect("unresolved function " + fn, loc);
        return sig;
    }

    private Expression requirePlace(Expression expr, String what, LoweringContext ctx) {
        if (!expr.isPlace()) {
            throw ctx.defect(what + " is not a place expression", expr.getLocation());
        }
        return expr;
    }

    // ========== 声明 ==========

    @Override
    public AstNode visitFunDecl(FunDecl node, LoweringContext ctx) {
        if (node.getId() == null) throw ctx.defect("function lacks id", node.getLocation());
        checkType(node.getReturnType(), node.getLocation(), ctx);
        for (Parameter p : node.getParams()) {
            if (p.getLocal() == null) throw ctx.defect("parameter " + p.getName() + " lacks local id", p.getLocation());
            checkType(p.getType(), p.getLocation(), ctx);
        }
        Block body = (Block) lowerStmt(node.getBody(), ctx);
        return new HirFunction(node.getLocation(), node.getId(), node.getName(), node.getParams(),
                node.getReturnType(), body);
    }

    // ========== 语句 ==========

    @Override
    public AstNode visitBlock(Block node, LoweringContext ctx) {
        return new Block(node.getLocation(), lowerStmts(node.getStatements(), ctx));
    }

    @Override
    public AstNode visitExpressionStmt(ExpressionStmt node, LoweringContext ctx) {
        return new ExpressionStmt(node.getLocation(), lowerExpr(node.getExpression(), ctx));
    }

    @Override
    public AstNode visitLetStmt(LetStmt node, LoweringContext ctx) {
        if (node.getLocal() == null) throw ctx.defect("let " + node.getName() + " lacks local id", node.getLocation());
        checkType(node.getType(), node.getLocation(), ctx);
        return new LetStmt(node.getLocation(), node.getLocal(), node.getName(), node.getType(),
                lowerExpr(node.getInitializer(), ctx));
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, LoweringContext ctx) {
        return new IfStmt(node.getLocation(),
                lowerExpr(node.getCondition(), ctx),
                lowerStmt(node.getThenBranch(), ctx),
                lowerStmt(node.getElseBranch(), ctx));
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, LoweringContext ctx) {
        return new HirLoop(node.getLocation(), node.getLabel(),
                lowerExpr(node.getCondition(), ctx),
                lowerStmt(node.getBody(), ctx), null);
    }

    /**
     * 脱糖：for (init; cond; update) body → { init; loop(cond) { body } update }
     */
    @Override
    public AstNode visitForStmt(ForStmt node, LoweringContext ctx) {
        SourceLocation loc = node.getLocation();
        List<Statement> stmts = new ArrayList<>(2);
        if (node.getInitializer() != null) {
            stmts.add(lowerStmt(node.getInitializer(), ctx));
        }
        Expression condition = node.getCondition() != null
                ? lowerExpr(node.getCondition(), ctx)
                : ctx.boolLiteral(loc, true);
        stmts.add(new HirLoop(loc, node.getLabel(), condition,
                lowerStmt(node.getBody(), ctx),
                lowerExpr(node.getUpdate(), ctx)));
        return new Block(loc, stmts);
    }

    @Override
    public AstNode visitBreakStmt(BreakStmt node, LoweringContext ctx) {
        return node;
    }

    @Override
    public AstNode visitContinueStmt(ContinueStmt node, LoweringContext ctx) {
        return node;
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, LoweringContext ctx) {
        return new ReturnStmt(node.getLocation(), lowerExpr(node.getValue(), ctx));
    }

    // ========== 表达式 ==========

    @Override
    public AstNode visitLiteral(Literal node, LoweringContext ctx) {
        return node;
    }

    @Override
    public AstNode visitLocalRef(LocalRef node, LoweringContext ctx) {
        if (node.getLocal() == null) throw ctx.defect("reference to " + node.getName() + " lacks local id", node.getLocation());
        return node;
    }

    @Override
    public AstNode visitFieldAccess(FieldAccess node, LoweringContext ctx) {
        if (node.getField() == null) throw ctx.defect("field access lacks field id", node.getLocation());
        return new FieldAccess(node.getLocation(), node.getType(), node.getRegime(),
                lowerExpr(node.getTarget(), ctx), node.getField(), node.getFieldIndex());
    }

    @Override
    public AstNode visitDerefExpr(DerefExpr node, LoweringContext ctx) {
        return new DerefExpr(node.getLocation(), node.getType(), node.getRegime(),
                lowerExpr(node.getOperand(), ctx));
    }

    @Override
    public AstNode visitIndexExpr(IndexExpr node, LoweringContext ctx) {
        return new IndexExpr(node.getLocation(), node.getType(), node.getRegime(),
                lowerExpr(node.getTarget(), ctx), lowerExpr(node.getIndex(), ctx));
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, LoweringContext ctx) {
        return new UnaryExpr(node.getLocation(), node.getType(), node.getRegime(),
                node.getOperator(), lowerExpr(node.getOperand(), ctx));
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, LoweringContext ctx) {
        return new BinaryExpr(node.getLocation(), node.getType(), node.getRegime(),
                lowerExpr(node.getLeft(), ctx), node.getOperator(), lowerExpr(node.getRight(), ctx));
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, LoweringContext ctx) {
        resolve(node.getFunction(), node.getLocation(), ctx);
        return new CallExpr(node.getLocation(), node.getType(), node.getRegime(),
                node.getFunction(), lowerExprs(node.getArgs(), ctx));
    }

    /**
     * 脱糖：recv.m(args) → m(&place, args)
     * <ul>
     *   <li>值接收者：借用接收者自身的 place</li>
     *   <li>手动/GC 句柄接收者：借用解引用后的 place *recv</li>
     * </ul>
     */
    @Override
    public AstNode visitMethodCallExpr(MethodCallExpr node, LoweringContext ctx) {
        SourceLocation loc = node.getLocation();
        FnSignature sig = resolve(node.getMethod(), loc, ctx);
        TypeTable types = ctx.getTypes();
        if (sig.getParamTypes().isEmpty() || types.kindOf(sig.getParamTypes().get(0)) != TypeKind.BORROW) {
            throw ctx.defect("method " + sig.getName() + " has no borrowed self parameter", loc);
        }
        TypeId borrowType = sig.getParamTypes().get(0);

        Expression receiver = lowerExpr(node.getReceiver(), ctx);
        Expression place;
        switch (receiver.getRegime()) {
            case VALUE:
                place = receiver;
                break;
            case MANUAL_HANDLE:
            case GC_HANDLE: {
                if (!types.kindOf(receiver.getType()).isPointer()) {
                    throw ctx.defect("handle receiver of " + node.getMethodName() + " cannot be dereferenced",
                            receiver.getLocation());
                }
                TypeId pointee = types.pointee(receiver.getType());
                place = new DerefExpr(receiver.getLocation(), pointee, types.regimeOf(pointee), receiver);
                break;
            }
            default:
                throw ctx.defect("receiver of " + node.getMethodName() + " has regime " + receiver.getRegime(),
                        receiver.getLocation());
        }
        if (!types.pointee(borrowType).equals(place.getType())) {
            throw ctx.defect("receiver type " + types.display(place.getType()) + " does not match self parameter "
                    + types.display(borrowType), receiver.getLocation());
        }

        List<Expression> args = new ArrayList<>(node.getArgs().size() + 1);
        args.add(new HirBorrow(receiver.getLocation(), borrowType, place));
        args.addAll(lowerExprs(node.getArgs(), ctx));
        return new CallExpr(loc, node.getType(), node.getRegime(), node.getMethod(), args);
    }

    @Override
    public AstNode visitStructLiteral(StructLiteral node, LoweringContext ctx) {
        return new StructLiteral(node.getLocation(), node.getType(), node.getRegime(),
                lowerExprs(node.getFieldValues(), ctx));
    }

    /**
     * 脱糖：复合赋值 x += 1 → x = x + 1，右侧的 x 复用左侧已求值的 place
     */
    @Override
    public AstNode visitAssignExpr(AssignExpr node, LoweringContext ctx) {
        Expression target = requirePlace(lowerExpr(node.getTarget(), ctx), "assignment target", ctx);
        Expression value = lowerExpr(node.getValue(), ctx);

        if (node.getOperator() == AssignExpr.AssignOp.ASSIGN) {
            return new AssignExpr(node.getLocation(), node.getType(), node.getRegime(),
                    target, AssignExpr.AssignOp.ASSIGN, value);
        }

        // 复合赋值 → 简单赋值
        BinaryOp binOp;
        switch (node.getOperator()) {
            case ADD_ASSIGN: binOp = BinaryOp.ADD; break;
            case SUB_ASSIGN: binOp = BinaryOp.SUB; break;
            case MUL_ASSIGN: binOp = BinaryOp.MUL; break;
            case DIV_ASSIGN: binOp = BinaryOp.DIV; break;
            case MOD_ASSIGN: binOp = BinaryOp.MOD; break;
            case AND_ASSIGN: binOp = BinaryOp.BAND; break;
            case OR_ASSIGN:  binOp = BinaryOp.BOR;  break;
            case XOR_ASSIGN: binOp = BinaryOp.BXOR; break;
            case SHL_ASSIGN: binOp = BinaryOp.SHL; break;
            case SHR_ASSIGN: binOp = BinaryOp.SHR; break;
            default:
                throw ctx.defect("unhandled compound assign operator " + node.getOperator(), node.getLocation());
        }
        Expression expanded = new BinaryExpr(node.getLocation(), target.getType(), target.getRegime(),
                new HirTargetRead(target), binOp, value);
        return new AssignExpr(node.getLocation(), node.getType(), node.getRegime(),
                target, AssignExpr.AssignOp.ASSIGN, expanded);
    }

    /**
     * 脱糖：字符串插值 "a${x}b" → concat(concat("a", toString(x)), "b")
     */
    @Override
    public AstNode visitStringInterpolation(StringInterpolation node, LoweringContext ctx) {
        SourceLocation loc = node.getLocation();
        List<StringInterpolation.StringPart> parts = node.getParts();
        if (parts.isEmpty()) {
            return ctx.stringLiteral(loc, "");
        }
        FnSignature concat = intrinsic(Intrinsic.STRING_CONCAT, loc, ctx);
        TypeId stringType = ctx.getTypes().string();

        Expression result = null;
        for (StringInterpolation.StringPart part : parts) {
            Expression partExpr;
            if (part instanceof StringInterpolation.LiteralPart) {
                partExpr = ctx.stringLiteral(part.getLocation(),
                        ((StringInterpolation.LiteralPart) part).getValue());
            } else {
                Expression expr = lowerExpr(((StringInterpolation.ExprPart) part).getExpression(), ctx);
                if (ctx.getTypes().kindOf(expr.getType()) != TypeKind.STRING) {
                    FnSignature toString = intrinsic(Intrinsic.TO_STRING, part.getLocation(), ctx);
                    expr = new CallExpr(part.getLocation(), stringType, Regime.GC_HANDLE,
                            toString.getId(), Collections.singletonList(expr));
                }
                partExpr = expr;
            }
            if (result == null) {
                result = partExpr;
            } else {
                List<Expression> args = new ArrayList<>(2);
                args.add(result);
                args.add(partExpr);
                result = new CallExpr(loc, stringType, Regime.GC_HANDLE, concat.getId(), args);
            }
        }
        return result;
    }

    private FnSignature intrinsic(Intrinsic kind, SourceLocation loc, LoweringContext ctx) {
        FnSignature sig = ctx.getSymbols().intrinsic(kind);
        if (sig == null) throw ctx.defect("no function declared for intrinsic " + kind, loc);
        return sig;
    }

    @Override
    public AstNode visitConditionalExpr(ConditionalExpr node, LoweringContext ctx) {
        return new ConditionalExpr(node.getLocation(), node.getType(), node.getRegime(),
                lowerExpr(node.getCondition(), ctx),
                lowerExpr(node.getThenExpr(), ctx),
                lowerExpr(node.getElseExpr(), ctx));
    }

    @Override
    public AstNode visitMoveExpr(MoveExpr node, LoweringContext ctx) {
        Expression operand = requirePlace(lowerExpr(node.getOperand(), ctx), "move operand", ctx);
        return new MoveExpr(node.getLocation(), node.getType(), node.getRegime(), operand);
    }
}
