package com.keellang.compiler.ast;

import com.keellang.compiler.ast.decl.FunDecl;
import com.keellang.compiler.ast.expr.*;
import com.keellang.compiler.ast.stmt.*;

/**
 * 已类型化 AST 的访问者接口
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface AstVisitor<R, C> {

    // ===== 声明 =====
    R visitFunDecl(FunDecl node, C context);

    // ===== 语句 =====
    R visitBlock(Block node, C context);
    R visitExpressionStmt(ExpressionStmt node, C context);
    R visitLetStmt(LetStmt node, C context);
    R visitIfStmt(IfStmt node, C context);
    R visitWhileStmt(WhileStmt node, C context);
    R visitForStmt(ForStmt node, C context);
    R visitBreakStmt(BreakStmt node, C context);
    R visitContinueStmt(ContinueStmt node, C context);
    R visitReturnStmt(ReturnStmt node, C context);

    // ===== 表达式 =====
    R visitLiteral(Literal node, C context);
    R visitLocalRef(LocalRef node, C context);
    R visitFieldAccess(FieldAccess node, C context);
    R visitDerefExpr(DerefExpr node, C context);
    R visitIndexExpr(IndexExpr node, C context);
    R visitUnaryExpr(UnaryExpr node, C context);
    R visitBinaryExpr(BinaryExpr node, C context);
    R visitCallExpr(CallExpr node, C context);
    R visitMethodCallExpr(MethodCallExpr node, C context);
    R visitStructLiteral(StructLiteral node, C context);
    R visitAssignExpr(AssignExpr node, C context);
    R visitStringInterpolation(StringInterpolation node, C context);
    R visitConditionalExpr(ConditionalExpr node, C context);
    R visitMoveExpr(MoveExpr node, C context);
}
