package com.autolang.tree;

import com.autolang.tree.expr.*;
import com.autolang.tree.stmt.*;

/**
 * 程序树访问者接口。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface TreeVisitor<R, C> {

    // ===== 语句 (12) =====
    R visitBlock(Block node, C context);
    R visitLet(LetStmt node, C context);
    R visitExprStmt(ExprStmt node, C context);
    R visitReturn(ReturnStmt node, C context);
    R visitIf(IfStmt node, C context);
    R visitWhile(WhileStmt node, C context);
    R visitLoop(LoopStmt node, C context);
    R visitForRange(ForRangeStmt node, C context);
    R visitBreak(BreakStmt node, C context);
    R visitContinue(ContinueStmt node, C context);
    R visitMatch(MatchStmt node, C context);
    R visitLowLevelBlock(LowLevelBlock node, C context);

    // ===== 表达式 (14) =====
    R visitLiteral(Literal node, C context);
    R visitIdentifier(Identifier node, C context);
    R visitSelf(SelfExpr node, C context);
    R visitSelfField(SelfFieldExpr node, C context);
    R visitFieldAccess(FieldAccess node, C context);
    R visitBinary(BinaryExpr node, C context);
    R visitUnary(UnaryExpr node, C context);
    R visitAssign(AssignExpr node, C context);
    R visitCall(CallExpr node, C context);
    R visitMethodCall(MethodCallExpr node, C context);
    R visitVariantInit(VariantInit node, C context);
    R visitStructInit(StructInit node, C context);
    R visitAddressOf(AddressOf node, C context);
    R visitIndex(IndexExpr node, C context);
}
