package com.autolang.tree;

import com.autolang.tree.expr.*;
import com.autolang.tree.stmt.*;

/**
 * 只读遍历基类：按源码顺序递归访问所有子节点，不产生结果。
 * 检查类 pass 覆盖关心的 visit 方法，需要继续下探时调用 super。
 */
public class TreeScanner<C> implements TreeVisitor<Void, C> {

    public void scan(TreeNode node, C context) {
        if (node != null) node.accept(this, context);
    }

    // ==================== 语句 ====================

    @Override
    public Void visitBlock(Block node, C context) {
        for (Statement stmt : node.getStatements()) {
            scan(stmt, context);
        }
        return null;
    }

    @Override
    public Void visitLet(LetStmt node, C context) {
        scan(node.getInitializer(), context);
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node, C context) {
        scan(node.getExpression(), context);
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt node, C context) {
        scan(node.getValue(), context);
        return null;
    }

    @Override
    public Void visitIf(IfStmt node, C context) {
        scan(node.getCondition(), context);
        scan(node.getThenBranch(), context);
        scan(node.getElseBranch(), context);
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt node, C context) {
        scan(node.getCondition(), context);
        scan(node.getBody(), context);
        return null;
    }

    @Override
    public Void visitLoop(LoopStmt node, C context) {
        scan(node.getBody(), context);
        return null;
    }

    @Override
    public Void visitForRange(ForRangeStmt node, C context) {
        scan(node.getFrom(), context);
        scan(node.getTo(), context);
        scan(node.getBody(), context);
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, C context) {
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt node, C context) {
        return null;
    }

    @Override
    public Void visitMatch(MatchStmt node, C context) {
        scan(node.getTarget(), context);
        for (MatchArm arm : node.getArms()) {
            scan(arm.getBody(), context);
        }
        return null;
    }

    @Override
    public Void visitLowLevelBlock(LowLevelBlock node, C context) {
        scan(node.getBody(), context);
        return null;
    }

    // ==================== 表达式 ====================

    @Override
    public Void visitLiteral(Literal node, C context) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, C context) {
        return null;
    }

    @Override
    public Void visitSelf(SelfExpr node, C context) {
        return null;
    }

    @Override
    public Void visitSelfField(SelfFieldExpr node, C context) {
        return null;
    }

    @Override
    public Void visitFieldAccess(FieldAccess node, C context) {
        scan(node.getTarget(), context);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr node, C context) {
        scan(node.getLeft(), context);
        scan(node.getRight(), context);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr node, C context) {
        scan(node.getOperand(), context);
        return null;
    }

    @Override
    public Void visitAssign(AssignExpr node, C context) {
        scan(node.getTarget(), context);
        scan(node.getValue(), context);
        return null;
    }

    @Override
    public Void visitCall(CallExpr node, C context) {
        for (Expression arg : node.getArgs()) {
            scan(arg, context);
        }
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCallExpr node, C context) {
        scan(node.getReceiver(), context);
        for (Expression arg : node.getArgs()) {
            scan(arg, context);
        }
        return null;
    }

    @Override
    public Void visitVariantInit(VariantInit node, C context) {
        for (Expression arg : node.getArgs()) {
            scan(arg, context);
        }
        return null;
    }

    @Override
    public Void visitStructInit(StructInit node, C context) {
        for (Expression value : node.getFields().values()) {
            scan(value, context);
        }
        return null;
    }

    @Override
    public Void visitAddressOf(AddressOf node, C context) {
        scan(node.getOperand(), context);
        return null;
    }

    @Override
    public Void visitIndex(IndexExpr node, C context) {
        scan(node.getTarget(), context);
        scan(node.getIndex(), context);
        return null;
    }
}
