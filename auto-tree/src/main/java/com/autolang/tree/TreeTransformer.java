package com.autolang.tree;

import com.autolang.tree.expr.*;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 程序树恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 * <p>
 * 子类可覆盖：
 * <ul>
 *   <li>{@link #transformType} 统一改写节点携带的类型（单态化）</li>
 *   <li>{@link #transformInto} 把一条语句展开为多条（临时变量提升）</li>
 *   <li>任意 visit 方法</li>
 * </ul>
 */
public class TreeTransformer implements TreeVisitor<TreeNode, Void> {

    // ==================== 入口与辅助方法 ====================

    public Statement transformStmt(Statement stmt) {
        if (stmt == null) return null;
        return (Statement) stmt.accept(this, null);
    }

    public Block transformBlock(Block block) {
        if (block == null) return null;
        return (Block) block.accept(this, null);
    }

    public Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        return (Expression) expr.accept(this, null);
    }

    /**
     * 类型改写钩子，默认不变。
     */
    protected TypeRef transformType(TypeRef type) {
        return type;
    }

    protected List<TypeRef> transformTypes(List<TypeRef> types) {
        List<TypeRef> result = null;
        for (int i = 0; i < types.size(); i++) {
            TypeRef original = types.get(i);
            TypeRef transformed = transformType(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(types.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : types;
    }

    protected NamedType transformOwner(NamedType owner) {
        TypeRef transformed = transformType(owner);
        if (!(transformed instanceof NamedType)) {
            throw new IllegalStateException("Owner type rewritten to non-named type: " + transformed);
        }
        return (NamedType) transformed;
    }

    /**
     * 把一条语句的变换结果追加到 out。默认一对一，子类可在前面插入语句。
     */
    protected void transformInto(Statement stmt, List<Statement> out) {
        out.add(transformStmt(stmt));
    }

    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> result = new ArrayList<>(stmts.size());
        boolean changed = false;
        for (Statement stmt : stmts) {
            int before = result.size();
            transformInto(stmt, result);
            if (result.size() != before + 1 || result.get(before) != stmt) changed = true;
        }
        return changed ? result : stmts;
    }

    protected List<Expression> transformExprs(List<Expression> exprs) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transformExpr(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : exprs;
    }

    protected MatchArm transformArm(MatchArm arm) {
        Block body = transformBlock(arm.getBody());
        if (body == arm.getBody()) return arm;
        return new MatchArm(arm.getLocation(), arm.getPattern(), body);
    }

    // ==================== 语句 ====================

    @Override
    public TreeNode visitBlock(Block node, Void context) {
        List<Statement> stmts = transformStmts(node.getStatements());
        if (stmts == node.getStatements()) return node;
        return new Block(node.getLocation(), stmts);
    }

    @Override
    public TreeNode visitLet(LetStmt node, Void context) {
        TypeRef declared = node.getDeclaredType() != null ? transformType(node.getDeclaredType()) : null;
        Expression init = transformExpr(node.getInitializer());
        if (declared == node.getDeclaredType() && init == node.getInitializer()) return node;
        return new LetStmt(node.getLocation(), node.getName(), declared, node.isMutable(), init);
    }

    @Override
    public TreeNode visitExprStmt(ExprStmt node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) return node;
        return new ExprStmt(node.getLocation(), expr);
    }

    @Override
    public TreeNode visitReturn(ReturnStmt node, Void context) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) return node;
        return new ReturnStmt(node.getLocation(), value);
    }

    @Override
    public TreeNode visitIf(IfStmt node, Void context) {
        Expression cond = transformExpr(node.getCondition());
        Block then = transformBlock(node.getThenBranch());
        Statement els = transformStmt(node.getElseBranch());
        if (cond == node.getCondition() && then == node.getThenBranch()
                && els == node.getElseBranch()) return node;
        return new IfStmt(node.getLocation(), cond, then, els);
    }

    @Override
    public TreeNode visitWhile(WhileStmt node, Void context) {
        Expression cond = transformExpr(node.getCondition());
        Block body = transformBlock(node.getBody());
        if (cond == node.getCondition() && body == node.getBody()) return node;
        return new WhileStmt(node.getLocation(), cond, body);
    }

    @Override
    public TreeNode visitLoop(LoopStmt node, Void context) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return new LoopStmt(node.getLocation(), body);
    }

    @Override
    public TreeNode visitForRange(ForRangeStmt node, Void context) {
        Expression from = transformExpr(node.getFrom());
        Expression to = transformExpr(node.getTo());
        Block body = transformBlock(node.getBody());
        if (from == node.getFrom() && to == node.getTo() && body == node.getBody()) return node;
        return new ForRangeStmt(node.getLocation(), node.getVariable(), from, to, node.isInclusive(), body);
    }

    @Override
    public TreeNode visitBreak(BreakStmt node, Void context) {
        return node;
    }

    @Override
    public TreeNode visitContinue(ContinueStmt node, Void context) {
        return node;
    }

    @Override
    public TreeNode visitMatch(MatchStmt node, Void context) {
        Expression target = transformExpr(node.getTarget());
        List<MatchArm> arms = new ArrayList<>(node.getArms().size());
        boolean changed = target != node.getTarget();
        for (MatchArm arm : node.getArms()) {
            MatchArm transformed = transformArm(arm);
            if (transformed != arm) changed = true;
            arms.add(transformed);
        }
        if (!changed) return node;
        return new MatchStmt(node.getLocation(), target, arms);
    }

    @Override
    public TreeNode visitLowLevelBlock(LowLevelBlock node, Void context) {
        Block body = transformBlock(node.getBody());
        if (body == node.getBody()) return node;
        return new LowLevelBlock(node.getLocation(), body);
    }

    // ==================== 表达式 ====================

    @Override
    public TreeNode visitLiteral(Literal node, Void context) {
        TypeRef type = transformType(node.getType());
        if (type == node.getType()) return node;
        return new Literal(node.getLocation(), type, node.getKind(), node.getText());
    }

    @Override
    public TreeNode visitIdentifier(Identifier node, Void context) {
        TypeRef type = transformType(node.getType());
        if (type == node.getType()) return node;
        return new Identifier(node.getLocation(), type, node.getName());
    }

    @Override
    public TreeNode visitSelf(SelfExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        if (type == node.getType()) return node;
        return new SelfExpr(node.getLocation(), type);
    }

    @Override
    public TreeNode visitSelfField(SelfFieldExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        if (type == node.getType()) return node;
        return new SelfFieldExpr(node.getLocation(), type, node.getField());
    }

    @Override
    public TreeNode visitFieldAccess(FieldAccess node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression target = transformExpr(node.getTarget());
        if (type == node.getType() && target == node.getTarget()) return node;
        return new FieldAccess(node.getLocation(), type, target, node.getField());
    }

    @Override
    public TreeNode visitBinary(BinaryExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression left = transformExpr(node.getLeft());
        Expression right = transformExpr(node.getRight());
        if (type == node.getType() && left == node.getLeft() && right == node.getRight()) return node;
        return new BinaryExpr(node.getLocation(), type, node.getOperator(), left, right);
    }

    @Override
    public TreeNode visitUnary(UnaryExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression operand = transformExpr(node.getOperand());
        if (type == node.getType() && operand == node.getOperand()) return node;
        return new UnaryExpr(node.getLocation(), type, node.getOperator(), operand);
    }

    @Override
    public TreeNode visitAssign(AssignExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression target = transformExpr(node.getTarget());
        Expression value = transformExpr(node.getValue());
        if (type == node.getType() && target == node.getTarget() && value == node.getValue()) return node;
        return new AssignExpr(node.getLocation(), type, node.getOperator(), target, value);
    }

    @Override
    public TreeNode visitCall(CallExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        List<TypeRef> typeArgs = transformTypes(node.getTypeArgs());
        List<Expression> args = transformExprs(node.getArgs());
        if (type == node.getType() && typeArgs == node.getTypeArgs() && args == node.getArgs()) return node;
        return new CallExpr(node.getLocation(), type, node.getCallee(), typeArgs, args);
    }

    @Override
    public TreeNode visitMethodCall(MethodCallExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        NamedType owner = transformOwner(node.getOwner());
        Expression receiver = transformExpr(node.getReceiver());
        List<Expression> args = transformExprs(node.getArgs());
        if (type == node.getType() && owner == node.getOwner()
                && receiver == node.getReceiver() && args == node.getArgs()) return node;
        return new MethodCallExpr(node.getLocation(), type, owner, node.getMethod(), receiver, args);
    }

    @Override
    public TreeNode visitVariantInit(VariantInit node, Void context) {
        TypeRef type = transformType(node.getType());
        List<Expression> args = transformExprs(node.getArgs());
        if (type == node.getType() && args == node.getArgs()) return node;
        return new VariantInit(node.getLocation(), type, node.getVariant(), args);
    }

    @Override
    public TreeNode visitStructInit(StructInit node, Void context) {
        TypeRef type = transformType(node.getType());
        Map<String, Expression> fields = new LinkedHashMap<>();
        boolean changed = type != node.getType();
        for (Map.Entry<String, Expression> e : node.getFields().entrySet()) {
            Expression value = transformExpr(e.getValue());
            if (value != e.getValue()) changed = true;
            fields.put(e.getKey(), value);
        }
        if (!changed) return node;
        return new StructInit(node.getLocation(), type, fields);
    }

    @Override
    public TreeNode visitAddressOf(AddressOf node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression operand = transformExpr(node.getOperand());
        if (type == node.getType() && operand == node.getOperand()) return node;
        return new AddressOf(node.getLocation(), type, operand);
    }

    @Override
    public TreeNode visitIndex(IndexExpr node, Void context) {
        TypeRef type = transformType(node.getType());
        Expression target = transformExpr(node.getTarget());
        Expression index = transformExpr(node.getIndex());
        if (type == node.getType() && target == node.getTarget() && index == node.getIndex()) return node;
        return new IndexExpr(node.getLocation(), type, target, index);
    }
}
