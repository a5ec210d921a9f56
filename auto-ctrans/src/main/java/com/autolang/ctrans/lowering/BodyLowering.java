package com.autolang.ctrans.lowering;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.ownership.ParamBinding;
import com.autolang.ctrans.ownership.SignatureBindings;
import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeNode;
import com.autolang.tree.TreeTransformer;
import com.autolang.tree.expr.*;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.PrimitiveType;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 函数体降级。
 * <ul>
 *   <li>字段简写 {@code .x} 改写为 {@code self.x}</li>
 *   <li>按引用传递的非位置实参、非位置接收者、非位置 match 目标提升为 {@code _tmpN} 局部变量</li>
 *   <li>条件需要提升的 while 改写为 {@code loop { 提升; if (!cond) break; body }}</li>
 * </ul>
 * 右操作数需要提升的 {@code &&}/{@code ||} 展开为显式分支，保留短路求值。
 */
public class BodyLowering extends TreeTransformer {
    private final CompilationContext ctx;
    private final LoweringContext lowering;
    private final TypeRef selfType;
    private final Deque<List<Statement>> hoists = new ArrayDeque<>();

    public BodyLowering(CompilationContext ctx, LoweringContext lowering, TypeRef selfType) {
        this.ctx = ctx;
        this.lowering = lowering;
        this.selfType = selfType;
    }

    // ==================== 临时值提升 ====================

    @Override
    protected void transformInto(Statement stmt, List<Statement> out) {
        hoists.push(new ArrayList<Statement>());
        Statement result;
        List<Statement> pending;
        try {
            result = transformStmt(stmt);
        } finally {
            pending = hoists.pop();
        }
        out.addAll(pending);
        out.add(result);
    }

    /**
     * 在当前语句之前引入临时变量，返回对它的引用。
     */
    private Expression hoist(Expression value) {
        if (hoists.isEmpty()) {
            throw new IllegalStateException("No statement to hoist into at " + value.getLocation());
        }
        TypeRef type = value.getType();
        if (type == null || type.isVoid()) {
            throw new IllegalStateException("Cannot hoist a value without a type at " + value.getLocation());
        }
        String name = lowering.freshTemp();
        hoists.peek().add(lowering.makeTemp(value.getLocation(), name, type, value));
        return lowering.tempRef(value.getLocation(), name, type);
    }

    private List<Expression> hoistArgs(List<Expression> args, SignatureBindings bindings) {
        if (bindings == null) return args;
        List<Expression> result = null;
        for (int i = 0; i < args.size(); i++) {
            Expression arg = args.get(i);
            ParamBinding param = bindings.getParam(i);
            Expression lowered = arg;
            if (param != null && param.isIndirect() && !Places.isPlace(arg)) {
                lowered = hoist(arg);
            }
            if (lowered != arg && result == null) {
                result = new ArrayList<>(args.subList(0, i));
            }
            if (result != null) result.add(lowered);
        }
        return result != null ? result : args;
    }

    // ==================== 表达式 ====================

    @Override
    public TreeNode visitSelfField(SelfFieldExpr node, Void context) {
        if (selfType == null) {
            throw new IllegalStateException("Field shorthand ." + node.getField()
                    + " outside of an instance method at " + node.getLocation());
        }
        return new FieldAccess(node.getLocation(), node.getType(),
                new SelfExpr(node.getLocation(), selfType), node.getField());
    }

    /**
     * {@code a && f(g())} 中 g() 的提升不能越过短路，展开为
     * {@code bool _tmpN = a; if (_tmpN) { 提升; _tmpN = f(...); }}，{@code ||} 对称。
     */
    @Override
    public TreeNode visitBinary(BinaryExpr node, Void context) {
        BinaryExpr.Operator op = node.getOperator();
        if (op != BinaryExpr.Operator.AND && op != BinaryExpr.Operator.OR) {
            return super.visitBinary(node, context);
        }
        Expression left = transformExpr(node.getLeft());
        hoists.push(new ArrayList<Statement>());
        Expression right;
        List<Statement> pending;
        try {
            right = transformExpr(node.getRight());
        } finally {
            pending = hoists.pop();
        }
        if (pending.isEmpty()) {
            if (left == node.getLeft() && right == node.getRight()) return node;
            return new BinaryExpr(node.getLocation(), node.getType(), op, left, right);
        }
        if (hoists.isEmpty()) {
            throw new IllegalStateException("No statement to hoist into at " + node.getLocation());
        }
        SourceLocation loc = node.getLocation();
        String name = lowering.freshTemp();
        Identifier result = lowering.tempRef(loc, name, PrimitiveType.BOOL);
        List<Statement> branch = new ArrayList<>(pending);
        branch.add(new ExprStmt(loc, new AssignExpr(loc, PrimitiveType.BOOL, AssignExpr.Operator.ASSIGN,
                result, right)));
        Expression test = op == BinaryExpr.Operator.AND ? result : lowering.not(result);
        List<Statement> out = hoists.peek();
        out.add(lowering.makeTemp(loc, name, PrimitiveType.BOOL, left));
        out.add(new IfStmt(loc, test, new Block(loc, branch), null));
        return result;
    }

    @Override
    public TreeNode visitCall(CallExpr node, Void context) {
        CallExpr call = (CallExpr) super.visitCall(node, context);
        List<Expression> args = hoistArgs(call.getArgs(), ctx.getBindings().forFunction(call.getCallee()));
        if (args == call.getArgs()) return call;
        return new CallExpr(call.getLocation(), call.getType(), call.getCallee(), call.getTypeArgs(), args);
    }

    @Override
    public TreeNode visitMethodCall(MethodCallExpr node, Void context) {
        MethodCallExpr call = (MethodCallExpr) super.visitMethodCall(node, context);
        Expression receiver = call.getReceiver();
        if (receiver != null && !Places.isPlace(receiver)) {
            receiver = hoist(receiver);
        }
        SignatureBindings bindings = ctx.getBindings().forMethod(call.getOwner().getName(), call.getMethod());
        List<Expression> args = hoistArgs(call.getArgs(), bindings);
        if (receiver == call.getReceiver() && args == call.getArgs()) return call;
        return new MethodCallExpr(call.getLocation(), call.getType(), call.getOwner(), call.getMethod(),
                receiver, args);
    }

    // ==================== 语句 ====================

    @Override
    public TreeNode visitMatch(MatchStmt node, Void context) {
        MatchStmt match = (MatchStmt) super.visitMatch(node, context);
        if (!Places.isPlace(match.getTarget())) {
            match = new MatchStmt(match.getLocation(), hoist(match.getTarget()), match.getArms());
        }
        ctx.getLayouts().transferPlan(node, match);
        return match;
    }

    @Override
    public TreeNode visitWhile(WhileStmt node, Void context) {
        hoists.push(new ArrayList<Statement>());
        Expression cond;
        List<Statement> pending;
        try {
            cond = transformExpr(node.getCondition());
        } finally {
            pending = hoists.pop();
        }
        Block body = transformBlock(node.getBody());
        if (pending.isEmpty()) {
            if (cond == node.getCondition() && body == node.getBody()) return node;
            return new WhileStmt(node.getLocation(), cond, body);
        }
        List<Statement> loopBody = new ArrayList<>(pending);
        List<Statement> exit = new ArrayList<>();
        exit.add(new BreakStmt(node.getLocation()));
        loopBody.add(new IfStmt(node.getLocation(), lowering.not(cond), new Block(node.getLocation(), exit), null));
        loopBody.addAll(body.getStatements());
        return new LoopStmt(node.getLocation(), new Block(body.getLocation(), loopBody));
    }

    @Override
    public TreeNode visitIf(IfStmt node, Void context) {
        Expression cond = transformExpr(node.getCondition());
        Block then = transformBlock(node.getThenBranch());
        Statement els = node.getElseBranch();
        if (els instanceof IfStmt) {
            // else if 的条件只能在前面的条件不成立时求值
            List<Statement> stmts = new ArrayList<>();
            transformInto(els, stmts);
            els = stmts.size() == 1 ? stmts.get(0) : new Block(els.getLocation(), stmts);
        } else {
            els = transformStmt(els);
        }
        if (cond == node.getCondition() && then == node.getThenBranch() && els == node.getElseBranch()) return node;
        return new IfStmt(node.getLocation(), cond, then, els);
    }

    @Override
    public TreeNode visitForRange(ForRangeStmt node, Void context) {
        Expression from = transformExpr(node.getFrom());
        Expression to = transformExpr(node.getTo());
        if (!(to instanceof Literal) && !(to instanceof Identifier)) {
            // 上界只求值一次
            to = hoist(to);
        }
        Block body = transformBlock(node.getBody());
        if (from == node.getFrom() && to == node.getTo() && body == node.getBody()) return node;
        return new ForRangeStmt(node.getLocation(), node.getVariable(), from, to, node.isInclusive(), body);
    }
}
