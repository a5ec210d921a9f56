package com.autolang.ctrans.emit;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.layout.DispatchPlan;
import com.autolang.ctrans.layout.TagLayout;
import com.autolang.ctrans.layout.VariantLayout;
import com.autolang.ctrans.lowering.LoweredFunction;
import com.autolang.ctrans.lowering.MethodLowering;
import com.autolang.ctrans.ownership.ParamBinding;
import com.autolang.ctrans.ownership.SignatureBindings;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.decl.FieldDecl;
import com.autolang.tree.expr.*;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.PointerType;
import com.autolang.tree.type.TypeRef;

import java.util.*;

/**
 * 语句与表达式的 C 输出。
 * <p>
 * 语句的 visit 方法直接写入 {@link CodeWriter} 并返回 null；表达式的 visit 方法返回 C 文本。
 * 引用和隐式指针绑定在值上下文中解引用为 {@code (*p)}，字段经 {@code ->} 访问；
 * 引用参数的实参传 {@code &place}，本身已是引用的绑定原样转发。
 */
public class CStatementWriter implements TreeVisitor<String, Void> {
    private final CompilationContext ctx;
    private final CTypeNames types;
    private final CodeWriter out;
    private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<>();
    private boolean inMain;

    public CStatementWriter(CompilationContext ctx, CTypeNames types, CodeWriter out) {
        this.ctx = ctx;
        this.types = types;
        this.out = out;
    }

    /**
     * 输出函数体（含外层花括号内的语句，不含签名）。
     */
    public void writeBody(LoweredFunction fn) {
        scopes.clear();
        Map<String, Boolean> params = new HashMap<>();
        SignatureBindings bindings = fn.getBindings();
        if (bindings.getReceiver() != null) params.put("self", Boolean.TRUE);
        for (ParamBinding p : bindings.getParams()) {
            params.put(p.getName(), p.isIndirect());
        }
        scopes.push(params);
        inMain = fn.isMain();
        for (Statement stmt : fn.getBody().getStatements()) {
            stmt.accept(this, null);
        }
    }

    public String expr(Expression e) {
        return e.accept(this, null);
    }

    // ==================== 作用域 ====================

    private boolean isIndirect(String name) {
        for (Map<String, Boolean> scope : scopes) {
            Boolean indirect = scope.get(name);
            if (indirect != null) return indirect;
        }
        return false;
    }

    private void declareLocal(String name) {
        scopes.peek().put(name, Boolean.FALSE);
    }

    private boolean isIndirectRef(Expression e) {
        return e instanceof SelfExpr || (e instanceof Identifier && isIndirect(((Identifier) e).getName()));
    }

    private String refName(Expression e) {
        return e instanceof SelfExpr ? "self" : ((Identifier) e).getName();
    }

    /**
     * 取成员时的前缀：经由引用或指针用 {@code ->}，否则用 {@code .}。
     */
    private String memberPrefix(Expression target) {
        if (isIndirectRef(target)) return refName(target) + "->";
        if (target.getType() instanceof PointerType) return operand(target) + "->";
        return operand(target) + ".";
    }

    /**
     * 位置的地址：已是引用的绑定直接转发。
     */
    private String addressOf(Expression place) {
        if (isIndirectRef(place)) return refName(place);
        return "&" + operand(place);
    }

    private String operand(Expression e) {
        String text = expr(e);
        if (e instanceof BinaryExpr || e instanceof AssignExpr) return "(" + text + ")";
        return text;
    }

    private String argument(Expression arg, ParamBinding binding) {
        if (binding != null && binding.isIndirect()) return addressOf(arg);
        return expr(arg);
    }

    private void block(Block body) {
        scopes.push(new HashMap<String, Boolean>());
        out.indent();
        try {
            for (Statement stmt : body.getStatements()) {
                stmt.accept(this, null);
            }
        } finally {
            out.dedent();
            scopes.pop();
        }
    }

    // ==================== 语句 ====================

    @Override
    public String visitBlock(Block node, Void context) {
        out.line("{");
        block(node);
        out.line("}");
        return null;
    }

    @Override
    public String visitLet(LetStmt node, Void context) {
        TypeRef type = node.getType();
        if (type == null) {
            throw new IllegalStateException("Local '" + node.getName() + "' has no type at " + node.getLocation());
        }
        StringBuilder sb = new StringBuilder(types.declare(type, node.getName()));
        Expression init = node.getInitializer();
        if (init != null) {
            sb.append(" = ");
            if (init instanceof StructInit || init instanceof VariantInit) {
                sb.append(initializer(init));
            } else {
                sb.append(expr(init));
            }
        }
        declareLocal(node.getName());
        out.line(sb.append(';').toString());
        return null;
    }

    @Override
    public String visitExprStmt(ExprStmt node, Void context) {
        out.line(expr(node.getExpression()) + ";");
        return null;
    }

    @Override
    public String visitReturn(ReturnStmt node, Void context) {
        if (node.getValue() == null) {
            out.line(inMain ? "return 0;" : "return;");
        } else {
            out.line("return " + expr(node.getValue()) + ";");
        }
        return null;
    }

    @Override
    public String visitIf(IfStmt node, Void context) {
        out.line("if (" + expr(node.getCondition()) + ") {");
        block(node.getThenBranch());
        Statement els = node.getElseBranch();
        while (els instanceof IfStmt) {
            IfStmt elseIf = (IfStmt) els;
            out.line("} else if (" + expr(elseIf.getCondition()) + ") {");
            block(elseIf.getThenBranch());
            els = elseIf.getElseBranch();
        }
        if (els != null) {
            out.line("} else {");
            block(els instanceof Block ? (Block) els : singleton(els));
        }
        out.line("}");
        return null;
    }

    private static Block singleton(Statement stmt) {
        return new Block(stmt.getLocation(), Collections.singletonList(stmt));
    }

    @Override
    public String visitWhile(WhileStmt node, Void context) {
        out.line("while (" + expr(node.getCondition()) + ") {");
        block(node.getBody());
        out.line("}");
        return null;
    }

    @Override
    public String visitLoop(LoopStmt node, Void context) {
        out.line("for (;;) {");
        block(node.getBody());
        out.line("}");
        return null;
    }

    @Override
    public String visitForRange(ForRangeStmt node, Void context) {
        String var = node.getVariable();
        TypeRef type = node.getFrom().getType();
        String from = expr(node.getFrom());
        String to = expr(node.getTo());
        scopes.push(new HashMap<String, Boolean>());
        try {
            declareLocal(var);
            out.line("for (" + types.declare(type, var) + " = " + from + "; " + var
                    + (node.isInclusive() ? " <= " : " < ") + to + "; " + var + "++) {");
            block(node.getBody());
        } finally {
            scopes.pop();
        }
        out.line("}");
        return null;
    }

    @Override
    public String visitBreak(BreakStmt node, Void context) {
        out.line("break;");
        return null;
    }

    @Override
    public String visitContinue(ContinueStmt node, Void context) {
        out.line("continue;");
        return null;
    }

    @Override
    public String visitLowLevelBlock(LowLevelBlock node, Void context) {
        return visitBlock(node.getBody(), context);
    }

    @Override
    public String visitMatch(MatchStmt node, Void context) {
        DispatchPlan plan = ctx.getLayouts().getPlan(node);
        if (plan == null) {
            throw new IllegalStateException("No dispatch plan for match at " + node.getLocation());
        }
        Expression target = node.getTarget();
        String selector = plan.isTagDispatch() ? memberPrefix(target) + TagLayout.TAG_FIELD : expr(target);
        if (plan.getForm() == DispatchPlan.Form.SWITCH) {
            out.line("switch (" + selector + ") {");
            out.indent();
            for (DispatchPlan.Case c : plan.getCases()) {
                out.line((c.isCatchAll() ? "default" : "case " + caseLabel(c)) + ": {");
                arm(node, c, target);
                out.line("} break;");
            }
            out.dedent();
            out.line("}");
            return null;
        }
        List<DispatchPlan.Case> cases = plan.getCases();
        for (int i = 0; i < cases.size(); i++) {
            DispatchPlan.Case c = cases.get(i);
            String head;
            if (c.isCatchAll()) {
                head = i == 0 ? "{" : "} else {";
            } else {
                String test = selector + " == " + caseLabel(c);
                head = (i == 0 ? "if (" : "} else if (") + test + ") {";
            }
            out.line(head);
            arm(node, c, target);
        }
        if (!cases.isEmpty()) out.line("}");
        return null;
    }

    private String caseLabel(DispatchPlan.Case c) {
        return c.getVariant() != null ? c.getVariant().getConstantName() : expr(c.getLiteral());
    }

    private void arm(MatchStmt match, DispatchPlan.Case c, Expression target) {
        scopes.push(new HashMap<String, Boolean>());
        out.indent();
        try {
            for (DispatchPlan.Binding b : c.getBindings()) {
                out.line(types.declare(b.getType(), b.getName()) + " = " + memberPrefix(target) + b.getAccessPath() + ";");
                declareLocal(b.getName());
            }
            if (c.getWholeBinding() != null) {
                out.line(types.declare(target.getType(), c.getWholeBinding()) + " = " + expr(target) + ";");
                declareLocal(c.getWholeBinding());
            }
            for (Statement stmt : match.getArms().get(c.getArmIndex()).getBody().getStatements()) {
                stmt.accept(this, null);
            }
        } finally {
            out.dedent();
            scopes.pop();
        }
    }

    // ==================== 表达式 ====================

    @Override
    public String visitLiteral(Literal node, Void context) {
        switch (node.getKind()) {
            case BOOL:
                types.use(CTypeNames.STDBOOL);
                return Boolean.parseBoolean(node.getText()) ? "true" : "false";
            case CHAR:
                return "'" + escape(node.getText(), '\'') + "'";
            case STR:
                return "\"" + escape(node.getText(), '"') + "\"";
            case NULL:
                types.use(CTypeNames.STDDEF);
                return "NULL";
            default:
                return node.getText();
        }
    }

    static String escape(String text, char quote) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (c == quote) sb.append('\\');
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String visitIdentifier(Identifier node, Void context) {
        return isIndirect(node.getName()) ? "(*" + node.getName() + ")" : node.getName();
    }

    @Override
    public String visitSelf(SelfExpr node, Void context) {
        return "(*self)";
    }

    @Override
    public String visitSelfField(SelfFieldExpr node, Void context) {
        return "self->" + node.getField();
    }

    @Override
    public String visitFieldAccess(FieldAccess node, Void context) {
        return memberPrefix(node.getTarget()) + node.getField();
    }

    @Override
    public String visitBinary(BinaryExpr node, Void context) {
        return operand(node.getLeft()) + " " + node.getOperator().getSymbol() + " " + operand(node.getRight());
    }

    @Override
    public String visitUnary(UnaryExpr node, Void context) {
        if (node.getOperator() == UnaryExpr.Operator.DEREF) {
            return "(*" + operand(node.getOperand()) + ")";
        }
        return node.getOperator().getSymbol() + operand(node.getOperand());
    }

    @Override
    public String visitAssign(AssignExpr node, Void context) {
        return expr(node.getTarget()) + " " + node.getOperator().getSymbol() + " " + expr(node.getValue());
    }

    @Override
    public String visitCall(CallExpr node, Void context) {
        SignatureBindings bindings = ctx.getBindings().forFunction(node.getCallee());
        List<String> args = new ArrayList<>();
        for (int i = 0; i < node.getArgs().size(); i++) {
            args.add(argument(node.getArgs().get(i), bindings != null ? bindings.getParam(i) : null));
        }
        return node.getCallee() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitMethodCall(MethodCallExpr node, Void context) {
        String owner = node.getOwner().getName();
        SignatureBindings bindings = ctx.getBindings().forMethod(owner, node.getMethod());
        List<String> args = new ArrayList<>();
        if (node.getReceiver() != null) {
            Expression receiver = node.getReceiver();
            args.add(receiver.getType() instanceof PointerType ? expr(receiver) : addressOf(receiver));
        }
        for (int i = 0; i < node.getArgs().size(); i++) {
            args.add(argument(node.getArgs().get(i), bindings != null ? bindings.getParam(i) : null));
        }
        return MethodLowering.mangle(owner, node.getMethod()) + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitVariantInit(VariantInit node, Void context) {
        return "(" + types.typeName(node.getType()) + ")" + initializer(node);
    }

    @Override
    public String visitStructInit(StructInit node, Void context) {
        return "(" + types.typeName(node.getType()) + ")" + initializer(node);
    }

    /**
     * 指定初始化器 {@code {.x = 1, .y = 2}}。
     */
    private String initializer(Expression init) {
        List<String> parts = new ArrayList<>();
        if (init instanceof StructInit) {
            for (Map.Entry<String, Expression> e : ((StructInit) init).getFields().entrySet()) {
                parts.add("." + e.getKey() + " = " + expr(e.getValue()));
            }
        } else {
            VariantInit vi = (VariantInit) init;
            String tagName = ((NamedType) vi.getType()).getName();
            TagLayout tag = ctx.getLayouts().getTagLayout(tagName);
            VariantLayout variant = tag != null ? tag.findVariant(vi.getVariant()) : null;
            if (variant == null) {
                throw new IllegalStateException("Unknown variant " + tagName + "." + vi.getVariant()
                        + " at " + vi.getLocation());
            }
            parts.add("." + TagLayout.TAG_FIELD + " = " + variant.getConstantName());
            List<FieldDecl> fields = variant.getFields();
            for (int i = 0; i < vi.getArgs().size() && i < fields.size(); i++) {
                parts.add("." + variant.accessPath(i) + " = " + expr(vi.getArgs().get(i)));
            }
        }
        return "{" + String.join(", ", parts) + "}";
    }

    @Override
    public String visitAddressOf(AddressOf node, Void context) {
        return addressOf(node.getOperand());
    }

    @Override
    public String visitIndex(IndexExpr node, Void context) {
        return operand(node.getTarget()) + "[" + expr(node.getIndex()) + "]";
    }
}
