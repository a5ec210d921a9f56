package com.autolang.ctrans.ownership;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.layout.LayoutTable;
import com.autolang.ctrans.layout.SizeClass;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.ctrans.pass.TransPass;
import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeScanner;
import com.autolang.tree.decl.*;
import com.autolang.tree.expr.*;
import com.autolang.tree.pattern.VariantPattern;
import com.autolang.tree.pattern.WildcardPattern;
import com.autolang.tree.stmt.*;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.PointerType;
import com.autolang.tree.type.PrimitiveType;
import com.autolang.tree.type.TypeRef;

import java.util.*;
import java.util.logging.Logger;

/**
 * 所有权驱动的参数分类。
 * <p>
 * 为每个具体函数和方法的参数、接收者、返回槽附加传递策略（决策表按顺序取第一条命中），
 * 并检查函数体中的所有权违规：对不可变来源调用修改接收者的方法、把它传给 MUTATE 参数或赋值，
 * 以及在底层代码之外取地址。
 */
public class OwnershipClassifier implements TransPass<ResolvedModule, ResolvedModule> {
    private static final Logger LOG = Logger.getLogger(OwnershipClassifier.class.getName());

    @Override
    public String getName() {
        return "ownership";
    }

    @Override
    public ResolvedModule run(ResolvedModule module, CompilationContext ctx) {
        BindingTable bindings = ctx.getBindings();
        LayoutTable layouts = ctx.getLayouts();
        for (TypeDecl type : module.getTypes()) {
            for (MethodDecl method : type.getMethods()) {
                bindings.attach(BindingTable.methodKey(type.getName(), method.getName()),
                        classifyMethod(type, method, layouts, ctx));
            }
        }
        for (FunctionDecl fn : module.getFunctions()) {
            bindings.attach(fn.getName(), classifyFunction(fn, layouts, ctx));
        }
        for (SpecDecl spec : module.getSpecs()) {
            for (MethodDecl method : spec.getMethods()) {
                bindings.attach(BindingTable.methodKey(spec.getName(), method.getName()),
                        classifySpecMethod(spec, method, layouts, ctx));
            }
        }
        LOG.fine(module.getName() + ": " + bindings.getAll().size() + " 个签名已分类");

        for (TypeDecl type : module.getTypes()) {
            for (MethodDecl method : type.getMethods()) {
                if (method.isExternal()) continue;
                BodyChecker checker = new BodyChecker(module, ctx, false);
                checker.enterMethod(method);
                checker.scan(method.getBody(), null);
            }
        }
        for (FunctionDecl fn : module.getFunctions()) {
            if (fn.isExternal()) continue;
            BodyChecker checker = new BodyChecker(module, ctx, fn.isLowLevel());
            checker.enterParams(fn.getParams());
            checker.scan(fn.getBody(), null);
        }
        return module;
    }

    // ==================== 决策表 ====================

    public static SignatureBindings classifyFunction(FunctionDecl fn, LayoutTable layouts, CompilationContext ctx) {
        List<ParamBinding> params = new ArrayList<>();
        for (ParamDecl p : fn.getParams()) {
            if (p.getIntent() == ParamIntent.ADDRESS && !fn.isLowLevel()) {
                throw ctx.error(ErrorKind.OWNERSHIP_VIOLATION, fn.getName() + "(" + p.getName() + ")",
                        p.getLocation(), "ADDRESS parameter is only allowed in a low-level function");
            }
            params.add(classifyParam(p, layouts));
        }
        return new SignatureBindings(null, params, classifyReturn(fn.getReturnType()));
    }

    public static SignatureBindings classifyMethod(TypeDecl owner, MethodDecl method,
                                                   LayoutTable layouts, CompilationContext ctx) {
        ParamBinding receiver = null;
        if (!method.isStatic()) {
            receiver = new ParamBinding(ParamBinding.Role.RECEIVER, "self", new NamedType(owner.getName()),
                    null, method.mutatesReceiver() ? PassingStrategy.REF_MUTABLE : PassingStrategy.REF_IMMUTABLE);
        }
        List<ParamBinding> params = new ArrayList<>();
        for (ParamDecl p : method.getParams()) {
            if (p.getIntent() == ParamIntent.ADDRESS) {
                throw ctx.error(ErrorKind.OWNERSHIP_VIOLATION,
                        owner.getName() + "." + method.getName() + "(" + p.getName() + ")",
                        p.getLocation(), "ADDRESS parameter is only allowed in a low-level function");
            }
            params.add(classifyParam(p, layouts));
        }
        return new SignatureBindings(receiver, params, classifyReturn(method.getReturnType()));
    }

    /**
     * 规格方法的签名即 vtable 槽位的签名：接收者是 {@code void *self}，参数按同样的决策表分类，
     * 与实现方法的参数传递方式一致。
     */
    public static SignatureBindings classifySpecMethod(SpecDecl spec, MethodDecl method,
                                                       LayoutTable layouts, CompilationContext ctx) {
        ParamBinding receiver = new ParamBinding(ParamBinding.Role.RECEIVER, "self",
                new PointerType(PrimitiveType.VOID), null, PassingStrategy.POINTER);
        List<ParamBinding> params = new ArrayList<>();
        for (ParamDecl p : method.getParams()) {
            if (p.getIntent() == ParamIntent.ADDRESS) {
                throw ctx.error(ErrorKind.OWNERSHIP_VIOLATION,
                        spec.getName() + "." + method.getName() + "(" + p.getName() + ")",
                        p.getLocation(), "ADDRESS parameter is only allowed in a low-level function");
            }
            params.add(classifyParam(p, layouts));
        }
        return new SignatureBindings(receiver, params, classifyReturn(method.getReturnType()));
    }

    static ParamBinding classifyParam(ParamDecl p, LayoutTable layouts) {
        return new ParamBinding(ParamBinding.Role.PARAM, p.getName(), p.getType(), p.getIntent(),
                strategyFor(p.getIntent(), p.getType(), layouts));
    }

    public static PassingStrategy strategyFor(ParamIntent intent, TypeRef type, LayoutTable layouts) {
        if (intent == ParamIntent.ADDRESS) return PassingStrategy.POINTER;
        if (type instanceof PointerType) return PassingStrategy.POINTER;
        if (intent == ParamIntent.MOVE) return PassingStrategy.COPY;
        if (intent == ParamIntent.MUTATE) return PassingStrategy.REF_MUTABLE;
        return layouts.sizeClassOf(type) == SizeClass.SMALL ? PassingStrategy.COPY : PassingStrategy.REF_IMMUTABLE;
    }

    static ParamBinding classifyReturn(TypeRef type) {
        return new ParamBinding(ParamBinding.Role.RETURN, "return", type, null,
                type instanceof PointerType ? PassingStrategy.POINTER : PassingStrategy.COPY);
    }

    // ==================== 函数体检查 ====================

    /**
     * 跟踪每个名字的来源可变性，检查修改操作。
     */
    private static final class BodyChecker extends TreeScanner<Void> {
        private final ResolvedModule module;
        private final CompilationContext ctx;
        private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<>();
        private boolean selfMutable;
        private int lowLevelDepth;

        BodyChecker(ResolvedModule module, CompilationContext ctx, boolean lowLevelFunction) {
            this.module = module;
            this.ctx = ctx;
            this.lowLevelDepth = lowLevelFunction ? 1 : 0;
            scopes.push(new HashMap<String, Boolean>());
        }

        void enterMethod(MethodDecl method) {
            selfMutable = method.mutatesReceiver();
            enterParams(method.getParams());
        }

        void enterParams(List<ParamDecl> params) {
            for (ParamDecl p : params) {
                declare(p.getName(), p.getIntent() != ParamIntent.READ);
            }
        }

        private void declare(String name, boolean mutable) {
            scopes.peek().put(name, mutable);
        }

        private Boolean lookup(String name) {
            for (Map<String, Boolean> scope : scopes) {
                Boolean mutable = scope.get(name);
                if (mutable != null) return mutable;
            }
            return null;
        }

        /**
         * 表达式所指位置的来源：TRUE 可变，FALSE 不可变，null 表示临时值或未知来源。
         */
        private Boolean origin(Expression expr) {
            if (expr instanceof Identifier) {
                return lookup(((Identifier) expr).getName());
            }
            if (expr instanceof SelfExpr || expr instanceof SelfFieldExpr) {
                return selfMutable;
            }
            if (expr instanceof FieldAccess) {
                Expression target = ((FieldAccess) expr).getTarget();
                return target.getType() instanceof PointerType ? Boolean.TRUE : origin(target);
            }
            if (expr instanceof IndexExpr) {
                Expression target = ((IndexExpr) expr).getTarget();
                return target.getType() instanceof PointerType ? Boolean.TRUE : origin(target);
            }
            if (expr instanceof UnaryExpr && ((UnaryExpr) expr).getOperator() == UnaryExpr.Operator.DEREF) {
                return Boolean.TRUE;
            }
            return null;
        }

        private static String describe(Expression expr) {
            if (expr instanceof Identifier) return ((Identifier) expr).getName();
            if (expr instanceof SelfExpr) return "self";
            if (expr instanceof SelfFieldExpr) return "self." + ((SelfFieldExpr) expr).getField();
            if (expr instanceof FieldAccess) {
                return describe(((FieldAccess) expr).getTarget()) + "." + ((FieldAccess) expr).getField();
            }
            if (expr instanceof IndexExpr) return describe(((IndexExpr) expr).getTarget()) + "[]";
            return "value";
        }

        private void requireMutable(Expression place, String action, SourceLocation loc) {
            if (Boolean.FALSE.equals(origin(place))) {
                throw ctx.error(ErrorKind.OWNERSHIP_VIOLATION, describe(place), loc,
                        "Cannot " + action + " '" + describe(place) + "': its binding is immutable");
            }
        }

        private void checkArgs(List<ParamDecl> params, List<Expression> args, String callee) {
            for (int i = 0; i < Math.min(params.size(), args.size()); i++) {
                ParamIntent intent = params.get(i).getIntent();
                if (intent == ParamIntent.MUTATE || intent == ParamIntent.ADDRESS) {
                    requireMutable(args.get(i), "pass to " + intent + " parameter '"
                            + params.get(i).getName() + "' of " + callee + " the place", args.get(i).getLocation());
                }
            }
        }

        // ==================== 作用域 ====================

        @Override
        public Void visitBlock(Block node, Void context) {
            scopes.push(new HashMap<String, Boolean>());
            try {
                return super.visitBlock(node, context);
            } finally {
                scopes.pop();
            }
        }

        @Override
        public Void visitLet(LetStmt node, Void context) {
            super.visitLet(node, context);
            declare(node.getName(), node.isMutable());
            return null;
        }

        @Override
        public Void visitForRange(ForRangeStmt node, Void context) {
            scan(node.getFrom(), context);
            scan(node.getTo(), context);
            scopes.push(new HashMap<String, Boolean>());
            try {
                declare(node.getVariable(), false);
                scan(node.getBody(), context);
            } finally {
                scopes.pop();
            }
            return null;
        }

        @Override
        public Void visitMatch(MatchStmt node, Void context) {
            scan(node.getTarget(), context);
            for (MatchArm arm : node.getArms()) {
                scopes.push(new HashMap<String, Boolean>());
                try {
                    if (arm.getPattern() instanceof VariantPattern) {
                        for (String binding : ((VariantPattern) arm.getPattern()).getBindings()) {
                            declare(binding, false);
                        }
                    } else if (arm.getPattern() instanceof WildcardPattern
                            && ((WildcardPattern) arm.getPattern()).getBinding() != null) {
                        declare(((WildcardPattern) arm.getPattern()).getBinding(), false);
                    }
                    scan(arm.getBody(), context);
                } finally {
                    scopes.pop();
                }
            }
            return null;
        }

        @Override
        public Void visitLowLevelBlock(LowLevelBlock node, Void context) {
            lowLevelDepth++;
            try {
                return super.visitLowLevelBlock(node, context);
            } finally {
                lowLevelDepth--;
            }
        }

        // ==================== 修改操作 ====================

        @Override
        public Void visitAssign(AssignExpr node, Void context) {
            requireMutable(node.getTarget(), "assign to", node.getLocation());
            return super.visitAssign(node, context);
        }

        @Override
        public Void visitAddressOf(AddressOf node, Void context) {
            if (lowLevelDepth == 0) {
                throw ctx.error(ErrorKind.OWNERSHIP_VIOLATION, describe(node.getOperand()), node.getLocation(),
                        "Taking an address is only allowed inside a low-level block");
            }
            return super.visitAddressOf(node, context);
        }

        @Override
        public Void visitMethodCall(MethodCallExpr node, Void context) {
            TypeDecl owner = module.findType(node.getOwner().getName());
            MethodDecl method = owner != null ? owner.findMethod(node.getMethod()) : null;
            if (method != null) {
                String callee = owner.getName() + "." + method.getName();
                // 经由 *T 调用时修改的是指向的对象，不受绑定本身可变性限制
                if (node.getReceiver() != null && method.mutatesReceiver()
                        && !(node.getReceiver().getType() instanceof PointerType)) {
                    requireMutable(node.getReceiver(), "call mutating method " + callee + " on",
                            node.getLocation());
                }
                checkArgs(method.getParams(), node.getArgs(), callee);
            }
            return super.visitMethodCall(node, context);
        }

        @Override
        public Void visitCall(CallExpr node, Void context) {
            FunctionDecl fn = module.findFunction(node.getCallee());
            if (fn != null) {
                checkArgs(fn.getParams(), node.getArgs(), fn.getName());
            } else {
                // 依赖模块的函数：按导入的绑定检查
                SignatureBindings imported = ctx.getBindings().forFunction(node.getCallee());
                if (imported != null) {
                    List<ParamDecl> params = new ArrayList<>();
                    for (ParamBinding p : imported.getParams()) {
                        params.add(new ParamDecl(node.getLocation(), p.getName(), p.getType(), p.getIntent()));
                    }
                    checkArgs(params, node.getArgs(), node.getCallee());
                }
            }
            return super.visitCall(node, context);
        }
    }
}
