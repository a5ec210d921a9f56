package com.autolang.ctrans.mono;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.pass.TransPass;
import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeTransformer;
import com.autolang.tree.decl.*;
import com.autolang.tree.expr.CallExpr;
import com.autolang.tree.expr.Expression;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.stmt.Block;
import com.autolang.tree.stmt.Statement;
import com.autolang.tree.TreeNode;
import com.autolang.tree.type.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * 类型解析与单态化。
 * <p>
 * 每个带泛型实参的类型引用和泛型函数调用都改写为实例名（{@code List<int>} → {@code List_int}），
 * 实例在首次请求时按需生成：先登记名字，再替换模板并递归解析。
 * 实例放在模板原来的声明位置，按实例化顺序排列；未被使用的模板不输出。
 * 类型别名在引用处展开为目标类型；类型实现的规格解析为具体规格，并检查方法签名一致。
 */
public class Monomorphizer implements TransPass<ModuleUnit, ResolvedModule> {
    private static final Logger LOG = Logger.getLogger(Monomorphizer.class.getName());

    /** 进行中的实例化链深度上限 */
    public static final int MAX_INSTANTIATION_DEPTH = 64;

    @Override
    public String getName() {
        return "monomorphize";
    }

    @Override
    public ResolvedModule run(ModuleUnit unit, CompilationContext ctx) {
        return new Session(unit, ctx).resolve();
    }

    /**
     * 一次单态化的状态。
     */
    private static final class Session {
        private final ModuleUnit unit;
        private final CompilationContext ctx;
        private final InstantiationTable table;
        private final Map<String, TypeDecl> typeDecls = new HashMap<>();
        private final Map<String, FunctionDecl> functionDecls = new HashMap<>();
        private final Map<String, TypeAliasDecl> aliasDecls = new HashMap<>();
        private final Map<String, SpecDecl> specDecls = new HashMap<>();
        private final Deque<Frame> inProgress = new ArrayDeque<>();
        /** 正在展开的别名链 */
        private final Deque<String> expanding = new ArrayDeque<>();

        Session(ModuleUnit unit, CompilationContext ctx) {
            this.unit = unit;
            this.ctx = ctx;
            this.table = ctx.getInstantiations();
            for (TypeDecl t : unit.getTypes()) typeDecls.put(t.getName(), t);
            for (FunctionDecl f : unit.getFunctions()) functionDecls.put(f.getName(), f);
            for (TypeAliasDecl a : unit.getAliases()) aliasDecls.put(a.getName(), a);
            for (SpecDecl s : unit.getSpecs()) specDecls.put(s.getName(), s);
        }

        ResolvedModule resolve() {
            Map<String, TypeRef> none = Collections.emptyMap();
            Map<TypeDecl, TypeDecl> concreteTypes = new IdentityHashMap<>();
            for (TypeDecl t : unit.getTypes()) {
                if (!t.isGeneric()) concreteTypes.put(t, substituteType(t, t.getName(), none));
            }
            Map<FunctionDecl, FunctionDecl> concreteFunctions = new IdentityHashMap<>();
            for (FunctionDecl f : unit.getFunctions()) {
                if (!f.isGeneric()) concreteFunctions.put(f, substituteFunction(f, f.getName(), none));
            }
            Map<SpecDecl, SpecDecl> concreteSpecs = new IdentityHashMap<>();
            for (SpecDecl s : unit.getSpecs()) {
                if (!s.isGeneric()) concreteSpecs.put(s, substituteSpec(s, s.getName(), none));
            }
            List<TypeAliasDecl> aliases = new ArrayList<>();
            for (TypeAliasDecl a : unit.getAliases()) {
                aliases.add(a.withTarget(new Resolver(none, a.getLocation()).type(new NamedType(a.getName()))));
            }
            serveRequests();

            List<TypeDecl> types = new ArrayList<>();
            for (TypeDecl t : unit.getTypes()) {
                if (!t.isGeneric()) {
                    types.add(concreteTypes.get(t));
                    continue;
                }
                for (GenericInstantiation inst : table.forTemplate(InstantiationKey.Kind.TYPE, t.getName())) {
                    types.add((TypeDecl) inst.getDeclaration());
                }
            }
            List<FunctionDecl> functions = new ArrayList<>();
            for (FunctionDecl f : unit.getFunctions()) {
                if (!f.isGeneric()) {
                    functions.add(concreteFunctions.get(f));
                    continue;
                }
                for (GenericInstantiation inst : table.forTemplate(InstantiationKey.Kind.FUNCTION, f.getName())) {
                    functions.add((FunctionDecl) inst.getDeclaration());
                }
            }
            List<SpecDecl> specs = new ArrayList<>();
            for (SpecDecl s : unit.getSpecs()) {
                if (!s.isGeneric()) {
                    specs.add(concreteSpecs.get(s));
                    continue;
                }
                for (GenericInstantiation inst : table.forTemplate(InstantiationKey.Kind.SPEC, s.getName())) {
                    specs.add((SpecDecl) inst.getDeclaration());
                }
            }
            ResolvedModule resolved = new ResolvedModule(unit.getName(), unit.getScenario(), unit.getUses(),
                    types, functions, aliases, specs);
            for (TypeDecl t : types) {
                checkConformance(t, resolved);
            }
            LOG.fine(unit.getName() + ": " + table.size() + " 个泛型实例");
            return resolved;
        }

        /**
         * 类型对每个实现的规格都提供同名实例方法，参数类型、意图与返回类型一致。
         */
        private void checkConformance(TypeDecl type, ResolvedModule resolved) {
            for (NamedType ref : type.getSpecs()) {
                SpecDecl spec = resolved.findSpec(ref.getName());
                for (MethodDecl required : spec.getMethods()) {
                    MethodDecl actual = type.findMethod(required.getName());
                    String symbol = type.getName() + "." + required.getName();
                    if (actual == null || actual.isStatic()) {
                        throw ctx.error(ErrorKind.SPEC_MISMATCH, symbol, type.getLocation(),
                                "Type '" + type.getName() + "' implements " + spec.getName()
                                        + " but has no instance method '" + required.getName() + "'");
                    }
                    if (!sameSignature(required, actual)) {
                        throw ctx.error(ErrorKind.SPEC_MISMATCH, symbol, actual.getLocation(),
                                "Method '" + symbol + "' does not match " + spec.getName() + "." + required.getName()
                                        + ": expected " + describe(required) + ", found " + describe(actual));
                    }
                }
            }
        }

        private static boolean sameSignature(MethodDecl a, MethodDecl b) {
            if (a.getParams().size() != b.getParams().size()) return false;
            if (!a.getReturnType().equals(b.getReturnType())) return false;
            for (int i = 0; i < a.getParams().size(); i++) {
                ParamDecl pa = a.getParams().get(i);
                ParamDecl pb = b.getParams().get(i);
                if (!pa.getType().equals(pb.getType()) || pa.getIntent() != pb.getIntent()) return false;
            }
            return true;
        }

        private static String describe(MethodDecl m) {
            List<String> params = new ArrayList<>();
            for (ParamDecl p : m.getParams()) {
                params.add(p.getIntent() + " " + p.getType());
            }
            return "(" + String.join(", ", params) + ") " + m.getReturnType();
        }

        // ==================== 实例化 ====================

        /**
         * 生成批内依赖方登记给本模块的实例。依赖方先于本模块单态化，请求此时已经齐全。
         */
        private void serveRequests() {
            InstantiationRequests requests = ctx.getRequests();
            if (requests == null) return;
            for (InstantiationRequests.Request r : requests.requestsFor(unit.getName())) {
                InstantiationKey key = r.getKey();
                if (key.getKind() == InstantiationKey.Kind.TYPE) {
                    requestType(typeDecls.get(key.getGenericName()), key.getTypeArgs(), 0, r.getLocation());
                } else {
                    requestFunction(functionDecls.get(key.getGenericName()), key.getTypeArgs(), 0, r.getLocation());
                }
                LOG.fine(unit.getName() + ": 为模块 " + r.getFromModule() + " 生成 " + key);
            }
        }

        private String requestType(TypeDecl template, List<TypeRef> args, int depth, SourceLocation loc) {
            InstantiationKey key = new InstantiationKey(InstantiationKey.Kind.TYPE, template.getName(), args);
            GenericInstantiation existing = table.lookup(key);
            if (existing != null) return existing.getName();
            GenericInstantiation inst = begin(key, depth, loc);
            try {
                inst.complete(substituteType(template, inst.getName(), bind(template.getTypeParams(), args)));
            } finally {
                inProgress.pop();
            }
            return inst.getName();
        }

        private String requestFunction(FunctionDecl template, List<TypeRef> args, int depth, SourceLocation loc) {
            InstantiationKey key = new InstantiationKey(InstantiationKey.Kind.FUNCTION, template.getName(), args);
            GenericInstantiation existing = table.lookup(key);
            if (existing != null) return existing.getName();
            GenericInstantiation inst = begin(key, depth, loc);
            try {
                inst.complete(substituteFunction(template, inst.getName(), bind(template.getTypeParams(), args)));
            } finally {
                inProgress.pop();
            }
            return inst.getName();
        }

        private String requestSpec(SpecDecl template, List<TypeRef> args, int depth, SourceLocation loc) {
            InstantiationKey key = new InstantiationKey(InstantiationKey.Kind.SPEC, template.getName(), args);
            GenericInstantiation existing = table.lookup(key);
            if (existing != null) return existing.getName();
            GenericInstantiation inst = begin(key, depth, loc);
            try {
                inst.complete(substituteSpec(template, inst.getName(), bind(template.getTypeParams(), args)));
            } finally {
                inProgress.pop();
            }
            return inst.getName();
        }

        private GenericInstantiation begin(InstantiationKey key, int depth, SourceLocation loc) {
            if (inProgress.size() >= MAX_INSTANTIATION_DEPTH) {
                throw ctx.error(ErrorKind.CYCLIC_INSTANTIATION, key.toString(), loc,
                        "Instantiation chain exceeds " + MAX_INSTANTIATION_DEPTH + " levels");
            }
            for (Frame frame : inProgress) {
                if (frame.key.getKind() == key.getKind()
                        && frame.key.getGenericName().equals(key.getGenericName())
                        && depth > frame.depth) {
                    throw ctx.error(ErrorKind.CYCLIC_INSTANTIATION, key.toString(), loc,
                            key.getGenericName() + " is instantiated in terms of itself with growing arguments ("
                                    + frame.key + " requests " + key + ")");
                }
            }
            String name = TypeNameEncoder.instanceName(key.getGenericName(), key.getTypeArgs());
            if (typeDecls.containsKey(name) || functionDecls.containsKey(name)
                    || aliasDecls.containsKey(name) || specDecls.containsKey(name)) {
                throw ctx.error(ErrorKind.SYMBOL_COLLISION, name, loc,
                        "Instantiation " + key + " collides with a declared symbol '" + name + "'");
            }
            GenericInstantiation inst = table.register(key, name, loc);
            LOG.fine("实例化 " + key + " → " + name);
            inProgress.push(new Frame(key, depth));
            return inst;
        }

        private static Map<String, TypeRef> bind(List<String> params, List<TypeRef> args) {
            Map<String, TypeRef> bindings = new HashMap<>();
            for (int i = 0; i < params.size(); i++) {
                bindings.put(params.get(i), args.get(i));
            }
            return bindings;
        }

        // ==================== 声明替换 ====================

        private TypeDecl substituteType(TypeDecl decl, String newName, Map<String, TypeRef> bindings) {
            Resolver resolver = new Resolver(bindings, decl.getLocation());
            List<MethodDecl> methods = new ArrayList<>();
            for (MethodDecl m : decl.getMethods()) {
                methods.add(resolver.method(m));
            }
            if (decl instanceof TagDecl) {
                TagDecl tag = (TagDecl) decl;
                List<VariantDecl> variants = new ArrayList<>();
                for (VariantDecl v : tag.getVariants()) {
                    variants.add(v.withFields(resolver.fields(v.getFields())));
                }
                return withSpecs(tag.rebuild(newName, variants, methods), resolver);
            }
            return withSpecs(decl.rebuild(newName, Collections.<String>emptyList(),
                    resolver.fields(decl.getFields()), methods), resolver);
        }

        private TypeDecl withSpecs(TypeDecl decl, Resolver resolver) {
            if (decl.getSpecs().isEmpty()) return decl;
            List<NamedType> specs = new ArrayList<>();
            for (NamedType ref : decl.getSpecs()) {
                specs.add(resolver.spec(ref));
            }
            return decl.withSpecs(specs);
        }

        private SpecDecl substituteSpec(SpecDecl decl, String newName, Map<String, TypeRef> bindings) {
            Resolver resolver = new Resolver(bindings, decl.getLocation());
            List<MethodDecl> methods = new ArrayList<>();
            for (MethodDecl m : decl.getMethods()) {
                methods.add(resolver.method(m));
            }
            return decl.rebuild(newName, methods);
        }

        private FunctionDecl substituteFunction(FunctionDecl decl, String newName, Map<String, TypeRef> bindings) {
            Resolver resolver = new Resolver(bindings, decl.getLocation());
            return new FunctionDecl(decl.getLocation(), newName, null, resolver.params(decl.getParams()),
                    resolver.type(decl.getReturnType()), resolver.transformBlock(decl.getBody()),
                    decl.isLowLevel(), decl.getHeader());
        }

        /**
         * 在一组泛型绑定下改写声明与函数体中的类型和泛型调用。
         */
        private final class Resolver extends TreeTransformer {
            private final Map<String, TypeRef> bindings;
            private SourceLocation location;

            Resolver(Map<String, TypeRef> bindings, SourceLocation location) {
                this.bindings = bindings;
                this.location = location;
            }

            MethodDecl method(MethodDecl m) {
                SourceLocation saved = location;
                location = m.getLocation();
                try {
                    return new MethodDecl(m.getLocation(), m.getName(), m.getKind(), m.mutatesReceiver(),
                            params(m.getParams()), type(m.getReturnType()), transformBlock(m.getBody()));
                } finally {
                    location = saved;
                }
            }

            List<FieldDecl> fields(List<FieldDecl> fields) {
                List<FieldDecl> result = new ArrayList<>(fields.size());
                for (FieldDecl f : fields) {
                    location = f.getLocation();
                    result.add(f.withType(type(f.getType())));
                }
                return result;
            }

            List<ParamDecl> params(List<ParamDecl> params) {
                List<ParamDecl> result = new ArrayList<>(params.size());
                for (ParamDecl p : params) {
                    location = p.getLocation();
                    result.add(p.withType(type(p.getType())));
                }
                return result;
            }

            TypeRef type(TypeRef t) {
                return transformType(t);
            }

            /**
             * 类型实现的规格引用改写为具体规格名。规格只在本模块中查找。
             */
            NamedType spec(NamedType ref) {
                SpecDecl decl = specDecls.get(ref.getName());
                if (decl == null) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, ref.getName(), location,
                            "Unknown spec '" + ref.getName() + "'");
                }
                if (decl.getTypeParams().size() != ref.getTypeArgs().size()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, ref.toString(), location,
                            "Spec '" + ref.getName() + "' expects " + decl.getTypeParams().size()
                                    + " type arguments, got " + ref.getTypeArgs().size());
                }
                if (!decl.isGeneric()) return ref;
                int depth = TypeSubstitutor.substitute(ref, bindings).nestingDepth() - 1;
                List<TypeRef> args = new ArrayList<>();
                for (TypeRef arg : ref.getTypeArgs()) {
                    args.add(transformType(arg));
                }
                return new NamedType(requestSpec(decl, args, depth, location));
            }

            /**
             * 别名展开为解析后的目标类型。
             */
            private TypeRef expandAlias(TypeAliasDecl alias) {
                if (expanding.contains(alias.getName())) {
                    throw ctx.error(ErrorKind.CYCLIC_INSTANTIATION, alias.getName(), alias.getLocation(),
                            "Type alias '" + alias.getName() + "' refers to itself");
                }
                expanding.push(alias.getName());
                try {
                    return new Resolver(Collections.<String, TypeRef>emptyMap(), alias.getLocation())
                            .type(alias.getTarget());
                } finally {
                    expanding.pop();
                }
            }

            @Override
            public Statement transformStmt(Statement stmt) {
                if (stmt == null) return null;
                SourceLocation saved = location;
                location = stmt.getLocation();
                try {
                    return super.transformStmt(stmt);
                } finally {
                    location = saved;
                }
            }

            @Override
            public Expression transformExpr(Expression expr) {
                if (expr == null) return null;
                SourceLocation saved = location;
                location = expr.getLocation();
                try {
                    return super.transformExpr(expr);
                } finally {
                    location = saved;
                }
            }

            @Override
            public Block transformBlock(Block block) {
                if (block == null) return null;
                SourceLocation saved = location;
                location = block.getLocation();
                try {
                    return super.transformBlock(block);
                } finally {
                    location = saved;
                }
            }

            @Override
            protected TypeRef transformType(TypeRef type) {
                if (type == null) return null;
                if (type instanceof PrimitiveType) return type;
                if (type instanceof TypeParamType) {
                    TypeRef bound = bindings.get(((TypeParamType) type).getName());
                    if (bound == null) {
                        throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, type.toString(), location,
                                "Type parameter '" + type + "' is not bound at this point");
                    }
                    return bound;
                }
                if (type instanceof PointerType) {
                    TypeRef pointee = transformType(((PointerType) type).getPointee());
                    return pointee == ((PointerType) type).getPointee() ? type : new PointerType(pointee);
                }
                if (type instanceof ArrayType) {
                    ArrayType array = (ArrayType) type;
                    TypeRef element = transformType(array.getElementType());
                    return element == array.getElementType() ? type : new ArrayType(element, array.getLength());
                }
                return resolveNamed((NamedType) type);
            }

            private TypeRef resolveNamed(NamedType named) {
                TypeAliasDecl alias = aliasDecls.get(named.getName());
                if (alias != null) {
                    if (named.hasTypeArgs()) {
                        throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, named.toString(), location,
                                "Type alias '" + named.getName() + "' takes no type arguments");
                    }
                    return expandAlias(alias);
                }
                if (specDecls.containsKey(named.getName())) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, named.toString(), location,
                            "Spec '" + named.getName() + "' cannot be used as a type");
                }
                TypeDecl decl = typeDecls.get(named.getName());
                if (!named.hasTypeArgs()) {
                    if (decl != null && decl.isGeneric()) {
                        throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, named.getName(), location,
                                "Generic type '" + named.getName() + "' used without type arguments");
                    }
                    return named;
                }
                int depth = TypeSubstitutor.substitute(named, bindings).nestingDepth() - 1;
                List<TypeRef> args = new ArrayList<>();
                for (TypeRef arg : named.getTypeArgs()) {
                    args.add(transformType(arg));
                }
                if (decl == null) {
                    return externalInstance(InstantiationKey.Kind.TYPE, named.getName(), args);
                }
                if (!decl.isGeneric()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, named.toString(), location,
                            "Type '" + named.getName() + "' is not generic");
                }
                if (decl.getTypeParams().size() != args.size()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, named.toString(), location,
                            "Type '" + named.getName() + "' expects " + decl.getTypeParams().size()
                                    + " type arguments, got " + args.size());
                }
                return new NamedType(requestType(decl, args, depth, location));
            }

            /**
             * 引用依赖模块中的泛型：名字只由键决定，实例由声明它的模块生成。
             * 批内编译时把请求登记给声明模块；声明模块不在批内时视为已经提供了该实例。
             */
            private NamedType externalInstance(InstantiationKey.Kind kind, String name, List<TypeRef> args) {
                if (unit.getUses().isEmpty()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, name, location,
                            "Unknown generic '" + name + "'");
                }
                InstantiationKey key = new InstantiationKey(kind, name, args);
                InstantiationRequests requests = ctx.getRequests();
                if (requests != null) {
                    String owner = requests.declaringModule(unit.getUses(), kind, name);
                    if (owner == null) {
                        if (allUsesInBatch(requests)) {
                            throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, name, location,
                                    "Unknown generic '" + name + "': no module in " + unit.getUses() + " declares it");
                        }
                    } else {
                        int expected = requests.arity(owner, kind, name);
                        if (expected != args.size()) {
                            throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, key.toString(), location,
                                    "'" + name + "' of module " + owner + " expects " + expected
                                            + " type arguments, got " + args.size());
                        }
                        for (TypeRef arg : args) {
                            requireVisibleFrom(owner, key, arg);
                        }
                        requests.request(owner, key, unit.getName(), location);
                    }
                }
                String instance = TypeNameEncoder.instanceName(name, args);
                LOG.fine("外部泛型实例 " + instance);
                return new NamedType(instance);
            }

            private boolean allUsesInBatch(InstantiationRequests requests) {
                for (String dep : unit.getUses()) {
                    if (!requests.contains(dep)) return false;
                }
                return true;
            }

            /**
             * 实例在声明模块的头文件中生成，实参不能引用本模块的类型（声明模块看不到它们）。
             */
            private void requireVisibleFrom(String owner, InstantiationKey key, TypeRef arg) {
                if (arg instanceof PointerType) {
                    requireVisibleFrom(owner, key, ((PointerType) arg).getPointee());
                } else if (arg instanceof ArrayType) {
                    requireVisibleFrom(owner, key, ((ArrayType) arg).getElementType());
                } else if (arg instanceof NamedType) {
                    String argName = ((NamedType) arg).getName();
                    if (typeDecls.containsKey(argName) || table.containsName(argName)) {
                        throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, key.toString(), location,
                                "Cannot instantiate " + key + " in module " + owner + ": type '" + argName
                                        + "' is declared in module " + unit.getName());
                    }
                }
            }

            @Override
            public TreeNode visitCall(CallExpr node, Void context) {
                FunctionDecl callee = functionDecls.get(node.getCallee());
                if (node.getTypeArgs().isEmpty()) {
                    if (callee != null && callee.isGeneric()) {
                        throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, node.getCallee(), location,
                                "Call to generic function '" + node.getCallee() + "' without type arguments");
                    }
                    return super.visitCall(node, context);
                }
                int depth = 0;
                List<TypeRef> args = new ArrayList<>();
                for (TypeRef arg : node.getTypeArgs()) {
                    depth = Math.max(depth, TypeSubstitutor.substitute(arg, bindings).nestingDepth());
                    args.add(transformType(arg));
                }
                String name;
                if (callee == null) {
                    name = externalInstance(InstantiationKey.Kind.FUNCTION, node.getCallee(), args).getName();
                } else if (!callee.isGeneric()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, node.getCallee(), location,
                            "Function '" + node.getCallee() + "' is not generic");
                } else if (callee.getTypeParams().size() != args.size()) {
                    throw ctx.error(ErrorKind.UNRESOLVED_GENERIC, node.getCallee(), location,
                            "Function '" + node.getCallee() + "' expects " + callee.getTypeParams().size()
                                    + " type arguments, got " + args.size());
                } else {
                    name = requestFunction(callee, args, depth, location);
                }
                return new CallExpr(node.getLocation(), transformType(node.getType()), name,
                        Collections.<TypeRef>emptyList(), transformExprs(node.getArgs()));
            }
        }
    }

    private static final class Frame {
        final InstantiationKey key;
        final int depth;

        Frame(InstantiationKey key, int depth) {
            this.key = key;
            this.depth = depth;
        }
    }
}
