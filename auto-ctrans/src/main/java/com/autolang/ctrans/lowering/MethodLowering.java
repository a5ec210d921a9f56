package com.autolang.ctrans.lowering;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.emit.EmittedSymbol;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.ctrans.ownership.SignatureBindings;
import com.autolang.ctrans.pass.TransPass;
import com.autolang.tree.decl.FunctionDecl;
import com.autolang.tree.decl.MethodDecl;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.stmt.Block;
import com.autolang.tree.type.NamedType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 方法降级：每个方法成为名为 {@code 类型名_方法名} 的自由函数，
 * 实例方法带上 self 参数（策略取自绑定表），函数体经 {@link BodyLowering} 改写。
 * 所有函数名在此登记到符号表。
 */
public class MethodLowering implements TransPass<ResolvedModule, LoweredModule> {
    private static final Logger LOG = Logger.getLogger(MethodLowering.class.getName());

    @Override
    public String getName() {
        return "method-lowering";
    }

    public static String mangle(String owner, String method) {
        return owner + "_" + method;
    }

    @Override
    public LoweredModule run(ResolvedModule module, CompilationContext ctx) {
        List<LoweredFunction> functions = new ArrayList<>();
        for (TypeDecl type : module.getTypes()) {
            for (MethodDecl method : type.getMethods()) {
                String cName = mangle(type.getName(), method.getName());
                String origin = "method " + type.getName() + "." + method.getName();
                ctx.getSymbols().register(cName, EmittedSymbol.Kind.FUNCTION, origin, method.getLocation());
                SignatureBindings bindings = ctx.getBindings().forMethod(type.getName(), method.getName());
                NamedType selfType = method.isStatic() ? null : new NamedType(type.getName());
                functions.add(new LoweredFunction(cName, origin, method.getLocation(), bindings,
                        method.getReturnType(), lowerBody(method.getBody(), selfType, ctx), false, null));
            }
        }
        for (FunctionDecl fn : module.getFunctions()) {
            String origin = "fn " + fn.getName();
            ctx.getSymbols().register(fn.getName(), EmittedSymbol.Kind.FUNCTION, origin, fn.getLocation());
            functions.add(new LoweredFunction(fn.getName(), origin, fn.getLocation(),
                    ctx.getBindings().forFunction(fn.getName()), fn.getReturnType(),
                    lowerBody(fn.getBody(), null, ctx), fn.isMain(), fn.getHeader()));
        }
        LOG.fine(module.getName() + ": " + functions.size() + " 个函数");
        return new LoweredModule(module.getName(), module.getUses(), module.getTypes(), functions,
                module.getAliases(), module.getSpecs());
    }

    private static Block lowerBody(Block body, NamedType selfType, CompilationContext ctx) {
        if (body == null) return null;
        return new BodyLowering(ctx, new LoweringContext(), selfType).transformBlock(body);
    }
}
