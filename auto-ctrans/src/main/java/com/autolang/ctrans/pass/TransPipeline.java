package com.autolang.ctrans.pass;

import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.TransOptions;
import com.autolang.ctrans.emit.CEmitter;
import com.autolang.ctrans.emit.CModuleOutput;
import com.autolang.ctrans.layout.AdtLayoutCompiler;
import com.autolang.ctrans.lowering.LoweredModule;
import com.autolang.ctrans.lowering.MethodLowering;
import com.autolang.ctrans.mono.InstantiationRequests;
import com.autolang.ctrans.mono.Monomorphizer;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.ctrans.ownership.OwnershipClassifier;
import com.autolang.tree.module.ModuleUnit;

import java.util.logging.Logger;

/**
 * C 后端 pass 管线。
 * 串联完整流程：单态化 → ADT 布局 → 所有权分类 → 方法降级 → 输出。
 * 每个模块使用独立的 {@link CompilationContext}。
 */
public class TransPipeline {
    private static final Logger LOG = Logger.getLogger(TransPipeline.class.getName());

    private final TransOptions options;
    private final TransPass<ModuleUnit, ResolvedModule> monomorphizer = new Monomorphizer();
    private final TransPass<ResolvedModule, ResolvedModule> layout = new AdtLayoutCompiler();
    private final TransPass<ResolvedModule, ResolvedModule> ownership = new OwnershipClassifier();
    private final TransPass<ResolvedModule, LoweredModule> lowering = new MethodLowering();
    private final TransPass<LoweredModule, CModuleOutput> emitter = new CEmitter();

    public TransPipeline(TransOptions options) {
        this.options = options != null ? options : new TransOptions();
    }

    public TransOptions getOptions() {
        return options;
    }

    public CompilationContext newContext(String moduleName) {
        return new CompilationContext(moduleName, options);
    }

    /**
     * 批内编译用的上下文，外部泛型实例经 requests 登记给声明模块。
     */
    public CompilationContext newContext(String moduleName, InstantiationRequests requests) {
        return new CompilationContext(moduleName, options, requests);
    }

    /**
     * 执行完整管线。
     *
     * @param unit 装配后的模块
     * @return 头文件与源文件文本
     */
    public CModuleOutput execute(ModuleUnit unit) {
        return execute(unit, newContext(unit.getName()));
    }

    public CModuleOutput execute(ModuleUnit unit, CompilationContext ctx) {
        return complete(monomorphize(unit, ctx), ctx);
    }

    public ResolvedModule monomorphize(ModuleUnit unit, CompilationContext ctx) {
        return runPass(monomorphizer, unit, ctx);
    }

    /**
     * 从单态化结果继续执行余下的 pass。批量编译在两步之间导入依赖模块的布局与绑定。
     */
    public CModuleOutput complete(ResolvedModule resolved, CompilationContext ctx) {
        LoweredModule lowered = runPass(lowering, analyze(resolved, ctx), ctx);
        return runPass(emitter, lowered, ctx);
    }

    /**
     * 只执行到方法降级（不生成文本）。
     */
    public LoweredModule executeToLowered(ModuleUnit unit, CompilationContext ctx) {
        ResolvedModule resolved = executeToResolved(unit, ctx);
        return runPass(lowering, resolved, ctx);
    }

    /**
     * 只执行到所有权分类（用于检查/调试）。
     */
    public ResolvedModule executeToResolved(ModuleUnit unit, CompilationContext ctx) {
        return analyze(monomorphize(unit, ctx), ctx);
    }

    private ResolvedModule analyze(ResolvedModule resolved, CompilationContext ctx) {
        return runPass(ownership, runPass(layout, resolved, ctx), ctx);
    }

    private static <I, O> O runPass(TransPass<I, O> pass, I input, CompilationContext ctx) {
        long start = System.nanoTime();
        O result = pass.run(input, ctx);
        LOG.fine("[" + ctx.getModuleName() + "] " + pass.getName() + " 完成, 耗时 "
                + (System.nanoTime() - start) / 1_000_000 + "ms");
        return result;
    }
}
