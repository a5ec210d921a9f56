package com.autolang.ctrans.batch;

import com.autolang.ctrans.AutoCTranspiler;
import com.autolang.ctrans.CompilationContext;
import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.ctrans.mono.InstantiationRequests;
import com.autolang.ctrans.mono.ResolvedModule;
import com.autolang.ctrans.pass.TransPipeline;
import com.autolang.tree.module.ModuleUnit;
import com.autolang.tree.module.Scenario;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 多模块并行编译。
 * <p>
 * 每个模块独立装配、独立上下文，分两步编译：
 * <ol>
 *   <li>单态化，按依赖的逆序：模块在所有 uses 它的批内模块之后进行，
 *       生成它们登记过来的泛型实例</li>
 *   <li>其余 pass，按依赖顺序：模块在它 uses 的批内模块完成后才开始，
 *       并导入这些模块的布局与签名绑定</li>
 * </ol>
 * 某模块失败不影响兄弟模块，依赖它的模块以 DEPENDENCY_FAILED 失败。
 * 不在本批中的依赖视为已编译。
 */
public class ModuleBatch {
    private static final Logger LOG = Logger.getLogger(ModuleBatch.class.getName());

    private final AutoCTranspiler transpiler;
    private final int threads;

    public ModuleBatch(AutoCTranspiler transpiler, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.transpiler = transpiler;
        this.threads = threads;
    }

    public BatchResult run(Collection<String> modules, Scenario scenario) {
        BatchResult result = new BatchResult();
        Set<String> names = new TreeSet<>(modules);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            // 1. 装配（I/O），得到依赖关系
            Map<String, CompletableFuture<ModuleUnit>> assembled = new TreeMap<>();
            for (final String name : names) {
                assembled.put(name, CompletableFuture.supplyAsync(() -> assemble(name, scenario), pool));
            }
            Map<String, ModuleUnit> units = new TreeMap<>();
            for (Map.Entry<String, CompletableFuture<ModuleUnit>> e : assembled.entrySet()) {
                try {
                    units.put(e.getKey(), e.getValue().join());
                } catch (CompletionException ex) {
                    fail(result, e.getKey(), ex.getCause());
                }
            }

            // 2. 逆依赖顺序单态化
            InstantiationRequests requests = new InstantiationRequests(units.values());
            Map<String, CompilationContext> contexts = new HashMap<>();
            Map<String, List<String>> dependents = new HashMap<>();
            for (ModuleUnit unit : units.values()) {
                contexts.put(unit.getName(), transpiler.getPipeline().newContext(unit.getName(), requests));
                for (String dep : unit.getUses()) {
                    if (!units.containsKey(dep)) continue;
                    List<String> users = dependents.get(dep);
                    if (users == null) {
                        users = new ArrayList<>();
                        dependents.put(dep, users);
                    }
                    users.add(unit.getName());
                }
            }
            Map<String, CompletableFuture<ResolvedModule>> resolved = new HashMap<>();
            for (String name : units.keySet()) {
                monomorphize(name, units, contexts, dependents, resolved, new HashSet<String>(), result, pool);
            }

            // 3. 按依赖调度其余 pass
            Map<String, CompletableFuture<Boolean>> scheduled = new HashMap<>();
            Batch batch = new Batch(names, units, contexts, resolved, scheduled, result, pool);
            for (String name : names) {
                batch.schedule(name, new LinkedHashSet<String>());
            }
            for (String name : names) {
                scheduled.get(name).join();
            }
        } finally {
            pool.shutdown();
        }
        return result;
    }

    private ModuleUnit assemble(String name, Scenario scenario) {
        try {
            return transpiler.assemble(name, scenario);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    /**
     * 模块在所有批内使用者单态化之后单态化，失败时 future 以 null 完成。
     * 依赖环上的边不等待，环本身在调度时报告。
     */
    private CompletableFuture<ResolvedModule> monomorphize(final String name, final Map<String, ModuleUnit> units,
                                                           final Map<String, CompilationContext> contexts,
                                                           Map<String, List<String>> dependents,
                                                           Map<String, CompletableFuture<ResolvedModule>> resolved,
                                                           Set<String> inProgress, final BatchResult result,
                                                           ExecutorService pool) {
        CompletableFuture<ResolvedModule> existing = resolved.get(name);
        if (existing != null) return existing;
        inProgress.add(name);
        List<CompletableFuture<ResolvedModule>> users = new ArrayList<>();
        List<String> userNames = dependents.get(name);
        if (userNames != null) {
            for (String user : userNames) {
                if (inProgress.contains(user)) continue;
                users.add(monomorphize(user, units, contexts, dependents, resolved, inProgress, result, pool));
            }
        }
        inProgress.remove(name);
        final TransPipeline pipeline = transpiler.getPipeline();
        CompletableFuture<ResolvedModule> task = CompletableFuture
                .allOf(users.toArray(new CompletableFuture<?>[0]))
                .thenApplyAsync(ignored -> {
                    try {
                        return pipeline.monomorphize(units.get(name), contexts.get(name));
                    } catch (RuntimeException e) {
                        fail(result, name, e);
                        return null;
                    }
                }, pool);
        resolved.put(name, task);
        return task;
    }

    /**
     * 第二步的调度状态。
     */
    private final class Batch {
        private final Set<String> names;
        private final Map<String, ModuleUnit> units;
        private final Map<String, CompilationContext> contexts;
        private final Map<String, CompletableFuture<ResolvedModule>> resolved;
        private final Map<String, CompletableFuture<Boolean>> scheduled;
        private final BatchResult result;
        private final ExecutorService pool;

        Batch(Set<String> names, Map<String, ModuleUnit> units, Map<String, CompilationContext> contexts,
              Map<String, CompletableFuture<ResolvedModule>> resolved,
              Map<String, CompletableFuture<Boolean>> scheduled, BatchResult result, ExecutorService pool) {
            this.names = names;
            this.units = units;
            this.contexts = contexts;
            this.resolved = resolved;
            this.scheduled = scheduled;
            this.result = result;
            this.pool = pool;
        }

        /**
         * 返回在模块完成后以成功与否完成的 future。
         */
        CompletableFuture<Boolean> schedule(final String name, Set<String> inProgress) {
            CompletableFuture<Boolean> existing = scheduled.get(name);
            if (existing != null) return existing;
            ModuleUnit unit = units.get(name);
            if (unit == null) {
                // 装配失败，已记录
                CompletableFuture<Boolean> failed = CompletableFuture.completedFuture(Boolean.FALSE);
                scheduled.put(name, failed);
                return failed;
            }
            inProgress.add(name);
            final List<CompletableFuture<Boolean>> deps = new ArrayList<>();
            final List<String> depNames = new ArrayList<>();
            for (String dep : unit.getUses()) {
                if (!names.contains(dep)) continue;
                if (inProgress.contains(dep)) {
                    fail(result, name, new CompileException(ErrorKind.DEPENDENCY_FAILED, name, dep, null,
                            "Cyclic module dependency: " + String.join(" -> ", inProgress) + " -> " + dep));
                    CompletableFuture<Boolean> failed = CompletableFuture.completedFuture(Boolean.FALSE);
                    scheduled.put(name, failed);
                    inProgress.remove(name);
                    return failed;
                }
                deps.add(schedule(dep, inProgress));
                depNames.add(dep);
            }
            inProgress.remove(name);
            final CompletableFuture<ResolvedModule> own = resolved.get(name);
            List<CompletableFuture<?>> waits = new ArrayList<CompletableFuture<?>>(deps);
            waits.add(own);
            CompletableFuture<Boolean> task = CompletableFuture
                    .allOf(waits.toArray(new CompletableFuture<?>[0]))
                    .thenApplyAsync(ignored -> complete(name, own.join(), deps, depNames), pool);
            scheduled.put(name, task);
            return task;
        }

        private Boolean complete(String name, ResolvedModule module, List<CompletableFuture<Boolean>> deps,
                                 List<String> depNames) {
            if (module == null) {
                // 单态化失败，已记录
                return Boolean.FALSE;
            }
            for (int i = 0; i < deps.size(); i++) {
                if (!deps.get(i).join()) {
                    fail(result, name, new CompileException(ErrorKind.DEPENDENCY_FAILED, name,
                            depNames.get(i), null, "Dependency '" + depNames.get(i) + "' failed"));
                    return Boolean.FALSE;
                }
            }
            CompilationContext ctx = contexts.get(name);
            for (String dep : depNames) {
                ctx.importFrom(contexts.get(dep));
            }
            try {
                result.succeeded(name, transpiler.getPipeline().complete(module, ctx));
                return Boolean.TRUE;
            } catch (RuntimeException e) {
                fail(result, name, e);
                return Boolean.FALSE;
            }
        }
    }

    private static void fail(BatchResult result, String name, Throwable cause) {
        LOG.log(Level.WARNING, "模块 " + name + " 编译失败: " + cause.getMessage(), cause);
        result.failed(name, cause);
    }
}
