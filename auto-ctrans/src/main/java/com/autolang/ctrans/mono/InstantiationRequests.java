package com.autolang.ctrans.mono;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.decl.FunctionDecl;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.module.ModuleUnit;

import java.util.*;

/**
 * 一个批次内跨模块的实例化请求表。
 * <p>
 * 依赖方单态化时把用到的外部泛型实例登记给声明模块；声明模块随后单态化，
 * 把登记给它的实例与本地实例一起生成。实例因此只出现在声明模块的头文件中。
 * 登记与读取可能来自不同线程，都经过本对象的锁。
 */
public class InstantiationRequests {
    /** 模块 → 泛型模板名 → 类型参数个数 */
    private final Map<String, Map<String, Integer>> typeTemplates = new HashMap<>();
    private final Map<String, Map<String, Integer>> functionTemplates = new HashMap<>();
    private final Map<String, LinkedHashMap<InstantiationKey, Request>> requests = new HashMap<>();

    public InstantiationRequests(Collection<ModuleUnit> units) {
        for (ModuleUnit unit : units) {
            Map<String, Integer> types = new HashMap<>();
            for (TypeDecl t : unit.getTypes()) {
                if (t.isGeneric()) types.put(t.getName(), t.getTypeParams().size());
            }
            Map<String, Integer> functions = new HashMap<>();
            for (FunctionDecl f : unit.getFunctions()) {
                if (f.isGeneric()) functions.put(f.getName(), f.getTypeParams().size());
            }
            typeTemplates.put(unit.getName(), types);
            functionTemplates.put(unit.getName(), functions);
        }
    }

    /**
     * 模块是否属于本批次。
     */
    public boolean contains(String module) {
        return typeTemplates.containsKey(module);
    }

    /**
     * 在 uses 列出的批内模块中查找声明该泛型模板的模块，找不到返回 null。
     */
    public String declaringModule(List<String> uses, InstantiationKey.Kind kind, String genericName) {
        for (String dep : uses) {
            Map<String, Integer> names = templates(kind).get(dep);
            if (names != null && names.containsKey(genericName)) return dep;
        }
        return null;
    }

    /**
     * 声明模块中该模板的类型参数个数。
     */
    public int arity(String module, InstantiationKey.Kind kind, String genericName) {
        Integer count = templates(kind).get(module).get(genericName);
        if (count == null) {
            throw new IllegalArgumentException("Module " + module + " declares no generic " + genericName);
        }
        return count;
    }

    private Map<String, Map<String, Integer>> templates(InstantiationKey.Kind kind) {
        return kind == InstantiationKey.Kind.TYPE ? typeTemplates : functionTemplates;
    }

    public synchronized void request(String declaringModule, InstantiationKey key,
                                     String fromModule, SourceLocation location) {
        LinkedHashMap<InstantiationKey, Request> forModule = requests.get(declaringModule);
        if (forModule == null) {
            forModule = new LinkedHashMap<>();
            requests.put(declaringModule, forModule);
        }
        if (!forModule.containsKey(key)) {
            forModule.put(key, new Request(key, fromModule, location));
        }
    }

    /**
     * 登记给某模块的请求，按登记顺序。
     */
    public synchronized List<Request> requestsFor(String module) {
        LinkedHashMap<InstantiationKey, Request> forModule = requests.get(module);
        if (forModule == null) return Collections.emptyList();
        return new ArrayList<>(forModule.values());
    }

    public static final class Request {
        private final InstantiationKey key;
        private final String fromModule;
        private final SourceLocation location;

        Request(InstantiationKey key, String fromModule, SourceLocation location) {
            this.key = key;
            this.fromModule = fromModule;
            this.location = location;
        }

        public InstantiationKey getKey() {
            return key;
        }

        public String getFromModule() {
            return fromModule;
        }

        public SourceLocation getLocation() {
            return location;
        }
    }
}
