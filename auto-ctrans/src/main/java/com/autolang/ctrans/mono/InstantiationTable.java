package com.autolang.ctrans.mono;

import com.autolang.ctrans.error.CompileException;
import com.autolang.ctrans.error.ErrorKind;
import com.autolang.tree.SourceLocation;

import java.util.*;

/**
 * 泛型实例化表。只追加，按键去重，是实例是否已生成的唯一记录。
 */
public class InstantiationTable {
    private final String moduleName;
    private final LinkedHashMap<InstantiationKey, GenericInstantiation> byKey = new LinkedHashMap<>();
    private final Map<String, InstantiationKey> byName = new HashMap<>();

    public InstantiationTable(String moduleName) {
        this.moduleName = moduleName;
    }

    public GenericInstantiation lookup(InstantiationKey key) {
        return byKey.get(key);
    }

    /**
     * 登记新实例。不同键生成同名时报 SYMBOL_COLLISION。
     */
    public GenericInstantiation register(InstantiationKey key, String name, SourceLocation location) {
        if (byKey.containsKey(key)) {
            throw new IllegalStateException("Instantiation already registered: " + key);
        }
        InstantiationKey other = byName.get(name);
        if (other != null) {
            throw new CompileException(ErrorKind.SYMBOL_COLLISION, moduleName, name, location,
                    "Instantiations " + other + " and " + key + " both mangle to '" + name + "'");
        }
        GenericInstantiation inst = new GenericInstantiation(key, name);
        byKey.put(key, inst);
        byName.put(name, key);
        return inst;
    }

    public boolean containsName(String name) {
        return byName.containsKey(name);
    }

    /**
     * 某个模板的全部实例（按实例化顺序）。
     */
    public List<GenericInstantiation> forTemplate(InstantiationKey.Kind kind, String genericName) {
        List<GenericInstantiation> result = new ArrayList<>();
        for (GenericInstantiation inst : byKey.values()) {
            if (inst.getKey().getKind() == kind && inst.getKey().getGenericName().equals(genericName)) {
                result.add(inst);
            }
        }
        return result;
    }

    public Collection<GenericInstantiation> getAll() {
        return Collections.unmodifiableCollection(byKey.values());
    }

    public int size() {
        return byKey.size();
    }
}
