package com.autolang.ctrans.ownership;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 绑定表。每个签名只附加一次，之后的阶段只读。
 * 键：自由函数为函数名，方法为 {@code 类型名.方法名}（均为单态化后的名字）。
 * 调用依赖模块的函数时，签名从导入的依赖绑定表中查找，传参方式与依赖模块的原型一致。
 */
public class BindingTable {
    private final Map<String, SignatureBindings> signatures = new LinkedHashMap<>();
    private final List<BindingTable> imports = new ArrayList<>();

    public void importFrom(BindingTable dependency) {
        if (dependency != this && !imports.contains(dependency)) imports.add(dependency);
    }

    public static String methodKey(String owner, String method) {
        return owner + "." + method;
    }

    void attach(String key, SignatureBindings bindings) {
        if (signatures.containsKey(key)) {
            throw new IllegalStateException("Bindings already attached for " + key);
        }
        signatures.put(key, bindings);
    }

    public SignatureBindings forFunction(String name) {
        return lookup(name);
    }

    public SignatureBindings forMethod(String owner, String method) {
        return lookup(methodKey(owner, method));
    }

    private SignatureBindings lookup(String key) {
        SignatureBindings found = signatures.get(key);
        if (found != null) return found;
        for (BindingTable dep : imports) {
            found = dep.lookup(key);
            if (found != null) return found;
        }
        return null;
    }

    /**
     * 本模块自己附加的签名（不含导入）。
     */
    public Map<String, SignatureBindings> getAll() {
        return Collections.unmodifiableMap(signatures);
    }
}
