package com.autolang.ctrans.lowering;

import com.autolang.tree.decl.SpecDecl;
import com.autolang.tree.decl.TypeAliasDecl;
import com.autolang.tree.decl.TypeDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法降级后的模块：具体类型声明加一组扁平的函数。
 */
public class LoweredModule {
    private final String name;
    private final List<String> uses;
    private final List<TypeDecl> types;
    private final List<LoweredFunction> functions;
    private final List<TypeAliasDecl> aliases;
    private final List<SpecDecl> specs;

    public LoweredModule(String name, List<String> uses, List<TypeDecl> types, List<LoweredFunction> functions) {
        this(name, uses, types, functions, Collections.<TypeAliasDecl>emptyList(), Collections.<SpecDecl>emptyList());
    }

    public LoweredModule(String name, List<String> uses, List<TypeDecl> types, List<LoweredFunction> functions,
                         List<TypeAliasDecl> aliases, List<SpecDecl> specs) {
        this.name = name;
        this.uses = Collections.unmodifiableList(new ArrayList<>(uses));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
        this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
    }

    public String getName() {
        return name;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<TypeDecl> getTypes() {
        return types;
    }

    public List<LoweredFunction> getFunctions() {
        return functions;
    }

    public List<TypeAliasDecl> getAliases() {
        return aliases;
    }

    public List<SpecDecl> getSpecs() {
        return specs;
    }

    public TypeDecl findType(String typeName) {
        for (TypeDecl t : types) {
            if (t.getName().equals(typeName)) return t;
        }
        return null;
    }
}
