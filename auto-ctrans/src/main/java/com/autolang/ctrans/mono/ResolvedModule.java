package com.autolang.ctrans.mono;

import com.autolang.tree.decl.FunctionDecl;
import com.autolang.tree.decl.SpecDecl;
import com.autolang.tree.decl.TypeAliasDecl;
import com.autolang.tree.decl.TypeDecl;
import com.autolang.tree.module.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单态化后的模块：所有声明都不再含泛型参数，类型别名已在引用处展开。
 */
public class ResolvedModule {
    private final String name;
    private final Scenario scenario;
    private final List<String> uses;
    private final List<TypeDecl> types;
    private final List<FunctionDecl> functions;
    private final List<TypeAliasDecl> aliases;
    private final List<SpecDecl> specs;

    public ResolvedModule(String name, Scenario scenario, List<String> uses,
                          List<TypeDecl> types, List<FunctionDecl> functions) {
        this(name, scenario, uses, types, functions,
                Collections.<TypeAliasDecl>emptyList(), Collections.<SpecDecl>emptyList());
    }

    public ResolvedModule(String name, Scenario scenario, List<String> uses,
                          List<TypeDecl> types, List<FunctionDecl> functions,
                          List<TypeAliasDecl> aliases, List<SpecDecl> specs) {
        this.name = name;
        this.scenario = scenario;
        this.uses = Collections.unmodifiableList(new ArrayList<>(uses));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.aliases = Collections.unmodifiableList(new ArrayList<>(aliases));
        this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
    }

    public String getName() {
        return name;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<TypeDecl> getTypes() {
        return types;
    }

    public List<FunctionDecl> getFunctions() {
        return functions;
    }

    /**
     * 供 C 使用方的别名，目标类型已解析。
     */
    public List<TypeAliasDecl> getAliases() {
        return aliases;
    }

    /**
     * 具体规格：非泛型规格与被类型用到的泛型规格实例。
     */
    public List<SpecDecl> getSpecs() {
        return specs;
    }

    public SpecDecl findSpec(String specName) {
        for (SpecDecl s : specs) {
            if (s.getName().equals(specName)) return s;
        }
        return null;
    }

    public TypeDecl findType(String typeName) {
        for (TypeDecl t : types) {
            if (t.getName().equals(typeName)) return t;
        }
        return null;
    }

    public FunctionDecl findFunction(String functionName) {
        for (FunctionDecl f : functions) {
            if (f.getName().equals(functionName)) return f;
        }
        return null;
    }
}
