package com.autolang.tree.module;

import com.autolang.tree.decl.FunctionDecl;
import com.autolang.tree.decl.SpecDecl;
import com.autolang.tree.decl.TypeAliasDecl;
import com.autolang.tree.decl.TypeDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 装配完成的单模块程序树。构建后不可变。
 */
public class ModuleUnit {
    private final String name;
    private final Scenario scenario;
    private final List<String> uses;
    private final List<TypeDecl> types;
    private final List<FunctionDecl> functions;
    private final List<TypeAliasDecl> aliases;
    private final List<SpecDecl> specs;

    public ModuleUnit(String name, Scenario scenario, List<String> uses,
                      List<TypeDecl> types, List<FunctionDecl> functions) {
        this(name, scenario, uses, types, functions,
                Collections.<TypeAliasDecl>emptyList(), Collections.<SpecDecl>emptyList());
    }

    public ModuleUnit(String name, Scenario scenario, List<String> uses,
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

    public FunctionDecl findFunction(String functionName) {
        for (FunctionDecl f : functions) {
            if (f.getName().equals(functionName)) return f;
        }
        return null;
    }
}
