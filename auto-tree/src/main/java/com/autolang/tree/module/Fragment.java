package com.autolang.tree.module;

import com.autolang.tree.decl.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个模块的单个片段：共享接口片段（scenario 为 null）或某个场景的专属片段。
 * 声明可以是 TypeDecl、TagDecl、FunctionDecl、ExtDecl、TypeAliasDecl 或 SpecDecl。
 */
public class Fragment {
    private final String moduleName;
    private final Scenario scenario;
    private final String fileName;
    private final List<String> uses;
    private final List<Declaration> declarations;

    public Fragment(String moduleName, Scenario scenario, String fileName,
                    List<String> uses, List<Declaration> declarations) {
        this.moduleName = moduleName;
        this.scenario = scenario;
        this.fileName = fileName != null ? fileName : moduleName;
        this.uses = uses != null
                ? Collections.unmodifiableList(new ArrayList<>(uses))
                : Collections.<String>emptyList();
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public String getModuleName() {
        return moduleName;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public boolean isShared() {
        return scenario == null;
    }

    public String getFileName() {
        return fileName;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public String toString() {
        return moduleName + (scenario != null ? "." + scenario.getSuffix() : "") + " (" + fileName + ")";
    }
}
