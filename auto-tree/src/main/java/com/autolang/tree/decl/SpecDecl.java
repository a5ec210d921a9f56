package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 规格（spec）声明：一组实例方法签名，没有方法体。
 * 实现它的类型在 specs 中列出它，C 端表现为一张函数指针表（vtable）。
 */
public class SpecDecl extends Declaration {

    private final List<String> typeParams;
    private final List<MethodDecl> methods;

    public SpecDecl(SourceLocation location, String name, List<String> typeParams, List<MethodDecl> methods) {
        super(location, name);
        this.typeParams = typeParams != null
                ? Collections.unmodifiableList(new ArrayList<>(typeParams))
                : Collections.<String>emptyList();
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    public List<MethodDecl> getMethods() {
        return methods;
    }

    public MethodDecl findMethod(String methodName) {
        for (MethodDecl m : methods) {
            if (m.getName().equals(methodName)) return m;
        }
        return null;
    }

    /**
     * 以新名字、新方法复制本声明（不再是泛型）。
     */
    public SpecDecl rebuild(String newName, List<MethodDecl> newMethods) {
        return new SpecDecl(location, newName, Collections.<String>emptyList(), newMethods);
    }
}
