package com.autolang.ctrans.mono;

import com.autolang.tree.decl.Declaration;

/**
 * 一次泛型实例化。先登记名字，替换完成后再填入具体声明，
 * 这样模板内部对自身的引用可以直接拿到名字。
 */
public class GenericInstantiation {
    private final InstantiationKey key;
    private final String name;
    private Declaration declaration;

    public GenericInstantiation(InstantiationKey key, String name) {
        this.key = key;
        this.name = name;
    }

    public InstantiationKey getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public Declaration getDeclaration() {
        return declaration;
    }

    public boolean isComplete() {
        return declaration != null;
    }

    void complete(Declaration declaration) {
        if (this.declaration != null) {
            throw new IllegalStateException("Instantiation already completed: " + key);
        }
        this.declaration = declaration;
    }
}
