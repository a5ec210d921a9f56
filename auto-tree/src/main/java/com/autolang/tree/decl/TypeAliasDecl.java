package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.type.TypeRef;

/**
 * 类型别名 {@code type Meters = int}。不带泛型参数。
 */
public class TypeAliasDecl extends Declaration {

    private final TypeRef target;

    public TypeAliasDecl(SourceLocation location, String name, TypeRef target) {
        super(location, name);
        this.target = target;
    }

    public TypeRef getTarget() {
        return target;
    }

    public TypeAliasDecl withTarget(TypeRef newTarget) {
        return newTarget == target ? this : new TypeAliasDecl(location, name, newTarget);
    }
}
