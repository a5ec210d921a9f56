package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.type.TypeRef;

/**
 * 记录字段或变体负载字段。
 */
public class FieldDecl extends Declaration {

    private final TypeRef type;
    private final Visibility visibility;

    public FieldDecl(SourceLocation location, String name, TypeRef type, Visibility visibility) {
        super(location, name);
        this.type = type;
        this.visibility = visibility != null ? visibility : Visibility.PUBLIC;
    }

    public FieldDecl(SourceLocation location, String name, TypeRef type) {
        this(location, name, type, Visibility.PUBLIC);
    }

    public TypeRef getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public FieldDecl withType(TypeRef newType) {
        return newType == type ? this : new FieldDecl(location, name, newType, visibility);
    }
}
