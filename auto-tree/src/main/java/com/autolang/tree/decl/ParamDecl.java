package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.type.TypeRef;

/**
 * 函数参数。
 */
public class ParamDecl extends Declaration {

    private final TypeRef type;
    private final ParamIntent intent;

    public ParamDecl(SourceLocation location, String name, TypeRef type, ParamIntent intent) {
        super(location, name);
        this.type = type;
        this.intent = intent != null ? intent : ParamIntent.READ;
    }

    public TypeRef getType() {
        return type;
    }

    public ParamIntent getIntent() {
        return intent;
    }

    public ParamDecl withType(TypeRef newType) {
        return newType == type ? this : new ParamDecl(location, name, newType, intent);
    }
}
