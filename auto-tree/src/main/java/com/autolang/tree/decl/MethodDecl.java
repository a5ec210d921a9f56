package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.stmt.Block;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型内声明的方法。body 为 null 表示由外部提供实现。
 */
public class MethodDecl extends Declaration {

    private final MethodKind kind;
    private final boolean mutatesReceiver;
    private final List<ParamDecl> params;
    private final TypeRef returnType;
    private final Block body;

    public MethodDecl(SourceLocation location, String name, MethodKind kind, boolean mutatesReceiver,
                      List<ParamDecl> params, TypeRef returnType, Block body) {
        super(location, name);
        this.kind = kind;
        this.mutatesReceiver = kind == MethodKind.INSTANCE && mutatesReceiver;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
        this.body = body;
    }

    public MethodKind getKind() {
        return kind;
    }

    public boolean isStatic() {
        return kind == MethodKind.STATIC;
    }

    public boolean mutatesReceiver() {
        return mutatesReceiver;
    }

    public List<ParamDecl> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean isExternal() {
        return body == null;
    }
}
