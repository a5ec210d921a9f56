package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.stmt.Block;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 顶层自由函数。
 * <p>
 * body 为 null 表示外部提供；header 非空时由系统头文件提供（如 printf 来自 stdio.h）。
 * lowLevel 函数体整体视为底层代码块，允许取地址。
 */
public class FunctionDecl extends Declaration {

    private final List<String> typeParams;
    private final List<ParamDecl> params;
    private final TypeRef returnType;
    private final Block body;
    private final boolean lowLevel;
    private final String header;

    public FunctionDecl(SourceLocation location, String name, List<String> typeParams,
                        List<ParamDecl> params, TypeRef returnType, Block body,
                        boolean lowLevel, String header) {
        super(location, name);
        this.typeParams = typeParams != null
                ? Collections.unmodifiableList(new ArrayList<>(typeParams))
                : Collections.<String>emptyList();
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
        this.body = body;
        this.lowLevel = lowLevel;
        this.header = header;
    }

    public FunctionDecl(SourceLocation location, String name, List<ParamDecl> params,
                        TypeRef returnType, Block body) {
        this(location, name, null, params, returnType, body, false, null);
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
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

    public boolean isLowLevel() {
        return lowLevel;
    }

    public String getHeader() {
        return header;
    }

    public boolean isMain() {
        return "main".equals(name);
    }
}
