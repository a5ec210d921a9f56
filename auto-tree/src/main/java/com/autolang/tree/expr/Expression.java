package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeNode;
import com.autolang.tree.type.TypeRef;

/**
 * 表达式基类。type 为上游解析出的类型（可能仍含泛型参数）。
 */
public abstract class Expression extends TreeNode {
    protected final TypeRef type;

    protected Expression(SourceLocation location, TypeRef type) {
        super(location);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }
}
