package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 标识符引用（局部变量、参数或全局常量）
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, TypeRef type, String name) {
        super(location, type);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
