package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 显式接收者引用 self
 */
public class SelfExpr extends Expression {

    public SelfExpr(SourceLocation location, TypeRef type) {
        super(location, type);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitSelf(this, context);
    }
}
