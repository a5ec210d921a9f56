package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 数组下标访问
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;

    public IndexExpr(SourceLocation location, TypeRef type, Expression target, Expression index) {
        super(location, type);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitIndex(this, context);
    }
}
