package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 字段访问 target.field
 */
public class FieldAccess extends Expression {
    private final Expression target;
    private final String field;

    public FieldAccess(SourceLocation location, TypeRef type, Expression target, String field) {
        super(location, type);
        this.target = target;
        this.field = field;
    }

    public Expression getTarget() {
        return target;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccess(this, context);
    }
}
