package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 字段简写 .x：隐式引用当前实例的字段。方法降级阶段会改写为 self.x。
 */
public class SelfFieldExpr extends Expression {
    private final String field;

    public SelfFieldExpr(SourceLocation location, TypeRef type, String field) {
        super(location, type);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitSelfField(this, context);
    }
}
