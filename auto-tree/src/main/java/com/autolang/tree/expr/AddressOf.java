package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 取地址（仅允许出现在底层代码块中）
 */
public class AddressOf extends Expression {
    private final Expression operand;

    public AddressOf(SourceLocation location, TypeRef type, Expression operand) {
        super(location, type);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitAddressOf(this, context);
    }
}
