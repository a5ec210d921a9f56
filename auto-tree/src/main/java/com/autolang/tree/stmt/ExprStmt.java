package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;

/**
 * 表达式语句
 */
public class ExprStmt extends Statement {
    private final Expression expression;

    public ExprStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitExprStmt(this, context);
    }
}
