package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;

/**
 * While 循环
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Block body;

    public WhileStmt(SourceLocation location, Expression condition, Block body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
