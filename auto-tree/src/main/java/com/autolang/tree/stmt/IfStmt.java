package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;

/**
 * If 语句。elseBranch 为 Block、另一个 IfStmt（else if 链）或 null。
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final Statement elseBranch;

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
