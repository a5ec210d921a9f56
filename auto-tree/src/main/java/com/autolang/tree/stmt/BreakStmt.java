package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
