package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitContinue(this, context);
    }
}
