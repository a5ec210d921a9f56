package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;

/**
 * 无条件循环，只能通过 break/return 退出。
 */
public class LoopStmt extends Statement {
    private final Block body;

    public LoopStmt(SourceLocation location, Block body) {
        super(location);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLoop(this, context);
    }
}
