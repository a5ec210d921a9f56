package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;

/**
 * 显式标记为底层访问的代码块，块内允许取地址。
 */
public class LowLevelBlock extends Statement {
    private final Block body;

    public LowLevelBlock(SourceLocation location, Block body) {
        super(location);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLowLevelBlock(this, context);
    }
}
