package com.autolang.tree;

/**
 * 程序树节点基类（语句、表达式）。
 */
public abstract class TreeNode {
    protected final SourceLocation location;

    protected TreeNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(TreeVisitor<R, C> visitor, C context);
}
