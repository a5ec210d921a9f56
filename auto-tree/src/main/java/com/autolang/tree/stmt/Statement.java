package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeNode;

/**
 * 语句基类
 */
public abstract class Statement extends TreeNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
