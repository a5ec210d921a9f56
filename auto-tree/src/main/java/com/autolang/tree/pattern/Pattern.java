package com.autolang.tree.pattern;

import com.autolang.tree.SourceLocation;

/**
 * 匹配模式基类
 */
public abstract class Pattern {
    protected final SourceLocation location;

    protected Pattern(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * 是否为兜底分支
     */
    public boolean isCatchAll() {
        return false;
    }
}
