package com.autolang.tree.decl;

import com.autolang.tree.SourceLocation;

/**
 * 顶层声明与成员声明的基类。
 */
public abstract class Declaration {

    protected final SourceLocation location;
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.name = name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }
}
