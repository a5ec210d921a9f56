package com.autolang.tree.pattern;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.expr.Literal;

/**
 * 字面量模式（标量匹配）
 */
public class LiteralPattern extends Pattern {
    private final Literal value;

    public LiteralPattern(SourceLocation location, Literal value) {
        super(location);
        this.value = value;
    }

    public Literal getValue() {
        return value;
    }
}
