package com.autolang.tree.pattern;

import com.autolang.tree.SourceLocation;

/**
 * 兜底模式（else / _），binding 非空时把整个值绑定到该名字。
 */
public class WildcardPattern extends Pattern {
    private final String binding;

    public WildcardPattern(SourceLocation location, String binding) {
        super(location);
        this.binding = binding;
    }

    public String getBinding() {
        return binding;
    }

    @Override
    public boolean isCatchAll() {
        return true;
    }
}
