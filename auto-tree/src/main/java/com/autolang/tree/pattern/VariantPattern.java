package com.autolang.tree.pattern;

import com.autolang.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 变体模式：按位置把负载字段绑定到名字，"_" 跳过对应字段。
 */
public class VariantPattern extends Pattern {
    public static final String SKIP = "_";

    private final String variant;
    private final List<String> bindings;

    public VariantPattern(SourceLocation location, String variant, List<String> bindings) {
        super(location);
        this.variant = variant;
        this.bindings = bindings != null
                ? Collections.unmodifiableList(new ArrayList<>(bindings))
                : Collections.<String>emptyList();
    }

    public String getVariant() {
        return variant;
    }

    public List<String> getBindings() {
        return bindings;
    }
}
