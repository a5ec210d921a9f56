package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 构造和类型的一个变体值，例如 Atom.Int(42)。type 为所属 tag 类型。
 */
public class VariantInit extends Expression {
    private final String variant;
    private final List<Expression> args;

    public VariantInit(SourceLocation location, TypeRef type, String variant, List<Expression> args) {
        super(location, type);
        this.variant = variant;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getVariant() {
        return variant;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitVariantInit(this, context);
    }
}
