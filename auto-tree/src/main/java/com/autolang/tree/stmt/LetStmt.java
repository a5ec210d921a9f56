package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;
import com.autolang.tree.type.TypeRef;

/**
 * 局部绑定。mutable 记录绑定在源头处声明的可变性（let / let mut）。
 */
public class LetStmt extends Statement {
    private final String name;
    private final TypeRef declaredType;
    private final boolean mutable;
    private final Expression initializer;

    public LetStmt(SourceLocation location, String name, TypeRef declaredType,
                   boolean mutable, Expression initializer) {
        super(location);
        this.name = name;
        this.declaredType = declaredType;
        this.mutable = mutable;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public TypeRef getDeclaredType() {
        return declaredType;
    }

    /**
     * 绑定的实际类型：显式声明优先，否则取初始化表达式的类型。
     */
    public TypeRef getType() {
        if (declaredType != null) return declaredType;
        return initializer != null ? initializer.getType() : null;
    }

    public boolean isMutable() {
        return mutable;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
