package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 自由函数调用。typeArgs 为上游推断出的显式泛型实参。
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<TypeRef> typeArgs;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, TypeRef type, String callee,
                    List<TypeRef> typeArgs, List<Expression> args) {
        super(location, type);
        this.callee = callee;
        this.typeArgs = typeArgs != null
                ? Collections.unmodifiableList(new ArrayList<>(typeArgs))
                : Collections.<TypeRef>emptyList();
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getCallee() {
        return callee;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
