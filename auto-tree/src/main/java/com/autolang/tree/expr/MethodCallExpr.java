package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.NamedType;
import com.autolang.tree.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法调用。owner 为已解析的所属类型；静态方法调用时 receiver 为 null。
 */
public class MethodCallExpr extends Expression {
    private final NamedType owner;
    private final String method;
    private final Expression receiver;
    private final List<Expression> args;

    public MethodCallExpr(SourceLocation location, TypeRef type, NamedType owner, String method,
                          Expression receiver, List<Expression> args) {
        super(location, type);
        this.owner = owner;
        this.method = method;
        this.receiver = receiver;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public NamedType getOwner() {
        return owner;
    }

    public String getMethod() {
        return method;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public boolean isStaticCall() {
        return receiver == null;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCall(this, context);
    }
}
