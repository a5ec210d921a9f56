package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 字面量。text 保存源码文本（字符串和字符字面量不含引号、未转义）。
 */
public class Literal extends Expression {

    public enum LiteralKind {
        INT, FLOAT, BOOL, CHAR, STR, NULL
    }

    private final LiteralKind kind;
    private final String text;

    public Literal(SourceLocation location, TypeRef type, LiteralKind kind, String text) {
        super(location, type);
        this.kind = kind;
        this.text = text;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
