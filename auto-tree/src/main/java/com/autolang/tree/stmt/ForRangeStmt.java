package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;

/**
 * 有界循环：for i in from..to（inclusive 时为 from..=to）。
 */
public class ForRangeStmt extends Statement {
    private final String variable;
    private final Expression from;
    private final Expression to;
    private final boolean inclusive;
    private final Block body;

    public ForRangeStmt(SourceLocation location, String variable, Expression from, Expression to,
                        boolean inclusive, Block body) {
        super(location);
        this.variable = variable;
        this.from = from;
        this.to = to;
        this.inclusive = inclusive;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getFrom() {
        return from;
    }

    public Expression getTo() {
        return to;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitForRange(this, context);
    }
}
