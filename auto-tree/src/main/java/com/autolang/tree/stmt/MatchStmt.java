package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模式匹配语句（源语言的 is 语句）。
 */
public class MatchStmt extends Statement {
    private final Expression target;
    private final List<MatchArm> arms;

    public MatchStmt(SourceLocation location, Expression target, List<MatchArm> arms) {
        super(location);
        this.target = target;
        this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
    }

    public Expression getTarget() {
        return target;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitMatch(this, context);
    }
}
