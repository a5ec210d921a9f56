package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
