package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        AND("&&"), OR("||"),
        BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"), SHL("<<"), SHR(">>");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            if ("and".equals(symbol)) return AND;
            if ("or".equals(symbol)) return OR;
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpr(SourceLocation location, TypeRef type, Operator operator,
                      Expression left, Expression right) {
        super(location, type);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }
}
