package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 一元表达式（DEREF 为指针解引用）
 */
public class UnaryExpr extends Expression {

    public enum Operator {
        NEG("-"), NOT("!"), BIT_NOT("~"), DEREF("*");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            if ("not".equals(symbol)) return NOT;
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown unary operator: " + symbol);
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, TypeRef type, Operator operator, Expression operand) {
        super(location, type);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }
}
