package com.autolang.tree.expr;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.TreeVisitor;
import com.autolang.tree.type.TypeRef;

/**
 * 赋值表达式（含复合赋值）
 */
public class AssignExpr extends Expression {

    public enum Operator {
        ASSIGN("="), ADD("+="), SUB("-="), MUL("*="), DIV("/="), MOD("%=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unknown assignment operator: " + symbol);
        }
    }

    private final Operator operator;
    private final Expression target;
    private final Expression value;

    public AssignExpr(SourceLocation location, TypeRef type, Operator operator,
                      Expression target, Expression value) {
        super(location, type);
        this.operator = operator;
        this.target = target;
        this.value = value;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
