package com.autolang.ctrans.lowering;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.expr.Expression;
import com.autolang.tree.expr.Identifier;
import com.autolang.tree.expr.UnaryExpr;
import com.autolang.tree.stmt.LetStmt;
import com.autolang.tree.type.PrimitiveType;
import com.autolang.tree.type.TypeRef;

/**
 * 方法降级上下文。
 * 用于生成临时变量名，以及构造提升临时值所需的节点。每个函数一个实例。
 */
public class LoweringContext {

    public static final String TEMP_PREFIX = "_tmp";

    private int tempCounter = 0;

    /**
     * 生成唯一的临时变量名。
     */
    public String freshTemp() {
        return TEMP_PREFIX + (tempCounter++);
    }

    /**
     * 创建一个临时变量声明语句（可变，可以取地址传给任意引用参数）。
     */
    public LetStmt makeTemp(SourceLocation loc, String name, TypeRef type, Expression init) {
        return new LetStmt(loc, name, type, true, init);
    }

    /**
     * 创建临时变量引用。
     */
    public Identifier tempRef(SourceLocation loc, String name, TypeRef type) {
        return new Identifier(loc, type, name);
    }

    /**
     * 创建逻辑非。
     */
    public Expression not(Expression cond) {
        return new UnaryExpr(cond.getLocation(), PrimitiveType.BOOL, UnaryExpr.Operator.NOT, cond);
    }
}
