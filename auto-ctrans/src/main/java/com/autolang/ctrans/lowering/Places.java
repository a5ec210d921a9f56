package com.autolang.ctrans.lowering;

import com.autolang.tree.expr.*;
import com.autolang.tree.type.PointerType;

/**
 * 可寻址位置判断。
 */
public final class Places {

    private Places() {
    }

    /**
     * 表达式是否指向一个可取地址的存储位置（变量、self、它们的字段和元素、指针解引用）。
     */
    public static boolean isPlace(Expression expr) {
        if (expr instanceof Identifier || expr instanceof SelfExpr || expr instanceof SelfFieldExpr) {
            return true;
        }
        if (expr instanceof FieldAccess) {
            Expression target = ((FieldAccess) expr).getTarget();
            return target.getType() instanceof PointerType || isPlace(target);
        }
        if (expr instanceof IndexExpr) {
            Expression target = ((IndexExpr) expr).getTarget();
            return target.getType() instanceof PointerType || isPlace(target);
        }
        return expr instanceof UnaryExpr && ((UnaryExpr) expr).getOperator() == UnaryExpr.Operator.DEREF;
    }
}
