package com.autolang.tree.type;

/**
 * 已解析类型基类。
 * 上游已完成名称解析，这里只剩下泛型参数尚待实例化。
 */
public abstract class TypeRef {

    /**
     * 类型中是否还含有未替换的泛型参数。
     */
    public abstract boolean containsTypeParam();

    /**
     * 泛型嵌套深度：List&lt;List&lt;int&gt;&gt; 为 2，int 为 0。
     */
    public abstract int nestingDepth();

    public boolean isVoid() {
        return this instanceof PrimitiveType && ((PrimitiveType) this).getKind() == PrimitiveType.Kind.VOID;
    }
}
