package com.autolang.tree.type;

/**
 * 泛型类型参数（如 List&lt;T&gt; 中的 T）。
 */
public final class TypeParamType extends TypeRef {

    private final String name;

    public TypeParamType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean containsTypeParam() {
        return true;
    }

    @Override
    public int nestingDepth() {
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeParamType && name.equals(((TypeParamType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() + 17;
    }

    @Override
    public String toString() {
        return name;
    }
}
