package com.autolang.tree.type;

/**
 * 显式间接引用 *T。
 * 自引用结构（链表节点等）必须经由指针字段，布局计算把它当作不透明引用。
 */
public final class PointerType extends TypeRef {

    private final TypeRef pointee;

    public PointerType(TypeRef pointee) {
        this.pointee = pointee;
    }

    public TypeRef getPointee() {
        return pointee;
    }

    @Override
    public boolean containsTypeParam() {
        return pointee.containsTypeParam();
    }

    @Override
    public int nestingDepth() {
        return pointee.nestingDepth();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PointerType && pointee.equals(((PointerType) o).pointee);
    }

    @Override
    public int hashCode() {
        return pointee.hashCode() * 7 + 1;
    }

    @Override
    public String toString() {
        return "*" + pointee;
    }
}
