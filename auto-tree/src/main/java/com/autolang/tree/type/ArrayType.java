package com.autolang.tree.type;

/**
 * 定长数组 [n]T。
 */
public final class ArrayType extends TypeRef {

    private final TypeRef elementType;
    private final int length;

    public ArrayType(TypeRef elementType, int length) {
        this.elementType = elementType;
        this.length = length;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public int getLength() {
        return length;
    }

    @Override
    public boolean containsTypeParam() {
        return elementType.containsTypeParam();
    }

    @Override
    public int nestingDepth() {
        return elementType.nestingDepth();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return length == that.length && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31 + length;
    }

    @Override
    public String toString() {
        return "[" + length + "]" + elementType;
    }
}
