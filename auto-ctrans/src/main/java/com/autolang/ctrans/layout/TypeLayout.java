package com.autolang.ctrans.layout;

/**
 * 具体类型的尺寸、对齐和分类。size 为 -1 表示尺寸未知（外部或不透明类型）。
 */
public final class TypeLayout {
    private final int size;
    private final int alignment;
    private final SizeClass sizeClass;

    public TypeLayout(int size, int alignment, SizeClass sizeClass) {
        this.size = size;
        this.alignment = alignment;
        this.sizeClass = sizeClass;
    }

    public int getSize() { return size; }
    public int getAlignment() { return alignment; }
    public SizeClass getSizeClass() { return sizeClass; }

    public boolean isKnown() {
        return size >= 0;
    }

    @Override
    public String toString() {
        return sizeClass + "(" + size + "/" + alignment + ")";
    }
}
