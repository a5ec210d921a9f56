package com.autolang.ctrans;

/**
 * C 后端配置
 */
public class TransOptions {

    /**
     * 头文件保护方式
     */
    public enum HeaderStyle {
        PRAGMA_ONCE,
        INCLUDE_GUARD
    }

    private HeaderStyle headerStyle = HeaderStyle.PRAGMA_ONCE;
    private int indentSize = 4;
    private int smallAggregateLimit = 16;
    private int pointerSize = 8;

    public TransOptions() {
    }

    public HeaderStyle getHeaderStyle() {
        return headerStyle;
    }

    public void setHeaderStyle(HeaderStyle headerStyle) {
        this.headerStyle = headerStyle;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    /**
     * 不超过该字节数的聚合类型按值传递
     */
    public int getSmallAggregateLimit() {
        return smallAggregateLimit;
    }

    public void setSmallAggregateLimit(int smallAggregateLimit) {
        this.smallAggregateLimit = smallAggregateLimit;
    }

    public int getPointerSize() {
        return pointerSize;
    }

    public void setPointerSize(int pointerSize) {
        this.pointerSize = pointerSize;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
