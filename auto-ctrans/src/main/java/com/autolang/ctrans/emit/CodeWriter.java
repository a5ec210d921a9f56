package com.autolang.ctrans.emit;

/**
 * C 文本输出缓冲，跟踪缩进层级。
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    public CodeWriter newLine() {
        output.append('\n');
        atLineStart = true;
        return this;
    }

    /**
     * 输出完整的一行
     */
    public CodeWriter line(String text) {
        return append(text).newLine();
    }

    /**
     * 追加空行（不产生连续空行，也不在开头产生空行）
     */
    public CodeWriter blankLine() {
        if (output.length() == 0 || endsWith("\n\n")) return this;
        if (!endsWith("\n")) output.append('\n');
        output.append('\n');
        atLineStart = true;
        return this;
    }

    private boolean endsWith(String suffix) {
        int start = output.length() - suffix.length();
        return start >= 0 && output.indexOf(suffix, start) == start;
    }

    public boolean isEmpty() {
        return output.length() == 0;
    }

    public String getOutput() {
        return output.toString();
    }
}
