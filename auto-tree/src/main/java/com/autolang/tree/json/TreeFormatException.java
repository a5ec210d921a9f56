package com.autolang.tree.json;

/**
 * 程序树 JSON 格式错误
 */
public class TreeFormatException extends RuntimeException {
    private final String fileName;
    private final int line;

    public TreeFormatException(String message, String fileName) {
        this(message, fileName, 0, null);
    }

    public TreeFormatException(String message, String fileName, int line) {
        this(message, fileName, line, null);
    }

    public TreeFormatException(String message, String fileName, int line, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
        this.line = line;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (fileName != null) {
            sb.append(" in ").append(fileName);
            if (line > 0) sb.append(" at line ").append(line);
        }
        return sb.toString();
    }
}
