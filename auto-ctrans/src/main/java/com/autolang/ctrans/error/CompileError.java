package com.autolang.ctrans.error;

import com.autolang.tree.SourceLocation;

/**
 * 编译诊断条目。核心只构造它，由命令行负责渲染。
 */
public final class CompileError {
    private final ErrorKind kind;
    private final String module;
    private final String symbol;
    private final SourceLocation location;
    private final String message;

    public CompileError(ErrorKind kind, String module, String symbol, SourceLocation location, String message) {
        this.kind = kind;
        this.module = module;
        this.symbol = symbol;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.message = message;
    }

    public ErrorKind getKind() { return kind; }
    public String getModule() { return module; }
    public String getSymbol() { return symbol; }
    public SourceLocation getLocation() { return location; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (module != null) sb.append(" [").append(module).append(']');
        if (symbol != null) sb.append(' ').append(symbol);
        sb.append(": ").append(message);
        if (location.isKnown()) sb.append(" (").append(location).append(')');
        return sb.toString();
    }
}
