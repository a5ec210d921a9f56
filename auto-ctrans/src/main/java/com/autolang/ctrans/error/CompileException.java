package com.autolang.ctrans.error;

import com.autolang.tree.SourceLocation;

/**
 * 编译失败。携带结构化的 {@link CompileError}，不会被重试。
 */
public class CompileException extends RuntimeException {
    private final CompileError error;

    public CompileException(CompileError error) {
        super(error.getMessage());
        this.error = error;
    }

    public CompileException(ErrorKind kind, String module, String symbol, SourceLocation location, String message) {
        this(new CompileError(kind, module, symbol, location, message));
    }

    public CompileError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }

    @Override
    public String getMessage() {
        return error.toString();
    }
}
