package com.autolang.ctrans.pass;

import com.autolang.ctrans.CompilationContext;

/**
 * C 后端 pass 接口。
 *
 * @param <I> 输入表示
 * @param <O> 输出表示
 */
public interface TransPass<I, O> {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 执行 pass。违反不变量时抛出 {@link com.autolang.ctrans.error.CompileException}。
     */
    O run(I input, CompilationContext ctx);
}
