package com.autolang.ctrans.batch;

import com.autolang.ctrans.emit.CModuleOutput;
import com.autolang.ctrans.error.CompileError;
import com.autolang.ctrans.error.CompileException;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 批量编译结果，按模块名排序。
 */
public final class BatchResult {
    private final SortedMap<String, CModuleOutput> outputs = new TreeMap<>();
    private final SortedMap<String, Throwable> failures = new TreeMap<>();

    synchronized void succeeded(String module, CModuleOutput output) {
        outputs.put(module, output);
    }

    /**
     * 只保留模块的第一个失败原因。
     */
    synchronized void failed(String module, Throwable cause) {
        failures.putIfAbsent(module, cause);
    }

    public synchronized Map<String, CModuleOutput> getOutputs() {
        return Collections.unmodifiableMap(new TreeMap<>(outputs));
    }

    public synchronized Map<String, Throwable> getFailures() {
        return Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    /**
     * 模块的结构化错误；非编译错误（I/O、格式错误）或成功时返回 null。
     */
    public synchronized CompileError getError(String module) {
        Throwable t = failures.get(module);
        return t instanceof CompileException ? ((CompileException) t).getError() : null;
    }

    public synchronized boolean isSuccess() {
        return failures.isEmpty();
    }

    @Override
    public synchronized String toString() {
        return "BatchResult{ok=" + outputs.keySet() + ", failed=" + failures.keySet() + "}";
    }
}
