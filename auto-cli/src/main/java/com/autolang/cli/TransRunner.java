package com.autolang.cli;

import com.autolang.ctrans.AutoCTranspiler;
import com.autolang.ctrans.assemble.DirectoryFragmentSource;
import com.autolang.ctrans.batch.BatchResult;
import com.autolang.ctrans.batch.ModuleBatch;
import com.autolang.ctrans.emit.CModuleOutput;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 编译执行器：批量编译、写出文件、打印错误。
 */
public class TransRunner {

    private final PrintStream out;
    private final PrintStream err;

    public TransRunner(PrintStream out, PrintStream err, boolean verbose) {
        this.out = out;
        this.err = err;
        configureLogging(err, verbose);
    }

    /**
     * 把 JUL 日志接到错误输出。verbose 时输出 FINE 级别的阶段日志。
     */
    static void configureLogging(PrintStream stream, boolean verbose) {
        Logger root = Logger.getLogger("");
        for (Handler h : root.getHandlers()) {
            if (h instanceof StreamHandler) root.removeHandler(h);
        }
        Level level = verbose ? Level.FINE : Level.INFO;
        StreamHandler handler = new StreamHandler(stream, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        handler.setLevel(level);
        root.addHandler(handler);
        root.setLevel(level);
        Logger.getLogger("com.autolang").setLevel(level);
    }

    /**
     * 编译选定模块；outputDir 为 null 时只检查。
     *
     * @return 进程退出码
     */
    public int trans(SourceOptions options, Path outputDir) {
        Path dir = options.sourceDir;
        if (!Files.isDirectory(dir)) {
            err.println("错误: 目录不存在 - " + dir);
            return 1;
        }
        DirectoryFragmentSource source = new DirectoryFragmentSource(dir);
        Collection<String> modules = options.modules;
        try {
            if (modules.isEmpty()) {
                modules = new ArrayList<>(source.listModules());
            }
        } catch (IOException e) {
            err.println("错误: 无法读取目录 " + dir + " - " + e.getMessage());
            return 1;
        }
        if (modules.isEmpty()) {
            err.println("错误: 目录中没有片段文件 (*" + DirectoryFragmentSource.EXTENSION + ") - " + dir);
            return 1;
        }

        AutoCTranspiler transpiler = new AutoCTranspiler(source, options.toTransOptions());
        BatchResult result = new ModuleBatch(transpiler, Math.max(1, options.threads))
                .run(modules, options.scenario);

        for (Map.Entry<String, Throwable> e : result.getFailures().entrySet()) {
            err.println("错误: " + e.getValue().getMessage());
        }
        int written = 0;
        for (CModuleOutput output : result.getOutputs().values()) {
            if (outputDir == null) continue;
            try {
                output.writeTo(outputDir);
                written++;
            } catch (IOException e) {
                err.println("错误: 写出 " + output.getModuleName() + " 失败 - " + e.getMessage());
                return 1;
            }
        }
        if (!result.isSuccess()) {
            return 1;
        }
        if (outputDir != null) {
            out.println("编译成功！" + written + " 个模块 -> " + outputDir);
        } else {
            out.println("检查通过: " + result.getOutputs().size() + " 个模块");
        }
        return 0;
    }
}
