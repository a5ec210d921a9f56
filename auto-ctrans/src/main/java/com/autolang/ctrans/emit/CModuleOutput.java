package com.autolang.ctrans.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * 一个模块的两份产物：声明 {@code <module>.h} 和定义 {@code <module>.c}。
 */
public final class CModuleOutput {
    private static final Logger LOG = Logger.getLogger(CModuleOutput.class.getName());

    private final String moduleName;
    private final String header;
    private final String source;

    public CModuleOutput(String moduleName, String header, String source) {
        this.moduleName = moduleName;
        this.header = header;
        this.source = source;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getHeader() {
        return header;
    }

    public String getSource() {
        return source;
    }

    public String getHeaderFileName() {
        return moduleName + ".h";
    }

    public String getSourceFileName() {
        return moduleName + ".c";
    }

    /**
     * 写入输出目录（不存在则创建），返回头文件路径。
     */
    public Path writeTo(Path directory) throws IOException {
        Files.createDirectories(directory);
        Path h = directory.resolve(getHeaderFileName());
        Path c = directory.resolve(getSourceFileName());
        Files.write(h, header.getBytes(StandardCharsets.UTF_8));
        Files.write(c, source.getBytes(StandardCharsets.UTF_8));
        LOG.fine("写出 " + h + ", " + c);
        return h;
    }
}
