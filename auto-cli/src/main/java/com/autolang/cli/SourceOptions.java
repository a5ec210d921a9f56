package com.autolang.cli;

import com.autolang.ctrans.TransOptions;
import com.autolang.tree.module.Scenario;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * trans 与 check 共用的选项
 */
public class SourceOptions {

    @Option(names = {"-d", "--dir"}, defaultValue = ".", description = "片段目录（默认当前目录）")
    Path sourceDir;

    @Option(names = {"-s", "--scenario"}, defaultValue = "c", converter = ScenarioConverter.class,
            description = "目标场景: c, vm（默认 c）")
    Scenario scenario;

    @Option(names = "--header-style", defaultValue = "PRAGMA_ONCE",
            description = "头文件保护方式: ${COMPLETION-CANDIDATES}（默认 ${DEFAULT-VALUE}）")
    TransOptions.HeaderStyle headerStyle;

    @Option(names = "--indent", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indent;

    @Option(names = {"-j", "--threads"}, defaultValue = "1", description = "并行编译线程数")
    int threads;

    @Option(names = {"-v", "--verbose"}, description = "输出各阶段日志")
    boolean verbose;

    @Parameters(arity = "0..*", description = "模块名（默认编译目录中的全部模块）")
    List<String> modules = new ArrayList<>();

    TransOptions toTransOptions() {
        TransOptions options = new TransOptions();
        options.setHeaderStyle(headerStyle);
        options.setIndentSize(indent);
        return options;
    }

    static class ScenarioConverter implements CommandLine.ITypeConverter<Scenario> {
        @Override
        public Scenario convert(String value) {
            try {
                return Scenario.fromName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException("未知场景 '" + value + "'（可选: c, vm）");
            }
        }
    }
}
