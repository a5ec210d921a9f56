package com.autolang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli trans 子命令：编译模块并写出 .h/.c
 */
@Command(name = "trans", description = "编译模块并写出 <module>.h 和 <module>.c")
public class TransCommand implements Callable<Integer> {

    @Mixin
    SourceOptions source;

    @Option(names = {"-o", "--output"}, defaultValue = "build/c", description = "输出目录（默认 build/c）")
    Path outputDir;

    @Override
    public Integer call() {
        return new TransRunner(System.out, System.err, source.verbose).trans(source, outputDir);
    }
}
