package com.autolang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：执行全部阶段但不写文件，只报告错误
 */
@Command(name = "check", description = "检查模块能否编译（不写文件）")
public class CheckCommand implements Callable<Integer> {

    @Mixin
    SourceOptions source;

    @Override
    public Integer call() {
        return new TransRunner(System.out, System.err, source.verbose).trans(source, null);
    }
}
