package com.autolang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * autoc CLI 入口点（picocli）
 */
@Command(name = "autoc", version = "autoc 0.1.0",
         mixinStandardHelpOptions = true,
         description = "把 auto 程序树编译为 C 头文件和源文件",
         subcommands = {TransCommand.class, CheckCommand.class})
public class Main implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding 反映操作系统原生编码）。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
