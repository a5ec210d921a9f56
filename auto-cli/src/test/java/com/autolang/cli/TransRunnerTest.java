package com.autolang.cli;

import com.autolang.tree.module.Scenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransRunner 与命令行解析测试
 */
class TransRunnerTest {

    private static final String HELLO = "{\"module\":\"hello\",\"decls\":[{\"kind\":\"fn\",\"name\":\"main\","
            + "\"returns\":\"int\",\"body\":[{\"stmt\":\"return\",\"value\":{\"expr\":\"lit\",\"kind\":\"int\",\"value\":\"0\"}}]}]}";
    private static final String BROKEN = "{\"module\":\"broken\",\"decls\":[{\"kind\":\"fn\",\"name\":\"f\","
            + "\"body\":[{\"stmt\":\"let\",\"name\":\"x\",\"type\":\"Ghost<int>\"}]}]}";

    @TempDir
    Path dir;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private TransRunner runner;

    @BeforeEach
    void setUp() throws UnsupportedEncodingException {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        runner = new TransRunner(new PrintStream(outBytes, true, "UTF-8"),
                new PrintStream(errBytes, true, "UTF-8"), false);
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private void write(String fileName, String json) throws IOException {
        Files.write(dir.resolve(fileName), json.getBytes(StandardCharsets.UTF_8));
    }

    private SourceOptions options(String... args) {
        return CommandLine.populateCommand(new SourceOptions(), args);
    }

    // ================================================================
    // 选项解析
    // ================================================================

    @Nested
    @DisplayName("选项解析")
    class OptionTests {

        @Test
        @DisplayName("默认值")
        void testDefaults() {
            SourceOptions options = options();
            assertEquals(Scenario.STATIC_C, options.scenario);
            assertEquals(4, options.indent);
            assertEquals(1, options.threads);
            assertTrue(options.modules.isEmpty());
            assertEquals(4, options.toTransOptions().getIndentSize());
        }

        @Test
        @DisplayName("场景与模块名")
        void testScenarioAndModules() {
            SourceOptions options = options("-s", "vm", "--indent", "2", "a", "b");
            assertEquals(Scenario.fromName("vm"), options.scenario);
            assertEquals(2, options.toTransOptions().getIndentSize());
            assertEquals(2, options.modules.size());
        }

        @Test
        @DisplayName("未知场景")
        void testUnknownScenario() {
            assertThrows(CommandLine.ParameterException.class, () -> options("-s", "jvm"));
        }
    }

    // ================================================================
    // 执行
    // ================================================================

    @Nested
    @DisplayName("执行")
    class RunTests {

        @Test
        @DisplayName("编译目录中的全部模块")
        void testTransAll() throws IOException {
            write("hello.at.json", HELLO);
            Path output = dir.resolve("build");

            int code = runner.trans(options("-d", dir.toString()), output);

            assertEquals(0, code, err());
            assertTrue(out().contains("编译成功！1 个模块"), out());
            assertTrue(Files.exists(output.resolve("hello.h")));
            String source = new String(Files.readAllBytes(output.resolve("hello.c")), StandardCharsets.UTF_8);
            assertTrue(source.contains("int main(void) {\n    return 0;\n}"), source);
        }

        @Test
        @DisplayName("检查模式不写文件")
        void testCheck() throws IOException {
            write("hello.at.json", HELLO);
            int code = runner.trans(options("-d", dir.toString(), "hello"), null);
            assertEquals(0, code);
            assertTrue(out().contains("检查通过: 1 个模块"));
            assertFalse(Files.exists(dir.resolve("hello.h")));
        }

        @Test
        @DisplayName("失败模块打印错误并返回 1")
        void testFailure() throws IOException {
            write("hello.at.json", HELLO);
            write("broken.at.json", BROKEN);
            Path output = dir.resolve("build");

            int code = runner.trans(options("-d", dir.toString(), "-j", "2"), output);

            assertEquals(1, code);
            assertTrue(err().contains("错误: "), err());
            assertTrue(err().contains("Ghost"), err());
            assertTrue(Files.exists(output.resolve("hello.h")));
            assertFalse(Files.exists(output.resolve("broken.h")));
        }

        @Test
        @DisplayName("目录不存在")
        void testMissingDir() {
            int code = runner.trans(options("-d", dir.resolve("nope").toString()), null);
            assertEquals(1, code);
            assertTrue(err().contains("目录不存在"));
        }

        @Test
        @DisplayName("目录中没有片段")
        void testEmptyDir() {
            int code = runner.trans(options("-d", dir.toString()), null);
            assertEquals(1, code);
            assertTrue(err().contains("没有片段文件"));
        }
    }

    @Test
    @DisplayName("子命令经由 picocli 执行")
    void testCommandLine() throws IOException {
        write("hello.at.json", HELLO);
        Path output = dir.resolve("c");
        int code = new CommandLine(new Main()).execute("trans", "-d", dir.toString(), "-o", output.toString());
        assertEquals(0, code);
        assertTrue(Files.exists(output.resolve("hello.c")));
    }
}
