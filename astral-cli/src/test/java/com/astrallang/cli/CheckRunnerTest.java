package com.astrallang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

/**
 * CheckRunner 与命令行参数测试
 */
class CheckRunnerTest {

    private static final String MOVED =
            "let x: string = \"hi\";\n" +
            "let y = x;\n" +
            "let z = x;\n";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ReportConfig config;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        config = new ReportConfig();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private int run(Path... files) {
        CheckRunner runner = new CheckRunner(config,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return runner.run(Arrays.asList(files));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("退出码与文本输出")
    class TextOutputTests {

        @Test
        @DisplayName("通过检查输出 ok 并返回 0")
        void testOk() throws IOException {
            Path file = write("ok.astral", "let x = 5;\nlet y = x;\nlet z = x;\n");

            assertThat(run(file)).isEqualTo(CheckRunner.EXIT_OK);
            assertThat(stdout()).contains("ok: " + file);
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("所有权诊断输出到标准错误并返回 1")
        void testDiagnostic() throws IOException {
            Path file = write("moved.astral", MOVED);

            assertThat(run(file)).isEqualTo(CheckRunner.EXIT_DIAGNOSTICS);
            assertThat(stdout()).isEmpty();
            assertThat(stderr())
                    .contains(file + ":3:9: Error: use of moved value 'x'")
                    .contains(" 3 | let z = x;")
                    .contains("  Note: value declared at line 1 was moved at line 2")
                    .contains("  Help: consider borrowing '&x'");
        }

        @Test
        @DisplayName("--no-snippet / --no-notes 对应的配置")
        void testPlainDiagnostic() throws IOException {
            Path file = write("moved.astral", MOVED);
            config.setShowSnippet(false);
            config.setShowNotes(false);

            run(file);
            assertThat(stderr().trim()).isEqualTo(file + ":3:9: Error: use of moved value 'x'");
        }

        @Test
        @DisplayName("语法错误返回 1")
        void testSyntaxError() throws IOException {
            Path file = write("bad.astral", "let x = ;\n");

            assertThat(run(file)).isEqualTo(CheckRunner.EXIT_DIAGNOSTICS);
            assertThat(stderr())
                    .contains("语法错误: Expected expression")
                    .contains(" 1 | let x = ;");
        }

        @Test
        @DisplayName("文件不存在返回 2")
        void testMissingFile() {
            Path missing = tempDir.resolve("missing.astral");

            assertThat(run(missing)).isEqualTo(CheckRunner.EXIT_IO_ERROR);
            assertThat(stderr()).contains("文件不存在").contains("missing.astral");
        }

        @Test
        @DisplayName("多个文件取最严重的退出码，且全部被检查")
        void testMultipleFiles() throws IOException {
            Path ok = write("a.astral", "let a = 1;\n");
            Path bad = write("b.astral", MOVED);
            Path last = write("c.astral", "fn f() { while true { break; } }\n");

            assertThat(run(ok, bad, last)).isEqualTo(CheckRunner.EXIT_DIAGNOSTICS);
            assertThat(stdout()).contains("ok: " + ok).contains("ok: " + last);
        }

        @Test
        @DisplayName("静默模式不输出 ok")
        void testQuiet() throws IOException {
            config.setQuiet(true);
            assertThat(run(write("ok.astral", "let a = 1;\n"))).isZero();
            assertThat(stdout()).isEmpty();
        }
    }

    @Nested
    @DisplayName("JSON 输出")
    class JsonOutputTests {

        @Test
        @DisplayName("诊断序列化为 JSON 数组")
        void testJsonDiagnostics() throws IOException {
            config.setJson(true);
            Path file = write("moved.astral", MOVED);
            Path ok = write("ok.astral", "let a = 1;\n");

            assertThat(run(file, ok)).isEqualTo(CheckRunner.EXIT_DIAGNOSTICS);
            assertThat(stderr()).isEmpty();

            JsonArray array = JsonParser.parseString(stdout()).getAsJsonArray();
            assertThat(array.size()).isEqualTo(1);
            JsonObject diag = array.get(0).getAsJsonObject();
            assertThat(diag.get("kind").getAsString()).isEqualTo("USE_OF_MOVED_VALUE");
            assertThat(diag.get("file").getAsString()).isEqualTo(file.toString());
            assertThat(diag.get("line").getAsInt()).isEqualTo(3);
            assertThat(diag.get("column").getAsInt()).isEqualTo(9);
            assertThat(diag.get("message").getAsString()).isEqualTo("use of moved value 'x'");
            assertThat(diag.has("note")).isTrue();
            assertThat(diag.has("help")).isTrue();
        }

        @Test
        @DisplayName("没有诊断时输出空数组")
        void testJsonEmpty() throws IOException {
            config.setJson(true);
            run(write("ok.astral", "let a = 1;\n"));
            assertThat(JsonParser.parseString(stdout()).getAsJsonArray()).isEmpty();
        }

        @Test
        @DisplayName("语法错误带 SYNTAX_ERROR 类型")
        void testJsonSyntaxError() throws IOException {
            config.setJson(true);
            run(write("bad.astral", "let = 1;\n"));

            JsonObject diag = JsonParser.parseString(stdout()).getAsJsonArray().get(0).getAsJsonObject();
            assertThat(diag.get("kind").getAsString()).isEqualTo("SYNTAX_ERROR");
            assertThat(diag.get("line").getAsInt()).isEqualTo(1);
            assertThat(diag.get("column").getAsInt()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("详细日志")
    class VerboseLoggingTests {

        private final Logger logger = Logger.getLogger("com.astrallang");

        @AfterEach
        void resetLogger() {
            for (Handler handler : logger.getHandlers()) {
                logger.removeHandler(handler);
            }
            logger.setLevel(null);
            logger.setUseParentHandlers(true);
        }

        @Test
        @DisplayName("重复开启只挂一个控制台 handler")
        void testEnableTwice() {
            Main.enableVerboseLogging();
            Main.enableVerboseLogging();

            assertThat(logger.getLevel()).isEqualTo(Level.FINE);
            assertThat(logger.getHandlers())
                    .filteredOn(handler -> handler instanceof ConsoleHandler)
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("命令行参数")
    class CommandLineTests {

        @Test
        @DisplayName("check 子命令选项")
        void testCheckOptions() {
            CheckCommand command = CommandLine.populateCommand(new CheckCommand(),
                    "--json", "--no-snippet", "-q", "a.astral", "b.astral");

            assertThat(command.report.json).isTrue();
            assertThat(command.report.noSnippet).isTrue();
            assertThat(command.report.noNotes).isFalse();
            assertThat(command.report.quiet).isTrue();
            assertThat(command.files).containsExactly(Path.of("a.astral"), Path.of("b.astral"));
        }

        @Test
        @DisplayName("check 至少需要一个文件")
        void testCheckRequiresFile() {
            assertThatThrownBy(() -> CommandLine.populateCommand(new CheckCommand()))
                    .isInstanceOf(CommandLine.MissingParameterException.class);
        }

        @Test
        @DisplayName("入口命令注册 check 子命令")
        void testSubcommandRegistered() {
            CommandLine cmd = new CommandLine(new Main());
            assertThat(cmd.getSubcommands()).containsKey("check");
            assertThat(cmd.getCommandSpec().version()).containsExactly("Astral v0.1.0");
        }

        @Test
        @DisplayName("入口命令直接接受文件")
        void testShortcutFiles() throws IOException {
            Path file = write("ok.astral", "let a = 1;\n");
            Main main = CommandLine.populateCommand(new Main(), file.toString());
            assertThat(main.files).containsExactly(file);
            assertThat(main.report.json).isFalse();
        }

        @Test
        @DisplayName("入口命令与 check 接受相同的输出选项")
        void testShortcutOptions() {
            Main main = CommandLine.populateCommand(new Main(),
                    "--json", "--no-notes", "-q", "-v", "a.astral");
            assertThat(main.files).containsExactly(Path.of("a.astral"));

            ReportConfig config = main.report.toConfig();
            assertThat(config.isJson()).isTrue();
            assertThat(config.isShowSnippet()).isTrue();
            assertThat(config.isShowNotes()).isFalse();
            assertThat(config.isQuiet()).isTrue();
            assertThat(main.report.verbose).isTrue();
        }
    }
}
