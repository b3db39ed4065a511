package com.keellang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("命令行测试")
class MainTest {

    @TempDir
    Path tempDir;

    private Path fixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/programs/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    @DisplayName("compile 写出 JSON 文件")
    void testCompileCommand() throws IOException {
        Path output = tempDir.resolve("vec2.mir.json");

        int code = new CommandLine(new Main()).execute("compile", fixture("vec2.json").toString(),
                "--emit", "json", "-o", output.toString(), "--jobs", "2", "--strict-moves");

        assertThat(code).isZero();
        assertThat(output).exists();
    }

    @Test
    @DisplayName("verify 对缺陷返回 1")
    void testVerifyCommandFailure() throws IOException {
        int code = new CommandLine(new Main()).execute("verify", fixture("stray-break.json").toString());

        assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
    }

    @Test
    @DisplayName("未知输出格式")
    void testUnknownEmit() throws IOException {
        int code = new CommandLine(new Main()).execute("compile", fixture("vec2.json").toString(), "--emit", "xml");

        assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
    }

    @Test
    @DisplayName("非法的配置值")
    void testInvalidOption() throws IOException {
        int code = new CommandLine(new Main()).execute("verify", fixture("vec2.json").toString(), "--max-blocks", "0");

        assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
    }

    @Test
    @DisplayName("缺少输入参数时给出用法")
    void testMissingInput() {
        StringWriter errors = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(errors));

        int code = cmd.execute("compile");

        assertThat(code).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(errors.toString()).contains("Missing required parameter");
    }

    @Test
    @DisplayName("控制台编码取操作系统原生编码，无效时退回默认编码")
    void testConsoleCharset() {
        String saved = System.getProperty("native.encoding");
        try {
            System.setProperty("native.encoding", "UTF-8");
            assertThat(Main.consoleCharset()).isEqualTo(StandardCharsets.UTF_8);

            System.setProperty("native.encoding", "no such charset");
            assertThat(Main.consoleCharset()).isEqualTo(Charset.defaultCharset());

            System.setProperty("native.encoding", "x-keel-unknown");
            assertThat(Main.consoleCharset()).isEqualTo(Charset.defaultCharset());
        } finally {
            if (saved == null) {
                System.clearProperty("native.encoding");
            } else {
                System.setProperty("native.encoding", saved);
            }
        }
    }
}
