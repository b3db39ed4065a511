package com.keellang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.keellang.ir.MirOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirRunner 测试")
class MirRunnerTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private MirRunner runner(MirOptions options) {
        return new MirRunner(options, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private MirRunner runner() {
        return runner(new MirOptions());
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    /** 把测试资源复制到临时目录 */
    private Path fixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/programs/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("文本输出到 stdout")
        void testTextToStdout() throws IOException {
            int code = runner().compile(fixture("vec2.json").toString(), null, "text");

            assertThat(code).isEqualTo(MirRunner.EXIT_OK);
            assertThat(stdout()).contains("fn choose(_1: i32) -> i32 {", "fn nudge(_1: Vec2) -> unit {",
                    "let _2: &Vec2; // temp borrow", "eval fn0(move _2, const 1, const 2);");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("JSON 输出到文件")
        void testJsonToFile() throws IOException {
            Path output = tempDir.resolve("out.json");

            int code = runner().compile(fixture("vec2.json").toString(), output.toString(), "json");

            assertThat(code).isEqualTo(MirRunner.EXIT_OK);
            assertThat(stdout()).isEmpty();
            JsonObject root = JsonParser.parseString(new String(Files.readAllBytes(output), StandardCharsets.UTF_8))
                    .getAsJsonObject();
            assertThat(root.get("source").getAsString()).isEqualTo("vec2.keel");
            assertThat(root.getAsJsonArray("diagnostics")).isEmpty();
            JsonArray functions = root.getAsJsonArray("functions");
            assertThat(functions).hasSize(2);
            JsonObject choose = functions.get(0).getAsJsonObject();
            assertThat(choose.get("name").getAsString()).isEqualTo("choose");
            assertThat(choose.get("entry").getAsInt()).isZero();
            assertThat(choose.getAsJsonArray("blocks")).hasSize(4);
            JsonObject ret = choose.getAsJsonObject("signature").getAsJsonObject("returns");
            assertThat(ret.get("display").getAsString()).isEqualTo("i32");
            assertThat(ret.get("regime").getAsString()).isEqualTo("VALUE");
        }

        @Test
        @DisplayName("JSON 终止指令带有种类与目标块编号")
        void testJsonTerminators() throws IOException {
            Path output = tempDir.resolve("out.json");

            runner().compile(fixture("vec2.json").toString(), output.toString(), "json");

            JsonObject root = JsonParser.parseString(new String(Files.readAllBytes(output), StandardCharsets.UTF_8))
                    .getAsJsonObject();
            JsonArray blocks = root.getAsJsonArray("functions").get(0).getAsJsonObject().getAsJsonArray("blocks");
            JsonObject entry = blocks.get(0).getAsJsonObject().getAsJsonObject("terminator");
            assertThat(entry.get("kind").getAsString()).isEqualTo("branch");
            assertThat(entry.get("text").getAsString()).startsWith("branch ");

            List<String> kinds = new ArrayList<>();
            for (JsonElement element : blocks) {
                JsonObject block = element.getAsJsonObject();
                JsonObject term = block.getAsJsonObject("terminator");
                kinds.add(term.get("kind").getAsString());
                List<Integer> targets = new ArrayList<>();
                if (term.has("target")) targets.add(term.get("target").getAsInt());
                if (term.has("then")) {
                    targets.add(term.get("then").getAsInt());
                    targets.add(term.get("else").getAsInt());
                }
                List<Integer> successors = new ArrayList<>();
                for (JsonElement succ : block.getAsJsonArray("successors")) successors.add(succ.getAsInt());
                assertThat(targets).isEqualTo(successors);
            }
            assertThat(kinds).contains("goto", "return");
        }

        @Test
        @DisplayName("有诊断时仍输出通过的函数，退出码为 1")
        void testPartialFailure() throws IOException {
            int code = runner().compile(fixture("stray-break.json").toString(), null, "json");

            assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
            JsonObject root = JsonParser.parseString(stdout()).getAsJsonObject();
            assertThat(root.getAsJsonArray("functions")).hasSize(1);
            JsonObject diagnostic = root.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
            assertThat(diagnostic.get("kind").getAsString()).isEqualTo("DEFECT");
            assertThat(diagnostic.get("stage").getAsString()).isEqualTo("cfg-build");
            assertThat(diagnostic.get("location").getAsString()).isEqualTo("stray.keel:2:5");
            assertThat(stderr()).contains("compiler defect [cfg-build] stray#0");
        }

        @Test
        @DisplayName("规模超限")
        void testTooLarge() throws IOException {
            int code = runner(new MirOptions().setMaxBlocks(2)).compile(fixture("vec2.json").toString(), null, "text");

            assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
            assertThat(stdout()).contains("fn nudge").doesNotContain("fn choose");
            assertThat(stderr()).contains("compilation too large [cfg-build] choose#1: function exceeds 2 basic blocks");
        }
    }

    @Nested
    @DisplayName("verify 与输入错误")
    class VerifyAndInput {

        @Test
        @DisplayName("校验通过时报告函数个数")
        void testVerify() throws IOException {
            int code = runner().verify(fixture("vec2.json").toString());

            assertThat(code).isEqualTo(MirRunner.EXIT_OK);
            assertThat(stdout()).contains("2 function(s) verified");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            int code = runner().verify(tempDir.resolve("none.json").toString());

            assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
            assertThat(stderr()).contains("文件不存在");
        }

        @Test
        @DisplayName("JSON 格式错误")
        void testMalformedJson() throws IOException {
            Path broken = tempDir.resolve("broken.json");
            Files.write(broken, "{\"types\": [".getBytes(StandardCharsets.UTF_8));

            int code = runner().verify(broken.toString());

            assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
            assertThat(stderr()).contains("输入格式无效");
        }

        @Test
        @DisplayName("内容结构错误")
        void testInvalidContent() throws IOException {
            Path invalid = tempDir.resolve("invalid.json");
            Files.write(invalid, "{\"types\": [{\"kind\": \"tuple\"}]}".getBytes(StandardCharsets.UTF_8));

            int code = runner().compile(invalid.toString(), null, "text");

            assertThat(code).isEqualTo(MirRunner.EXIT_FAILED);
            assertThat(stderr()).contains("unknown type kind: tuple");
            assertThat(stdout()).isEmpty();
        }
    }
}
