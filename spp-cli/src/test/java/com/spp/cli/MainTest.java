package com.spp.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

@DisplayName("spp 命令行测试")
class MainTest {

    /** 一次命令执行的退出码与输出 */
    private static final class Run {
        final int exitCode;
        final String out;
        final String err;

        Run(int exitCode, String out, String err) {
            this.exitCode = exitCode;
            this.out = out;
            this.err = err;
        }
    }

    private Run run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int exitCode = cmd.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder(s.length() * count);
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }

    private String fixture(String name) throws URISyntaxException {
        return Paths.get(getClass().getResource("/trees/" + name).toURI()).toString();
    }

    @Test
    @DisplayName("无子命令时打印用法")
    void testUsage() {
        Run result = run();

        assertThat(result.exitCode).isZero();
        assertThat(result.out).contains("validate", "literal", "expr");
    }

    @Test
    @DisplayName("--version 输出版本号")
    void testVersion() {
        Run result = run("--version");

        assertThat(result.exitCode).isZero();
        assertThat(result.out.trim()).isEqualTo("spp 0.1.0");
    }

    // ============ validate ============

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("合法的模块输出 OK")
        void testValidModule() throws Exception {
            Run result = run("validate", fixture("valid-module.json"));

            assertThat(result.exitCode).isZero();
            assertThat(result.out.trim()).isEqualTo("OK");
            assertThat(result.err).isEmpty();
        }

        @Test
        @DisplayName("重复参数名")
        void testDuplicateArgument() throws Exception {
            Run result = run("validate", fixture("duplicate-argument.json"));

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).startsWith("Validation error: Duplicate argument in function definition");
        }

        @Test
        @DisplayName("不可赋值的目标，带出错位置")
        void testNotAssignable() throws Exception {
            Run result = run("validate", fixture("not-assignable.json"));

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out)
                    .contains("Validation error: Cannot assign to left hand-side")
                    .contains("not-assignable.json:2:1");
        }

        @Test
        @DisplayName("未知节点类型报格式错误")
        void testUnknownNode() throws Exception {
            Run result = run("validate", fixture("unknown-node.json"));

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).isEmpty();
            assertThat(result.err).contains("Unknown node type 'Frobnicate'").contains("$.body[0]");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile(@TempDir Path dir) {
            Run result = run("validate", dir.resolve("nope.json").toString());

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.err).contains("错误: 文件不存在");
        }

        @Test
        @DisplayName("--max-unpacking-depth 限制解包层数")
        void testMaxUnpackingDepth(@TempDir Path dir) throws IOException {
            String json = "{\"type\":\"Module\",\"body\":[{\"type\":\"Assign\","
                    + "\"targets\":[{\"type\":\"Tuple\",\"elts\":[{\"type\":\"Tuple\",\"elts\":[{\"type\":\"Name\",\"id\":\"x\"}]}]}],"
                    + "\"value\":{\"type\":\"Name\",\"id\":\"v\"}}]}";
            Path file = dir.resolve("nested.json");
            Files.write(file, json.getBytes(StandardCharsets.UTF_8));

            assertThat(run("validate", file.toString()).exitCode).isZero();

            Run limited = run("validate", "--max-unpacking-depth", "1", file.toString());
            assertThat(limited.exitCode).isEqualTo(1);
            assertThat(limited.out).contains("Maximum nesting depth exceeded");
        }

        @Test
        @DisplayName("非正数的深度参数是用法错误")
        void testInvalidDepthOption() throws Exception {
            Run result = run("validate", "--max-unpacking-depth", "0", fixture("valid-module.json"));

            assertThat(result.exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(result.err).contains("必须为正整数");
        }

        @Test
        @DisplayName("--max-tree-depth 限制语法树深度")
        void testMaxTreeDepth(@TempDir Path dir) throws IOException {
            String json = "{\"type\":\"Module\",\"body\":[{\"type\":\"ExprStmt\",\"value\":"
                    + "{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":{\"type\":\"Name\",\"id\":\"x\"}}}]}";
            Path file = dir.resolve("deep.json");
            Files.write(file, json.getBytes(StandardCharsets.UTF_8));

            assertThat(run("validate", "--max-tree-depth", "4", file.toString()).exitCode).isZero();

            Run limited = run("validate", "--max-tree-depth", "3", file.toString());
            assertThat(limited.exitCode).isEqualTo(1);
            assertThat(limited.err)
                    .contains("语法树格式错误: Maximum nesting depth exceeded")
                    .contains("$.body[0].value.operand");

            assertThat(run("validate", "--max-tree-depth", "0", file.toString()).exitCode)
                    .isEqualTo(CommandLine.ExitCode.USAGE);
        }
    }

    // ============ literal ============

    @Nested
    @DisplayName("literal")
    class Literal {

        @Test
        @DisplayName("格式化字符串输出 JoinedStr")
        void testFormattedLiteral() {
            Run result = run("literal", "f'a {x!r:>{w}}'");

            assertThat(result.exitCode).isZero();
            JsonObject tree = JsonParser.parseString(result.out).getAsJsonObject();
            assertThat(tree.get("type").getAsString()).isEqualTo("JoinedStr");
            assertThat(tree.getAsJsonArray("values")).hasSize(2);

            JsonObject field = tree.getAsJsonArray("values").get(1).getAsJsonObject();
            assertThat(field.get("type").getAsString()).isEqualTo("FormattedValue");
            assertThat(field.get("conversion").getAsString()).isEqualTo("r");
            assertThat(field.getAsJsonObject("value").get("id").getAsString()).isEqualTo("x");
            assertThat(field.getAsJsonObject("format_spec").get("type").getAsString()).isEqualTo("JoinedStr");
        }

        @Test
        @DisplayName("普通字符串输出 Constant")
        void testPlainLiteral() {
            Run result = run("literal", "'abc'");

            assertThat(result.exitCode).isZero();
            JsonObject tree = JsonParser.parseString(result.out).getAsJsonObject();
            assertThat(tree.get("type").getAsString()).isEqualTo("Constant");
            assertThat(tree.get("kind").getAsString()).isEqualTo("str");
            assertThat(tree.get("value").getAsString()).isEqualTo("abc");
        }

        @Test
        @DisplayName("非法转换符")
        void testInvalidConversion() {
            Run result = run("literal", "f'{x!z}'");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.err).contains("解析错误").contains("invalid conversion character");
        }

        @Test
        @DisplayName("--max-field-depth 限制替换字段嵌套")
        void testMaxFieldDepth() {
            assertThat(run("literal", "f'{x:{y}}'").exitCode).isZero();

            Run limited = run("literal", "--max-field-depth", "1", "f'{x:{y}}'");
            assertThat(limited.exitCode).isEqualTo(1);
            assertThat(limited.err).contains("nested too deeply");
        }

        @Test
        @DisplayName("字段中嵌套过深的表达式报告解析错误")
        void testDeepExpressionInField() {
            Run result = run("literal", "f'{" + repeat("(", 20000) + "1" + repeat(")", 20000) + "}'");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).isEmpty();
            assertThat(result.err).startsWith("解析错误: Expression nested too deeply");
        }

        @Test
        @DisplayName("过深的字段语法树不输出 JSON")
        void testDeepFieldTree() {
            Run result = run("literal", "f'{1" + repeat(" + 1", 600) + "}'");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).startsWith("Validation error: Maximum nesting depth exceeded");
        }

        @Test
        @DisplayName("输入必须是单个字符串字面量")
        void testNotASingleLiteral() {
            Run result = run("literal", "'a' 'b'");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.err).contains("Expected a single string literal");
        }
    }

    // ============ expr ============

    @Nested
    @DisplayName("expr")
    class Expr {

        @Test
        @DisplayName("输出表达式的 JSON 语法树")
        void testExpression() {
            Run result = run("expr", "a + b * 2");

            assertThat(result.exitCode).isZero();
            JsonObject tree = JsonParser.parseString(result.out).getAsJsonObject();
            assertThat(tree.get("type").getAsString()).isEqualTo("BinOp");
            assertThat(tree.get("op").getAsString()).isEqualTo("+");
            assertThat(tree.getAsJsonObject("right").get("op").getAsString()).isEqualTo("*");
        }

        @Test
        @DisplayName("推导式目标不可赋值")
        void testComprehensionTarget() {
            Run result = run("expr", "[x for f() in y]");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out)
                    .contains("\"type\": \"ListComp\"")
                    .contains("Validation error: Cannot assign to left hand-side");
        }

        @Test
        @DisplayName("关键字参数名必须是名字")
        void testKeywordArgumentName() {
            Run result = run("expr", "f(a.b=1)");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).contains("Validation error: Argument must be a name");
        }

        @Test
        @DisplayName("--max-expression-depth 限制表达式嵌套")
        void testMaxExpressionDepth() {
            assertThat(run("expr", "((x))").exitCode).isZero();

            Run limited = run("expr", "--max-expression-depth", "2", "((x))");
            assertThat(limited.exitCode).isEqualTo(1);
            assertThat(limited.err).contains("Expression nested too deeply");
        }

        @Test
        @DisplayName("过深的语法树只报告错误")
        void testDeepTree() {
            Run result = run("expr", "a" + repeat(".b", 600));

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).startsWith("Validation error: Maximum nesting depth exceeded");
            assertThat(result.out).doesNotContain("\"type\"");
        }

        @Test
        @DisplayName("语法错误")
        void testSyntaxError() {
            Run result = run("expr", "a +");

            assertThat(result.exitCode).isEqualTo(1);
            assertThat(result.out).isEmpty();
            assertThat(result.err).startsWith("解析错误: ");
        }
    }
}
