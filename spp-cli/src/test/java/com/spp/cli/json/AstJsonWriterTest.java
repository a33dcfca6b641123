package com.spp.cli.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.spp.compiler.analysis.TreeValidator;
import com.spp.compiler.ast.decl.ModuleDecl;
import com.spp.compiler.ast.expr.Constant;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.parser.PythonExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstJsonWriter 测试")
class AstJsonWriterTest {

    private final PythonExpressionParser parser = new PythonExpressionParser();
    private final AstJsonWriter writer = new AstJsonWriter(false);

    private JsonObject write(String source) {
        Expression expr = parser.parseExpression(source);
        return writer.toJsonTree(expr);
    }

    private static String type(JsonObject node) {
        return node.get("type").getAsString();
    }

    @Test
    @DisplayName("格式化字符串的替换字段和嵌套格式说明")
    void testFormattedString() {
        JsonObject tree = write("f'a {x!r:>{w}}'");

        assertThat(type(tree)).isEqualTo("JoinedStr");
        JsonArray values = tree.getAsJsonArray("values");
        assertThat(values).hasSize(2);

        JsonObject text = values.get(0).getAsJsonObject();
        assertThat(type(text)).isEqualTo("Constant");
        assertThat(text.get("kind").getAsString()).isEqualTo("str");
        assertThat(text.get("value").getAsString()).isEqualTo("a ");

        JsonObject field = values.get(1).getAsJsonObject();
        assertThat(field.get("conversion").getAsString()).isEqualTo("r");
        JsonArray spec = field.getAsJsonObject("format_spec").getAsJsonArray("values");
        assertThat(spec).hasSize(2);
        assertThat(spec.get(0).getAsJsonObject().get("value").getAsString()).isEqualTo(">");
        assertThat(type(spec.get(1).getAsJsonObject())).isEqualTo("FormattedValue");
        assertThat(spec.get(1).getAsJsonObject().get("conversion").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("lambda 参数的四个分组")
    void testLambdaArguments() {
        JsonObject tree = write("lambda a, *b, c=1, **d: a");

        JsonObject args = tree.getAsJsonObject("args");
        assertThat(type(args)).isEqualTo("Arguments");
        assertThat(args.getAsJsonArray("args").get(0).getAsJsonObject().get("arg").getAsString()).isEqualTo("a");
        assertThat(args.getAsJsonObject("vararg").get("arg").getAsString()).isEqualTo("b");
        JsonObject c = args.getAsJsonArray("kwonlyargs").get(0).getAsJsonObject();
        assertThat(c.getAsJsonObject("default").get("value").getAsInt()).isEqualTo(1);
        assertThat(args.getAsJsonObject("kwarg").get("arg").getAsString()).isEqualTo("d");
    }

    @Test
    @DisplayName("运算符按源码符号输出")
    void testOperators() {
        JsonObject compare = write("a < b is not c");
        assertThat(compare.getAsJsonArray("ops").get(0).getAsString()).isEqualTo("<");
        assertThat(compare.getAsJsonArray("ops").get(1).getAsString()).isEqualTo("is not");

        assertThat(write("not x").get("op").getAsString()).isEqualTo("not");
        assertThat(write("a or b").get("op").getAsString()).isEqualTo("or");
        assertThat(write("a // b").get("op").getAsString()).isEqualTo("//");
    }

    @Test
    @DisplayName("扩展切片")
    void testExtSlice() {
        JsonObject tree = write("m[1:2, ::3]");

        JsonObject slice = tree.getAsJsonObject("slice");
        assertThat(type(slice)).isEqualTo("ExtSlice");
        JsonObject first = slice.getAsJsonArray("dims").get(0).getAsJsonObject();
        assertThat(type(first)).isEqualTo("DefaultSlice");
        assertThat(first.get("step").isJsonNull()).isTrue();
    }

    @Test
    @DisplayName("None 常量没有 value 字段，空的可选字段写 null")
    void testNullFields() {
        JsonObject none = write("None");
        assertThat(none.get("kind").getAsString()).isEqualTo("None");
        assertThat(none.has("value")).isFalse();

        JsonObject yield = write("(yield)");
        assertThat(type(yield)).isEqualTo("Yield");
        assertThat(yield.get("value").isJsonNull()).isTrue();
        assertThat(writer.toJson(parser.parseExpression("(yield)"))).contains("\"value\": null");
    }

    @Test
    @DisplayName("位置信息可选")
    void testLocations() {
        Expression expr = parser.parseExpression("x");

        JsonObject withLocation = new AstJsonWriter().toJsonTree(expr);
        assertThat(withLocation.get("line").getAsInt()).isEqualTo(1);
        assertThat(withLocation.has("column")).isTrue();

        assertThat(writer.toJsonTree(expr).has("line")).isFalse();
    }

    @Test
    @DisplayName("大整数和虚数")
    void testNumbers() {
        JsonObject big = write("123456789012345678901234567890");
        assertThat(big.get("value").getAsBigInteger().toString()).isEqualTo("123456789012345678901234567890");

        JsonObject imaginary = write("2j");
        assertThat(imaginary.get("kind").getAsString()).isEqualTo("complex");
        assertThat(imaginary.get("value").getAsDouble()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("写出的 JSON 读回后再写出保持不变")
    void testStableOutput() throws IOException {
        AstJsonReader reader = new AstJsonReader();
        ModuleDecl module;
        try (Reader in = new InputStreamReader(
                getClass().getResourceAsStream("/trees/statements.json"), StandardCharsets.UTF_8)) {
            module = reader.readModule(in);
        }
        assertThat(new TreeValidator().validate(module).isValid()).isTrue();

        String first = writer.toJson(module);
        String second = writer.toJson(reader.readModule(first));

        assertThat(second).isEqualTo(first);
        assertThat(first).contains("\"type\": \"ExceptionHandler\"", "\"exc_type\"", "\"is_async\": true");
    }

    @Test
    @DisplayName("原始字符串和字节串常量")
    void testStringKinds() {
        JsonObject bytes = write("b'\\x00'");
        assertThat(bytes.get("kind").getAsString()).isEqualTo("bytes");
        assertThat(bytes.get("value").getAsString()).isEqualTo("\\x00");

        Constant raw = (Constant) parser.parseExpression("r'\\d'");
        assertThat(writer.toJsonTree(raw).get("value").getAsString()).isEqualTo(raw.getStringValue());
    }
}
