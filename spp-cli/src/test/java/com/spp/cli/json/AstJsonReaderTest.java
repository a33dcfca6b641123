package com.spp.cli.json;

import com.spp.compiler.analysis.TreeValidator;
import com.spp.compiler.analysis.ValidationError;
import com.spp.compiler.analysis.ValidationResult;
import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.decl.Arguments;
import com.spp.compiler.ast.decl.FunctionDecl;
import com.spp.compiler.ast.decl.ModuleDecl;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.ast.stmt.AssignStmt;
import com.spp.compiler.ast.stmt.ExceptHandler;
import com.spp.compiler.ast.stmt.ImportFromStmt;
import com.spp.compiler.ast.stmt.TryStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstJsonReader 测试")
class AstJsonReaderTest {

    private final AstJsonReader reader = new AstJsonReader("test.json");

    private ModuleDecl readFixture(String name) throws IOException {
        try (Reader in = new InputStreamReader(
                getClass().getResourceAsStream("/trees/" + name), StandardCharsets.UTF_8)) {
            return reader.readModule(in);
        }
    }

    // ============ 正常读取 ============

    @Nested
    @DisplayName("读取节点")
    class ReadNodes {

        @Test
        @DisplayName("读取函数定义及其参数")
        void testFunctionDef() throws IOException {
            ModuleDecl module = readFixture("valid-module.json");

            assertThat(module.getBody()).hasSize(1);
            FunctionDecl fn = (FunctionDecl) module.getBody().get(0);
            assertThat(fn.getName()).isEqualTo("f");
            assertThat(fn.getLocation().getFile()).isEqualTo("test.json");
            assertThat(fn.getLocation().getLine()).isEqualTo(1);
            assertThat(fn.getArgs().getAllNames()).containsExactly("a", "b");

            Constant defaultValue = (Constant) fn.getArgs().getArgs().get(1).getDefaultValue();
            assertThat(defaultValue.getValue()).isEqualTo(BigInteger.ONE);
            assertThat(fn.getBody()).hasSize(2);
        }

        @Test
        @DisplayName("调用参数区分位置参数和关键字参数")
        void testCallArguments() throws IOException {
            FunctionDecl fn = (FunctionDecl) readFixture("valid-module.json").getBody().get(0);
            CallExpr call = (CallExpr) ((AssignStmt) fn.getBody().get(0)).getValue();

            assertThat(call.getArgs()).hasSize(2);
            assertThat(call.getArgs().get(0)).isInstanceOf(PositionalArg.class);
            KeywordArg keyword = (KeywordArg) call.getArgs().get(1);
            assertThat(((NameExpr) keyword.getName()).getName()).isEqualTo("k");
        }

        @Test
        @DisplayName("缺省的列表和可选字段")
        void testDefaults() {
            FunctionDecl fn = (FunctionDecl) reader.readNode("{\"type\":\"FunctionDef\",\"name\":\"g\"}");

            assertThat(fn.getBody()).isEmpty();
            assertThat(fn.getDecorators()).isEmpty();
            assertThat(fn.getReturns()).isNull();
            assertThat(fn.isAsync()).isFalse();
            Arguments args = fn.getArgs();
            assertThat(args.getAllArgs()).isEmpty();
            assertThat(fn.getLocation().getLine()).isZero();
        }

        @Test
        @DisplayName("各种常量")
        void testConstants() {
            assertThat(((Constant) reader.readExpression("{\"type\":\"Constant\",\"kind\":\"int\",\"value\":123456789012345678901234567890}")).getValue())
                    .isEqualTo(new BigInteger("123456789012345678901234567890"));
            assertThat(((Constant) reader.readExpression("{\"type\":\"Constant\",\"kind\":\"float\",\"value\":1.5}")).getValue())
                    .isEqualTo(1.5);
            assertThat(((Constant) reader.readExpression("{\"type\":\"Constant\",\"kind\":\"bool\",\"value\":true}")).getValue())
                    .isEqualTo(Boolean.TRUE);
            assertThat(((Constant) reader.readExpression("{\"type\":\"Constant\",\"kind\":\"bytes\",\"value\":\"ab\"}")).getKind())
                    .isEqualTo(Constant.ConstantKind.BYTES);

            Constant none = (Constant) reader.readExpression("{\"type\":\"Constant\",\"kind\":\"None\"}");
            assertThat(none.getKind()).isEqualTo(Constant.ConstantKind.NONE);
            assertThat(none.getValue()).isNull();
        }

        @Test
        @DisplayName("比较、格式化字段和下标")
        void testCompoundExpressions() {
            CompareExpr compare = (CompareExpr) reader.readExpression(
                    "{\"type\":\"Compare\",\"left\":{\"type\":\"Name\",\"id\":\"a\"},\"ops\":[\"<\",\"not in\"],"
                            + "\"comparators\":[{\"type\":\"Name\",\"id\":\"b\"},{\"type\":\"Name\",\"id\":\"c\"}]}");
            assertThat(compare.getOperators())
                    .containsExactly(CompareExpr.CompareOp.LT, CompareExpr.CompareOp.NOT_IN);

            FormattedValue field = (FormattedValue) reader.readExpression(
                    "{\"type\":\"FormattedValue\",\"value\":{\"type\":\"Name\",\"id\":\"x\"},\"conversion\":\"a\","
                            + "\"format_spec\":{\"type\":\"JoinedStr\",\"values\":[{\"type\":\"Constant\",\"kind\":\"str\",\"value\":\">10\"}]}}");
            assertThat(field.getConversion()).isEqualTo('a');
            assertThat(field.getFormatSpec().getValues()).hasSize(1);

            SubscriptExpr subscript = (SubscriptExpr) reader.readExpression(
                    "{\"type\":\"Subscript\",\"value\":{\"type\":\"Name\",\"id\":\"m\"},\"slice\":{\"type\":\"ExtSlice\",\"dims\":["
                            + "{\"type\":\"DefaultSlice\",\"upper\":{\"type\":\"Constant\",\"kind\":\"int\",\"value\":2}},"
                            + "{\"type\":\"Index\",\"value\":{\"type\":\"Constant\",\"kind\":\"int\",\"value\":0}}]}}");
            ExtSlice ext = (ExtSlice) subscript.getSlice();
            assertThat(ext.getDims()).hasSize(2);
            assertThat(((DefaultSlice) ext.getDims().get(0)).getLower()).isNull();
        }

        @Test
        @DisplayName("异常处理器使用 exc_type 字段")
        void testExceptHandler() {
            TryStmt stmt = (TryStmt) reader.readNode(
                    "{\"type\":\"Try\",\"body\":[{\"type\":\"Pass\"}],\"handlers\":[{\"type\":\"ExceptionHandler\","
                            + "\"exc_type\":{\"type\":\"Name\",\"id\":\"ValueError\"},\"name\":\"e\",\"body\":[{\"type\":\"Pass\"}]}]}");

            ExceptHandler handler = stmt.getHandlers().get(0);
            assertThat(((NameExpr) handler.getType()).getName()).isEqualTo("ValueError");
            assertThat(handler.getName()).isEqualTo("e");
            assertThat(stmt.getFinalBody()).isEmpty();
        }

        @Test
        @DisplayName("相对导入")
        void testImportFrom() {
            ImportFromStmt stmt = (ImportFromStmt) reader.readNode(
                    "{\"type\":\"ImportFrom\",\"names\":[{\"type\":\"Alias\",\"name\":\"x\",\"asname\":\"y\"}],\"level\":2}");

            assertThat(stmt.getModule()).isNull();
            assertThat(stmt.getLevel()).isEqualTo(2);
            assertThat(stmt.getNames().get(0).getAsName()).isEqualTo("y");
        }

        @Test
        @DisplayName("读取的树可以直接校验")
        void testValidateFixtures() throws IOException {
            TreeValidator validator = new TreeValidator();

            assertThat(validator.validate(readFixture("valid-module.json")).isValid()).isTrue();

            ValidationResult duplicate = validator.validate(readFixture("duplicate-argument.json"));
            assertThat(duplicate.getError().getKind()).isEqualTo(ValidationError.Kind.DUPLICATE_ARGUMENT);

            ValidationResult notAssignable = validator.validate(readFixture("not-assignable.json"));
            assertThat(notAssignable.getError().getKind()).isEqualTo(ValidationError.Kind.NOT_ASSIGNABLE);
            AstNode errorNode = notAssignable.getError().getNode();
            assertThat(errorNode).isInstanceOf(CallExpr.class);
            assertThat(errorNode.getLocation().getLine()).isEqualTo(2);
        }
    }

    // ============ 错误输入 ============

    @Nested
    @DisplayName("格式错误")
    class Errors {

        @Test
        @DisplayName("未知节点类型带 JSON 路径")
        void testUnknownType() {
            assertThatThrownBy(() -> readFixture("unknown-node.json"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Unknown node type 'Frobnicate'")
                    .satisfies(e -> assertThat(((AstJsonException) e).getPath()).isEqualTo("$.body[0]"));
        }

        @Test
        @DisplayName("节点出现在错误的位置")
        void testWrongCategory() {
            assertThatThrownBy(() -> reader.readModule("{\"type\":\"Module\",\"body\":[{\"type\":\"Name\",\"id\":\"x\"}]}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Expected Statement but found 'Name'");
        }

        @Test
        @DisplayName("缺少必需字段")
        void testMissingField() {
            assertThatThrownBy(() -> reader.readExpression("{\"type\":\"Name\"}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessage("Missing field 'id' at $");

            assertThatThrownBy(() -> reader.readExpression("{\"type\":\"Attribute\",\"attr\":\"a\"}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessage("Missing node at $.value");
        }

        @Test
        @DisplayName("非法运算符和转换符")
        void testBadOperators() {
            assertThatThrownBy(() -> reader.readExpression("{\"type\":\"BinOp\",\"op\":\"<>\","
                    + "\"left\":{\"type\":\"Name\",\"id\":\"a\"},\"right\":{\"type\":\"Name\",\"id\":\"b\"}}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Unknown binary operator '<>'");

            assertThatThrownBy(() -> reader.readExpression("{\"type\":\"FormattedValue\","
                    + "\"value\":{\"type\":\"Name\",\"id\":\"x\"},\"conversion\":\"x\"}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("Invalid conversion 'x'");
        }

        @Test
        @DisplayName("推导式至少需要一个生成器")
        void testEmptyGenerators() {
            assertThatThrownBy(() -> reader.readExpression(
                    "{\"type\":\"ListComp\",\"elt\":{\"type\":\"Name\",\"id\":\"x\"},\"generators\":[]}"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageContaining("at least one generator");
        }

        @Test
        @DisplayName("非法 JSON 与非对象的根")
        void testMalformedJson() {
            assertThatThrownBy(() -> reader.readModule("{"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageStartingWith("Malformed JSON");

            assertThatThrownBy(() -> reader.readModule("42"))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessage("Expected a node object at $");
        }

        private String negated(int depth) {
            StringBuilder json = new StringBuilder();
            for (int i = 0; i < depth; i++) {
                json.append("{\"type\":\"UnaryOp\",\"op\":\"-\",\"operand\":");
            }
            json.append("{\"type\":\"Name\",\"id\":\"x\"}");
            for (int i = 0; i < depth; i++) {
                json.append('}');
            }
            return json.toString();
        }

        @Test
        @DisplayName("嵌套超过上限时报错并给出路径")
        void testNestingLimit() {
            AstJsonReader limited = new AstJsonReader("deep.json", 10);

            assertThat(limited.readExpression(negated(9))).isInstanceOf(UnaryExpr.class);

            StringBuilder path = new StringBuilder("$");
            for (int i = 0; i < 10; i++) {
                path.append(".operand");
            }
            assertThatThrownBy(() -> limited.readExpression(negated(10)))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageStartingWith("Maximum nesting depth exceeded")
                    .satisfies(e -> assertThat(((AstJsonException) e).getPath()).isEqualTo(path.toString()));

            // 失败后计数恢复
            assertThat(limited.readExpression(negated(9))).isInstanceOf(UnaryExpr.class);
        }

        @Test
        @DisplayName("默认上限拦截极深的树")
        void testDefaultNestingLimit() {
            assertThatThrownBy(() -> reader.readExpression(negated(2000)))
                    .isInstanceOf(AstJsonException.class)
                    .hasMessageStartingWith("Maximum nesting depth exceeded");
        }
    }
}
