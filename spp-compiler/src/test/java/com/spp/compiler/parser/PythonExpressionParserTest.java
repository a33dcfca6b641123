package com.spp.compiler.parser;

import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.decl.Arguments;
import com.spp.compiler.ast.expr.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Python 表达式解析测试
 */
class PythonExpressionParserTest {

    private final PythonExpressionParser parser = new PythonExpressionParser();

    private Expression parse(String source) {
        return parser.parseExpression(source);
    }

    private <T extends Expression> T parseAs(Class<T> type, String source) {
        Expression expr = parse(source);
        assertInstanceOf(type, expr, source);
        return type.cast(expr);
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder(s.length() * count);
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }

    private static String parens(int depth, String inner) {
        return repeat("(", depth) + inner + repeat(")", depth);
    }

    private static String nameOf(Expression expr) {
        assertInstanceOf(NameExpr.class, expr);
        return ((NameExpr) expr).getName();
    }

    @Nested
    @DisplayName("运算符优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmetic() {
            BinaryExpr sum = parseAs(BinaryExpr.class, "a + b * c");
            assertEquals(BinaryExpr.BinaryOp.ADD, sum.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) sum.getRight()).getOperator());
        }

        @Test
        @DisplayName("减法左结合")
        void testLeftAssociative() {
            BinaryExpr outer = parseAs(BinaryExpr.class, "a - b - c");
            assertInstanceOf(BinaryExpr.class, outer.getLeft());
            assertEquals("c", nameOf(outer.getRight()));
        }

        @Test
        @DisplayName("幂运算右结合，且比左侧一元负号结合更紧")
        void testPower() {
            UnaryExpr neg = parseAs(UnaryExpr.class, "-2 ** -x ** 2");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            BinaryExpr pow = (BinaryExpr) neg.getOperand();
            assertEquals(BinaryExpr.BinaryOp.POW, pow.getOperator());
            UnaryExpr rightNeg = (UnaryExpr) pow.getRight();
            assertEquals(BinaryExpr.BinaryOp.POW, ((BinaryExpr) rightNeg.getOperand()).getOperator());
        }

        @Test
        @DisplayName("位运算层级：| < ^ < & < 移位")
        void testBitwise() {
            BinaryExpr or = parseAs(BinaryExpr.class, "a | b ^ c & d << 1");
            assertEquals(BinaryExpr.BinaryOp.BIT_OR, or.getOperator());
            BinaryExpr xor = (BinaryExpr) or.getRight();
            assertEquals(BinaryExpr.BinaryOp.BIT_XOR, xor.getOperator());
            BinaryExpr and = (BinaryExpr) xor.getRight();
            assertEquals(BinaryExpr.BinaryOp.BIT_AND, and.getOperator());
            assertEquals(BinaryExpr.BinaryOp.LSHIFT, ((BinaryExpr) and.getRight()).getOperator());
        }

        @Test
        @DisplayName("布尔运算展开为多值节点")
        void testBoolOp() {
            BoolOpExpr or = parseAs(BoolOpExpr.class, "a or b and c or not d");
            assertEquals(BoolOpExpr.BoolOp.OR, or.getOperator());
            assertEquals(3, or.getValues().size());
            assertInstanceOf(BoolOpExpr.class, or.getValues().get(1));
            assertInstanceOf(UnaryExpr.class, or.getValues().get(2));
        }

        @Test
        @DisplayName("链式比较合并为一个节点")
        void testChainedComparison() {
            CompareExpr cmp = parseAs(CompareExpr.class, "a < b <= c not in d is not e");
            assertEquals(Arrays.asList(CompareExpr.CompareOp.LT, CompareExpr.CompareOp.LE,
                    CompareExpr.CompareOp.NOT_IN, CompareExpr.CompareOp.IS_NOT), cmp.getOperators());
            assertEquals(4, cmp.getComparators().size());
        }

        @Test
        @DisplayName("条件表达式")
        void testConditional() {
            IfExpr expr = parseAs(IfExpr.class, "a if b else c if d else e");
            assertEquals("a", nameOf(expr.getThenExpr()));
            assertEquals("b", nameOf(expr.getCondition()));
            assertInstanceOf(IfExpr.class, expr.getElseExpr());
        }

        @Test
        @DisplayName("await 作用于后缀表达式")
        void testAwait() {
            AwaitExpr expr = parseAs(AwaitExpr.class, "await f(x).y");
            assertInstanceOf(AttributeExpr.class, expr.getValue());
        }
    }

    @Nested
    @DisplayName("原子")
    class AtomTests {

        @Test
        @DisplayName("常量")
        void testConstants() {
            assertEquals(BigInteger.valueOf(255), parseAs(Constant.class, "0xFF").getValue());
            assertEquals(Constant.ConstantKind.FLOAT, parseAs(Constant.class, "1.5").getKind());
            assertEquals(Constant.ConstantKind.COMPLEX, parseAs(Constant.class, "2j").getKind());
            assertEquals(Boolean.TRUE, parseAs(Constant.class, "True").getValue());
            assertEquals(Constant.ConstantKind.NONE, parseAs(Constant.class, "None").getKind());
            assertEquals(Constant.ConstantKind.ELLIPSIS, parseAs(Constant.class, "...").getKind());
        }

        @Test
        @DisplayName("括号、元组与生成器表达式")
        void testParentheses() {
            assertInstanceOf(NameExpr.class, parse("(a)"));
            assertTrue(parseAs(TupleExpr.class, "()").getElements().isEmpty());
            assertEquals(1, parseAs(TupleExpr.class, "(a,)").getElements().size());
            assertEquals(2, parseAs(TupleExpr.class, "a, b,").getElements().size());
            assertEquals(1, parseAs(GeneratorExpr.class, "(x for x in y)").getGenerators().size());
        }

        @Test
        @DisplayName("列表、集合、字典及其推导式")
        void testDisplays() {
            assertEquals(3, parseAs(ListExpr.class, "[1, *a, 2]").getElements().size());
            assertEquals(2, parseAs(ListCompExpr.class, "[x for x in a if x for y in x]").getGenerators().size());
            assertEquals(2, parseAs(SetExpr.class, "{a, b}").getElements().size());
            assertInstanceOf(SetCompExpr.class, parse("{x for x in a}"));
            assertTrue(parseAs(DictExpr.class, "{}").getEntries().isEmpty());
            assertInstanceOf(DictCompExpr.class, parse("{k: v for k, v in a}"));
        }

        @Test
        @DisplayName("字典中的 ** 解包")
        void testDictUnpacking() {
            DictExpr dict = parseAs(DictExpr.class, "{'a': 1, **rest, 'b': 2}");
            assertEquals(3, dict.getEntries().size());
            assertTrue(dict.getEntries().get(1).isUnpacking());
            assertTrue(parseAs(DictExpr.class, "{**a}").getEntries().get(0).isUnpacking());
        }

        @Test
        @DisplayName("异步推导式")
        void testAsyncComprehension() {
            ListCompExpr comp = parseAs(ListCompExpr.class, "[x async for x in aiter()]");
            assertTrue(comp.getGenerators().get(0).isAsync());
        }

        @Test
        @DisplayName("括号内的 yield")
        void testYield() {
            assertFalse(parseAs(YieldExpr.class, "(yield)").hasValue());
            assertInstanceOf(TupleExpr.class, parseAs(YieldExpr.class, "(yield a, b)").getValue());
            assertInstanceOf(YieldFromExpr.class, parse("(yield from g)"));
            assertInstanceOf(YieldExpr.class, parse("yield x"));
        }

        @Test
        @DisplayName("海象运算符")
        void testWalrus() {
            NamedExpr named = parseAs(NamedExpr.class, "(n := len(a))");
            assertEquals("n", nameOf(named.getTarget()));
            assertInstanceOf(CallExpr.class, named.getValue());
        }
    }

    @Nested
    @DisplayName("后缀表达式")
    class TrailerTests {

        @Test
        @DisplayName("调用参数的四种形式")
        void testCallArguments() {
            CallExpr call = parseAs(CallExpr.class, "f(a, *b, c=1, **d)");
            assertEquals(4, call.getArgs().size());
            assertInstanceOf(PositionalArg.class, call.getArgs().get(0));
            assertInstanceOf(StarredExpr.class, call.getArgs().get(1).getValue());
            KeywordArg keyword = (KeywordArg) call.getArgs().get(2);
            assertEquals("c", nameOf(keyword.getName()));
            assertTrue(((KeywordArg) call.getArgs().get(3)).isUnpacking());
        }

        @Test
        @DisplayName("关键字参数的名字按表达式保留")
        void testKeywordNameKeptAsExpression() {
            CallExpr call = parseAs(CallExpr.class, "f(a.b=1)");
            assertInstanceOf(AttributeExpr.class, ((KeywordArg) call.getArgs().get(0)).getName());
        }

        @Test
        @DisplayName("唯一参数为生成器表达式")
        void testGeneratorArgument() {
            CallExpr call = parseAs(CallExpr.class, "sum(x for x in y)");
            assertInstanceOf(GeneratorExpr.class, call.getArgs().get(0).getValue());
            assertThrows(ParseException.class, () -> parse("f(a, x for x in y)"));
        }

        @Test
        @DisplayName("下标：索引、切片、扩展切片")
        void testSubscripts() {
            assertInstanceOf(IndexSlice.class, parseAs(SubscriptExpr.class, "a[0]").getSlice());

            DefaultSlice slice = (DefaultSlice) parseAs(SubscriptExpr.class, "a[::2]").getSlice();
            assertNull(slice.getLower());
            assertNull(slice.getUpper());
            assertNotNull(slice.getStep());

            IndexSlice tuple = (IndexSlice) parseAs(SubscriptExpr.class, "a[1, 2]").getSlice();
            assertInstanceOf(TupleExpr.class, tuple.getValue());

            ExtSlice ext = (ExtSlice) parseAs(SubscriptExpr.class, "a[1:2, 3]").getSlice();
            assertEquals(2, ext.getDims().size());
        }

        @Test
        @DisplayName("属性链")
        void testAttributes() {
            AttributeExpr attr = parseAs(AttributeExpr.class, "a.b.c");
            assertEquals("c", attr.getAttr());
            assertEquals("b", ((AttributeExpr) attr.getValue()).getAttr());
        }
    }

    @Nested
    @DisplayName("lambda")
    class LambdaTests {

        @Test
        @DisplayName("各类形参")
        void testParameters() {
            LambdaExpr lambda = parseAs(LambdaExpr.class, "lambda a, b=1, *args, c, d=2, **kw: a");
            Arguments args = lambda.getArgs();
            assertEquals(2, args.getArgs().size());
            assertEquals("args", args.getVararg().getName());
            assertEquals(2, args.getKwonly().size());
            assertEquals("kw", args.getKwarg().getName());
            assertEquals(Arrays.asList("a", "b", "args", "c", "d", "kw"), args.getAllNames());
        }

        @Test
        @DisplayName("单独的 * 之后是仅关键字参数")
        void testBareStar() {
            LambdaExpr lambda = parseAs(LambdaExpr.class, "lambda *, key: key");
            assertNull(lambda.getArgs().getVararg());
            assertEquals(1, lambda.getArgs().getKwonly().size());
        }

        @Test
        @DisplayName("无参数 lambda")
        void testNoParameters() {
            assertTrue(parseAs(LambdaExpr.class, "lambda: 0").getArgs().getAllArgs().isEmpty());
        }

        @Test
        @DisplayName("重名形参留给语义校验")
        void testDuplicateAccepted() {
            assertEquals(2, parseAs(LambdaExpr.class, "lambda x, x: x").getArgs().getArgs().size());
        }

        @Test
        @DisplayName("非默认参数不能跟在默认参数之后")
        void testDefaultOrder() {
            assertThrows(ParseException.class, () -> parse("lambda a=1, b: 0"));
        }
    }

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("相邻的普通字符串合并为一个常量")
        void testPlainConcatenation() {
            Constant constant = parseAs(Constant.class, "'a' \"b\" '''c'''");
            assertEquals("abc", constant.getStringValue());
        }

        @Test
        @DisplayName("含格式化字符串时合并为一个 JoinedStr，相邻常量合并")
        void testFormattedConcatenation() {
            JoinedStr joined = parseAs(JoinedStr.class, "'a' f'b{x}c' 'd' f'{y}'");
            assertEquals(4, joined.getValues().size());
            assertEquals("ab", ((Constant) joined.getValues().get(0)).getStringValue());
            assertInstanceOf(FormattedValue.class, joined.getValues().get(1));
            assertEquals("cd", ((Constant) joined.getValues().get(2)).getStringValue());
            assertInstanceOf(FormattedValue.class, joined.getValues().get(3));
        }

        @Test
        @DisplayName("单个格式化字符串")
        void testSingleFormatted() {
            JoinedStr joined = parseAs(JoinedStr.class, "f'{a!r}'");
            assertEquals('r', ((FormattedValue) joined.getValues().get(0)).getConversion());
        }

        @Test
        @DisplayName("字节串不能与普通字符串混用")
        void testMixedBytes() {
            assertThrows(ParseException.class, () -> parse("b'a' 'b'"));
            assertEquals(Constant.ConstantKind.BYTES, parseAs(Constant.class, "b'a' rb'b'").getKind());
        }

        @Test
        @DisplayName("字段中的错误向上传播")
        void testFieldError() {
            StringLiteralException e = assertThrows(StringLiteralException.class, () -> parse("f'{x!q}'"));
            assertEquals(StringLiteralException.Kind.INVALID_CONVERSION, e.getKind());
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("空输入")
        void testEmpty() {
            assertThrows(ParseException.class, () -> parse("   "));
        }

        @Test
        @DisplayName("多余的 token")
        void testTrailingTokens() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a b"));
            assertEquals("b", e.getToken().getLexeme());
        }

        @Test
        @DisplayName("未闭合的括号")
        void testUnclosed() {
            assertThrows(ParseException.class, () -> parse("(a"));
            assertThrows(ParseException.class, () -> parse("[a, b"));
            assertThrows(ParseException.class, () -> parse("f(a"));
        }

        @Test
        @DisplayName("语句关键词不能出现在表达式中")
        void testReservedKeyword() {
            assertThrows(ParseException.class, () -> parse("return"));
        }

        @Test
        @DisplayName("词法错误转为解析异常并输出诊断")
        void testLexerError() {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            PrintStream err = new PrintStream(baos, true, StandardCharsets.UTF_8);
            PythonExpressionParser quiet = new PythonExpressionParser(new FrontendConfig(), err);

            ParseException e = assertThrows(ParseException.class, () -> quiet.parseExpression("a $ b"));
            assertTrue(e.getMessage().startsWith("Unexpected character: $"));
            assertTrue(baos.toString(StandardCharsets.UTF_8).contains("Lexer error"));
        }

        @Test
        @DisplayName("海象运算符的目标必须是名字")
        void testWalrusTarget() {
            assertThrows(ParseException.class, () -> parse("(a.b := 1)"));
        }
    }

    @Nested
    @DisplayName("嵌套深度")
    class NestingDepthTests {

        private PythonExpressionParser limitedTo(int depth) {
            FrontendConfig config = new FrontendConfig();
            config.setMaxExpressionDepth(depth);
            return new PythonExpressionParser(config);
        }

        @Test
        @DisplayName("深层括号报告解析错误而不是耗尽调用栈")
        void testDeepParentheses() {
            ParseException e = assertThrows(ParseException.class, () -> parse(parens(20000, "1")));
            assertTrue(e.getMessage().startsWith("Expression nested too deeply"), e.getMessage());
        }

        @Test
        @DisplayName("上限以内的括号正常解析")
        void testWithinLimit() {
            Constant one = parseAs(Constant.class, parens(100, "1"));
            assertEquals(BigInteger.ONE, one.getValue());
        }

        @Test
        @DisplayName("一元运算、not、lambda、条件表达式、列表、调用都计入深度")
        void testOtherNestedForms() {
            PythonExpressionParser limited = limitedTo(5);
            assertNotNull(limited.parseExpression("--x"));

            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("-", 10) + "x"));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("not ", 10) + "x"));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("lambda: ", 10) + "x"));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("lambda a=", 10) + "x"));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("a if b else ", 10) + "c"));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("[", 10) + repeat("]", 10)));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("f(", 10) + repeat(")", 10)));
            assertThrows(ParseException.class, () -> limited.parseExpression(repeat("a[", 10) + "0" + repeat("]", 10)));
        }

        @Test
        @DisplayName("同层的长运算链不受深度限制")
        void testFlatChain() {
            PythonExpressionParser limited = limitedTo(5);
            BinaryExpr sum = (BinaryExpr) limited.parseExpression("a" + repeat(" + a", 50));
            assertEquals(BinaryExpr.BinaryOp.ADD, sum.getOperator());
        }

        @Test
        @DisplayName("失败后同一解析器仍可继续使用")
        void testReusableAfterFailure() {
            PythonExpressionParser limited = limitedTo(5);
            assertThrows(ParseException.class, () -> limited.parseExpression(parens(10, "x")));
            assertNotNull(limited.parseExpression(parens(3, "x")));
        }
    }
}
