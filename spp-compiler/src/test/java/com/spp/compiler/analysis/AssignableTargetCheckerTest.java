package com.spp.compiler.analysis;

import com.spp.compiler.ast.expr.*;
import com.spp.compiler.parser.PythonExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 赋值目标检查测试
 */
class AssignableTargetCheckerTest {

    private final AssignableTargetChecker checker = new AssignableTargetChecker();
    private final PythonExpressionParser parser = new PythonExpressionParser();

    private boolean assignable(String source) {
        return checker.isAssignable(parser.parseExpression(source));
    }

    @Test
    @DisplayName("名字、属性、下标可赋值")
    void testBaseCases() {
        assertTrue(assignable("x"));
        assertTrue(assignable("a.b.c"));
        assertTrue(assignable("a[0]"));
        assertTrue(assignable("f().attr"));
        assertTrue(assignable("a[1:2, ::3]"));
    }

    @Test
    @DisplayName("元组和列表在所有元素可赋值时可赋值")
    void testUnpacking() {
        assertTrue(assignable("a, b"));
        assertTrue(assignable("[a, (b, [c.d, e[0]])]"));
        assertTrue(assignable("()"));
        assertTrue(assignable("[]"));
    }

    @Test
    @DisplayName("其它表达式不可赋值")
    void testRejected() {
        for (String source : Arrays.asList("1", "'s'", "f()", "a + b", "-a", "not a", "a < b",
                "a if b else c", "lambda: 0", "{a}", "{a: b}", "[x for x in y]", "(x for x in y)",
                "a and b", "None", "...", "*a", "(a, 1)", "[a, [b, f()]]")) {
            assertFalse(assignable(source), source);
        }
    }

    @Test
    @DisplayName("错误指向最内层的非法元素")
    void testErrorNode() {
        Expression call = new CallExpr(null, new NameExpr(null, "f"), Collections.<CallArgument>emptyList());
        TupleExpr target = new TupleExpr(null, Arrays.asList(new NameExpr(null, "a"), call));
        ValidationResult result = checker.check(target);
        assertEquals(ValidationError.Kind.NOT_ASSIGNABLE, result.getError().getKind());
        assertSame(call, result.getError().getNode());
    }

    @Test
    @DisplayName("不可赋值的判断不依赖嵌套深度")
    void testDeepNesting() {
        Expression ok = new NameExpr(null, "x");
        Expression bad = Constant.none(null);
        for (int i = 0; i < 40; i++) {
            ok = new ListExpr(null, Arrays.asList(ok, new NameExpr(null, "y")));
            bad = new TupleExpr(null, Arrays.asList(new NameExpr(null, "y"), bad));
        }
        assertTrue(checker.isAssignable(ok));
        assertFalse(checker.isAssignable(bad));
    }
}
