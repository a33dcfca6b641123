package com.spp.compiler.parser;

import com.spp.compiler.ast.expr.Expression;

/**
 * 表达式解析能力：f-string 替换字段中的表达式文本交给它解析
 */
@FunctionalInterface
public interface ExpressionParser {

    /**
     * @param text 表达式源码
     * @return 表达式节点
     * @throws ParseException 语法错误
     */
    Expression parseExpression(String text);
}
