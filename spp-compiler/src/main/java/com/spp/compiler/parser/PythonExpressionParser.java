package com.spp.compiler.parser;

import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.lexer.Lexer;

import java.io.PrintStream;

/**
 * Python 表达式解析器
 *
 * <p>每次调用都新建 Lexer 和 Parser，实例本身无状态，可在线程间共享。
 * 字符串字面量交给内部的 {@link StringLiteralParser}，替换字段再回调本解析器。</p>
 */
public final class PythonExpressionParser implements ExpressionParser {

    public static final String DEFAULT_FILE_NAME = "<expr>";

    private final PrintStream errStream;
    private final StringLiteralParser literalParser;
    private final int maxDepth;

    public PythonExpressionParser() {
        this(new FrontendConfig());
    }

    public PythonExpressionParser(FrontendConfig config) {
        this(config, System.err);
    }

    public PythonExpressionParser(FrontendConfig config, PrintStream errStream) {
        this.errStream = errStream;
        this.maxDepth = config.getMaxExpressionDepth();
        this.literalParser = new StringLiteralParser(this, config);
    }

    @Override
    public Expression parseExpression(String text) {
        return parseExpression(text, DEFAULT_FILE_NAME);
    }

    public Expression parseExpression(String text, String fileName) {
        Lexer lexer = new Lexer(text, fileName, errStream);
        Parser parser = new Parser(lexer.scanTokens(), fileName, literalParser, maxDepth);
        return parser.parseExpressionInput();
    }

    public StringLiteralParser getLiteralParser() {
        return literalParser;
    }
}
