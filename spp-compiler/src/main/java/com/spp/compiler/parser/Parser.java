package com.spp.compiler.parser;

import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.lexer.Token;
import com.spp.compiler.lexer.TokenType;

import java.util.List;

import static com.spp.compiler.lexer.TokenType.*;

/**
 * Python 表达式语法分析器（递归下降）
 *
 * <p>一个实例只解析一段输入；各优先级的规则在 {@link ExprParser} 中。</p>
 */
public class Parser {

    final String fileName;
    final StringLiteralParser literalParser;
    final int maxDepth;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    final ExprParser exprParser = new ExprParser(this);

    /**
     * @param maxDepth 表达式递归结构允许的最大嵌套层数
     */
    public Parser(List<Token> tokens, String fileName, StringLiteralParser literalParser, int maxDepth) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.literalParser = literalParser;
        this.maxDepth = maxDepth;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    SourceLocation location() {
        return current.toLocation(fileName);
    }

    SourceLocation previousLocation() {
        return previous.toLocation(fileName);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 入口 ============

    /**
     * 解析一个完整的表达式输入（替换字段的内容）
     *
     * <p>接受 yield 表达式、带星号的元素和不加括号的元组，必须消费全部输入。</p>
     */
    public Expression parseExpressionInput() {
        for (Token token : tokens) {
            if (token.is(ERROR)) {
                throw new ParseException(token.getErrorMessage(), token);
            }
        }
        if (isAtEnd()) {
            throw new ParseException("Expected expression", current);
        }

        Expression expr = check(KW_YIELD)
                ? exprParser.parseYieldExpr()
                : exprParser.parseStarExpressions();

        if (!isAtEnd()) {
            throw new ParseException("Unexpected token after expression", current);
        }
        return expr;
    }
}
