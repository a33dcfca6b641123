package com.spp.compiler.parser;

import com.spp.compiler.lexer.Token;
import com.spp.compiler.lexer.TokenType;

/**
 * 语法错误
 *
 * <p>表达式语法错误带出错的 token；格式化字符串的结构错误见 {@link StringLiteralException}，
 * 那里没有 token，只有扫描文本中的偏移。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message) {
        this(message, null, null);
    }

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    /**
     * @param expected 期望的 token 类型，可为 null
     */
    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    /** 出错的 token，可为 null */
    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不含位置信息的错误描述 */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (token == null) {
            return getReason();
        }
        StringBuilder sb = new StringBuilder(getReason());
        sb.append(" at ").append(token.getLine()).append(':').append(token.getColumn());
        if (token.is(TokenType.EOF)) {
            sb.append(" (end of input)");
        } else {
            sb.append(" near '").append(token.getLexeme()).append('\'');
        }
        if (expected != null) {
            sb.append(", expected ").append(expected);
        }
        return sb.toString();
    }
}
