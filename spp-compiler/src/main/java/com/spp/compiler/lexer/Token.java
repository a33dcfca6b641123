package com.spp.compiler.lexer;

import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.parser.StringLiteral;

/**
 * 词法单元
 *
 * <p>literal 按类型存放：INT_LITERAL 为 BigInteger，FLOAT_LITERAL/IMAGINARY_LITERAL 为 Double，
 * STRING_LITERAL 为 {@link StringLiteral}，ERROR 为错误消息，其余为 null。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public StringLiteral getStringLiteral() {
        if (type != TokenType.STRING_LITERAL) {
            throw new IllegalStateException("Not a string token: " + this);
        }
        return (StringLiteral) literal;
    }

    /** ERROR token 携带的词法错误描述 */
    public String getErrorMessage() {
        if (type != TokenType.ERROR) {
            throw new IllegalStateException("Not an error token: " + this);
        }
        return String.valueOf(literal);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 词素首字符在源码中的偏移 */
    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (type == t) return true;
        }
        return false;
    }

    public SourceLocation toLocation(String fileName) {
        return new SourceLocation(fileName, line, column, offset, lexeme.length());
    }

    @Override
    public String toString() {
        return type == TokenType.EOF
                ? "EOF at " + line + ":" + column
                : type + " '" + lexeme + "' at " + line + ":" + column;
    }
}
