package com.spp.compiler.lexer;

import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.parser.StringLiteral;

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Python 表达式词法分析器
 *
 * <p>只处理表达式，换行视为空白。出错时向 errStream 输出诊断并产生 ERROR token，
 * 由语法分析器决定如何报告。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private final PrintStream errStream;

    private static final Map<String, TokenType> KEYWORDS;

    /** 合法的字符串前缀（小写） */
    private static final Set<String> STRING_PREFIXES = new HashSet<String>(Arrays.asList(
            "r", "u", "b", "br", "rb", "f", "fr", "rf"));

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);
        map.put("in", TokenType.KW_IN);
        map.put("is", TokenType.KW_IS);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("yield", TokenType.KW_YIELD);
        map.put("from", TokenType.KW_FROM);
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);

        // 语句关键词
        for (String kw : new String[] {"as", "assert", "break", "class", "continue", "def", "del",
                "elif", "except", "finally", "global", "import", "nonlocal", "pass", "raise",
                "return", "try", "while", "with"}) {
            map.put(kw, TokenType.KW_RESERVED);
        }

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '~': addToken(TokenType.TILDE); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '@': addToken(TokenType.AT); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '|': addToken(TokenType.PIPE); break;
            case '^': addToken(TokenType.CARET); break;

            case '*':
                addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR);
                break;

            case '/':
                addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH);
                break;

            case '<':
                if (match('<')) addToken(TokenType.LSHIFT);
                else if (match('=')) addToken(TokenType.LE);
                else addToken(TokenType.LT);
                break;

            case '>':
                if (match('>')) addToken(TokenType.RSHIFT);
                else if (match('=')) addToken(TokenType.GE);
                else addToken(TokenType.GT);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'");
                }
                break;

            case ':':
                addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
                break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            case '\\':
                // 续行
                if (match('\r')) {
                    match('\n');
                    newLine();
                } else if (match('\n')) {
                    newLine();
                } else {
                    error("Unexpected character after line continuation");
                }
                break;

            case ' ':
            case '\r':
            case '\t':
            case '\f':
                break;

            case '\n':
                newLine();
                break;

            case '\'':
            case '"':
                string("", c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        if ((peek() == '\'' || peek() == '"') && STRING_PREFIXES.contains(text.toLowerCase())) {
            string(text, advance());
            return;
        }

        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    /**
     * 扫描字符串字面量，开引号已消费
     *
     * <p>只确定字面量的边界，内容保持原样；反斜杠总是连同下一个字符一起跳过，
     * 原始字符串也是如此。</p>
     */
    private void string(String prefix, char quote) {
        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }
        String quoteStyle = triple ? repeat(quote, 3) : String.valueOf(quote);
        int contentStart = current;

        while (true) {
            if (isAtEnd()) {
                error(triple ? "Unterminated triple-quoted string" : "Unterminated string");
                return;
            }
            char c = peek();
            if (c == '\\') {
                advance();
                if (isAtEnd()) continue;
                if (advance() == '\n') newLine();
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    error("Unterminated string");
                    return;
                }
                advance();
                newLine();
                continue;
            }
            if (c == quote && (!triple || (peekNext() == quote
                    && current + 2 < source.length() && source.charAt(current + 2) == quote))) {
                break;
            }
            advance();
        }

        String content = source.substring(contentStart, current);
        for (int i = 0; i < quoteStyle.length(); i++) advance();

        SourceLocation location = new SourceLocation(fileName, startLine, startColumn,
                start, current - start);
        addToken(TokenType.STRING_LITERAL, new StringLiteral(prefix, quoteStyle, content, location));
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) sb.append(c);
        return sb.toString();
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        // 进制前缀
        if (source.charAt(start) == '0' && !isAtEnd()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x') {
                radixNumber(16);
                return;
            } else if (next == 'o') {
                radixNumber(8);
                return;
            } else if (next == 'b') {
                radixNumber(2);
                return;
            }
        }

        boolean isFloat = source.charAt(start) == '.';
        advanceDigits();

        // 小数部分
        if (!isFloat && peek() == '.') {
            advance();
            advanceDigits();
            isFloat = true;
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            if (isDigit(sign) || ((sign == '+' || sign == '-')
                    && current + 2 < source.length() && isDigit(source.charAt(current + 2)))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                advanceDigits();
                isFloat = true;
            }
        }

        String text = stripUnderscores(source.substring(start, current));

        // 虚数后缀
        if (peek() == 'j' || peek() == 'J') {
            advance();
            parseAndAddDouble(TokenType.IMAGINARY_LITERAL, text);
        } else if (isFloat) {
            parseAndAddDouble(TokenType.FLOAT_LITERAL, text);
        } else {
            parseAndAddInt(text, 10);
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费 x/o/b
        while (isRadixDigit(peek(), radix) || peek() == '_') advance();

        String text = stripUnderscores(source.substring(start + 2, current));
        parseAndAddInt(text, radix);
    }

    private static boolean isRadixDigit(char c, int radix) {
        return Character.digit(c, radix) >= 0;
    }

    // ========== 数字解析辅助方法 ==========

    private void parseAndAddInt(String text, int radix) {
        try {
            addToken(TokenType.INT_LITERAL, new BigInteger(text, radix));
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    private void parseAndAddDouble(TokenType type, String text) {
        try {
            addToken(type, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            error("Invalid float literal: " + source.substring(start, current));
        }
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, startLine, startColumn, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
