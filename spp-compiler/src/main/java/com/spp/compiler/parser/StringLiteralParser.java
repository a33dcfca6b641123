package com.spp.compiler.parser;

import com.spp.compiler.FrontendConfig;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 字符串字面量解析：普通字面量得到 {@link Constant}，格式化字面量得到 {@link JoinedStr}
 *
 * <p>顶层文本和格式说明使用同一个扫描过程（{@link #parseFormatted(String)}），
 * 转义和嵌套规则在两处完全一致。替换字段中的表达式交给注入的 {@link ExpressionParser}，
 * 它抛出的异常原样向上传播。</p>
 */
public final class StringLiteralParser {

    private final ExpressionParser expressionParser;
    private final int maxFieldNestingDepth;

    public StringLiteralParser(ExpressionParser expressionParser) {
        this(expressionParser, new FrontendConfig());
    }

    public StringLiteralParser(ExpressionParser expressionParser, FrontendConfig config) {
        this.expressionParser = expressionParser;
        this.maxFieldNestingDepth = config.getMaxFieldNestingDepth();
    }

    /**
     * 解析字面量
     *
     * <p>格式化字面量总是得到 JoinedStr，即使内容为空或者不含替换字段。
     * 普通字面量原样返回原始文本。</p>
     */
    public Expression parse(StringLiteral literal) {
        if (!literal.isFormatted()) {
            Constant.ConstantKind kind = literal.isBytes()
                    ? Constant.ConstantKind.BYTES : Constant.ConstantKind.STRING;
            return new Constant(literal.getLocation(), literal.getRawContent(), kind);
        }
        return parseFormatted(literal.getRawContent(), 0, literal.getLocation());
    }

    /** 把格式化字符串内容解析为片段序列 */
    public JoinedStr parseFormatted(String text) {
        return parseFormatted(text, 0, SourceLocation.UNKNOWN);
    }

    private JoinedStr parseFormatted(String text, int depth, SourceLocation loc) {
        List<Expression> fragments = new ArrayList<Expression>();
        StringBuilder literal = new StringBuilder();
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);

            if (c == '{') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                flush(literal, fragments, loc);
                Field field = scanField(text, i, depth + 1);
                fragments.add(buildFormattedValue(text, field, depth + 1, loc));
                i = field.end + 1;
            } else if (c == '}') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new StringLiteralException(StringLiteralException.Kind.UNMATCHED_BRACE, text, i);
            } else {
                literal.append(c);
                i++;
            }
        }

        flush(literal, fragments, loc);
        return new JoinedStr(loc, fragments);
    }

    private void flush(StringBuilder literal, List<Expression> fragments, SourceLocation loc) {
        if (literal.length() > 0) {
            fragments.add(Constant.ofString(loc, literal.toString()));
            literal.setLength(0);
        }
    }

    private FormattedValue buildFormattedValue(String text, Field field, int depth, SourceLocation loc) {
        String exprText = text.substring(field.open + 1, field.exprEnd);
        if (exprText.trim().isEmpty()) {
            throw new StringLiteralException(StringLiteralException.Kind.EMPTY_EXPRESSION, text, field.open);
        }

        char conversion = FormattedValue.NO_CONVERSION;
        if (field.conversionStart >= 0) {
            String spec = text.substring(field.conversionStart, field.conversionEnd);
            if (spec.length() != 1 || "sra".indexOf(spec.charAt(0)) < 0) {
                throw new StringLiteralException(StringLiteralException.Kind.INVALID_CONVERSION,
                        text, field.conversionStart - 1);
            }
            conversion = spec.charAt(0);
        }

        Expression value = expressionParser.parseExpression(exprText);

        JoinedStr formatSpec = null;
        if (field.specStart >= 0) {
            // 格式说明中可以再嵌套替换字段，按同样的规则递归解析
            formatSpec = parseFormatted(text.substring(field.specStart, field.end), depth, loc);
        }
        return new FormattedValue(loc, value, conversion, formatSpec);
    }

    // ============ 字段扫描 ============

    /**
     * 从 open 处的 '{' 开始，找到与之匹配的顶层 '}'，并记录转换说明符和格式说明的位置
     *
     * <p>表达式部分跟踪 ()[]{} 嵌套和引号状态，第一个顶层的 '!'（不含 '!='）或 ':' 结束表达式。
     * 格式说明部分只关心花括号：嵌套字段整体跳过，第一个顶层 '}' 结束整个字段。</p>
     */
    private Field scanField(String text, int open, int depth) {
        if (depth > maxFieldNestingDepth) {
            throw new StringLiteralException(StringLiteralException.Kind.NESTING_TOO_DEEP, text, open);
        }
        int n = text.length();
        int i = open + 1;
        int brackets = 0;
        char quote = 0;
        boolean triple = false;

        Field field = new Field(open);

        // 表达式部分
        while (i < n) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    if (!triple) {
                        quote = 0;
                    } else if (isTripleQuote(text, i, quote)) {
                        quote = 0;
                        i += 3;
                        continue;
                    }
                }
                i++;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                triple = isTripleQuote(text, i, c);
                i += triple ? 3 : 1;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                brackets++;
            } else if (c == ')' || c == ']') {
                // 括号不配对时交给表达式解析器报错
                if (brackets > 0) brackets--;
            } else if (c == '}') {
                if (brackets == 0) {
                    field.exprEnd = i;
                    field.end = i;
                    return field;
                }
                brackets--;
            } else if (brackets == 0 && c == '!' && !(i + 1 < n && text.charAt(i + 1) == '=')) {
                field.exprEnd = i;
                field.conversionStart = i + 1;
                i++;
                break;
            } else if (brackets == 0 && c == ':') {
                field.exprEnd = i;
                field.specStart = i + 1;
                i++;
                break;
            }
            i++;
        }
        if (field.exprEnd < 0) {
            throw new StringLiteralException(StringLiteralException.Kind.UNTERMINATED_FIELD, text, open);
        }

        // 转换说明符：到下一个 ':' 或 '}' 为止
        if (field.conversionStart >= 0) {
            while (i < n && text.charAt(i) != ':' && text.charAt(i) != '}') {
                i++;
            }
            if (i >= n) {
                throw new StringLiteralException(StringLiteralException.Kind.UNTERMINATED_FIELD, text, open);
            }
            field.conversionEnd = i;
            if (text.charAt(i) == '}') {
                field.end = i;
                return field;
            }
            field.specStart = i + 1;
            i++;
        }

        // 格式说明
        while (i < n) {
            char c = text.charAt(i);
            if (c == '{') {
                if (i + 1 < n && text.charAt(i + 1) == '{') {
                    i += 2;
                    continue;
                }
                i = scanField(text, i, depth + 1).end + 1;
                continue;
            }
            if (c == '}') {
                field.end = i;
                return field;
            }
            i++;
        }
        throw new StringLiteralException(StringLiteralException.Kind.UNTERMINATED_FIELD, text, open);
    }

    private static boolean isTripleQuote(String text, int i, char quote) {
        return i + 2 < text.length() && text.charAt(i + 1) == quote && text.charAt(i + 2) == quote;
    }

    /** 一个替换字段在文本中的边界，-1 表示对应部分不存在 */
    private static final class Field {
        final int open;
        int exprEnd = -1;
        int conversionStart = -1;
        int conversionEnd = -1;
        int specStart = -1;
        int end = -1;

        Field(int open) {
            this.open = open;
        }
    }
}
