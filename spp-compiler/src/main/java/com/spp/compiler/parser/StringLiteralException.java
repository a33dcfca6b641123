package com.spp.compiler.parser;

/**
 * 格式化字符串字面量的结构错误
 */
public class StringLiteralException extends ParseException {

    public enum Kind {
        UNTERMINATED_FIELD("f-string: expecting '}'"),
        UNMATCHED_BRACE("f-string: single '}' is not allowed"),
        INVALID_CONVERSION("f-string: invalid conversion character: expected 's', 'r', or 'a'"),
        EMPTY_EXPRESSION("f-string: empty expression not allowed"),
        NESTING_TOO_DEEP("f-string: expressions nested too deeply");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Kind kind;
    private final String text;
    private final int offset;

    public StringLiteralException(Kind kind, String text, int offset) {
        super(kind.getMessage());
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    public Kind getKind() {
        return kind;
    }

    /** 出错时正在扫描的文本（顶层内容或某个格式说明） */
    public String getText() {
        return text;
    }

    /** 问题在 text 中的起始偏移 */
    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        return getReason() + " at offset " + offset + " in \"" + text + "\"";
    }
}
