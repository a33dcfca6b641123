package com.spp.compiler.parser;

import com.spp.compiler.ast.SourceLocation;

/**
 * 词法分析得到的原始字符串字面量：前缀、引号形式、引号之间的原始文本
 *
 * <p>引号形式仅作记录，不影响解析。</p>
 */
public final class StringLiteral {
    private final String prefix;
    private final String quoteStyle;
    private final String rawContent;
    private final SourceLocation location;

    public StringLiteral(String prefix, String quoteStyle, String rawContent) {
        this(prefix, quoteStyle, rawContent, SourceLocation.UNKNOWN);
    }

    public StringLiteral(String prefix, String quoteStyle, String rawContent, SourceLocation location) {
        this.prefix = prefix != null ? prefix : "";
        this.quoteStyle = quoteStyle;
        this.rawContent = rawContent;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getQuoteStyle() {
        return quoteStyle;
    }

    public String getRawContent() {
        return rawContent;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 前缀含 f/F 时为格式化字符串 */
    public boolean isFormatted() {
        return hasPrefixChar('f');
    }

    public boolean isBytes() {
        return hasPrefixChar('b');
    }

    public boolean isRaw() {
        return hasPrefixChar('r');
    }

    private boolean hasPrefixChar(char lower) {
        for (int i = 0; i < prefix.length(); i++) {
            if (Character.toLowerCase(prefix.charAt(i)) == lower) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return prefix + quoteStyle + rawContent + quoteStyle;
    }
}
