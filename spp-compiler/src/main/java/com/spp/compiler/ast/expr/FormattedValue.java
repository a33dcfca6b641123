package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * f-string 中的替换字段 {@code {value!conversion:formatSpec}}
 */
public class FormattedValue extends Expression {
    /** 无转换说明符 */
    public static final char NO_CONVERSION = '\0';

    private final Expression value;
    private final char conversion;
    private final JoinedStr formatSpec;

    public FormattedValue(SourceLocation location, Expression value, char conversion, JoinedStr formatSpec) {
        super(location);
        this.value = value;
        this.conversion = conversion;
        this.formatSpec = formatSpec;
    }

    public Expression getValue() {
        return value;
    }

    /** 转换说明符 's'、'r' 或 'a'；没有时为 {@link #NO_CONVERSION} */
    public char getConversion() {
        return conversion;
    }

    public boolean hasConversion() {
        return conversion != NO_CONVERSION;
    }

    /** 格式说明，可为 null */
    public JoinedStr getFormatSpec() {
        return formatSpec;
    }

    public boolean hasFormatSpec() {
        return formatSpec != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFormattedValue(this, context);
    }
}
