package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 关键字实参 {@code name=value}；name 为 null 表示 {@code **kwargs}
 *
 * <p>name 以表达式形式保存（解析器按表达式解析等号左侧），
 * 是否为合法标识符由树校验负责。</p>
 */
public class KeywordArg extends CallArgument {
    private final Expression name;
    private final Expression value;

    public KeywordArg(SourceLocation location, Expression name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public Expression getName() {
        return name;
    }

    @Override
    public Expression getValue() {
        return value;
    }

    public boolean isUnpacking() {
        return name == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitKeywordArg(this, context);
    }
}
