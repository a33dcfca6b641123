package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 格式化字符串（f-string）
 *
 * <p>values 按源码从左到右的顺序保存片段，每个片段是字符串 {@link Constant}
 * 或 {@link FormattedValue}。格式说明（format spec）同样以 JoinedStr 表示。</p>
 */
public class JoinedStr extends Expression {
    private final List<Expression> values;

    public JoinedStr(SourceLocation location, List<Expression> values) {
        super(location);
        this.values = immutable(values);
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJoinedStr(this, context);
    }
}
