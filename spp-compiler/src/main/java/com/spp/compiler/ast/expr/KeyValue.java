package com.spp.compiler.ast.expr;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 字典条目；key 为 null 表示 {@code **mapping} 解包
 */
public class KeyValue extends AstNode {
    private final Expression key;
    private final Expression value;

    public KeyValue(SourceLocation location, Expression key, Expression value) {
        super(location);
        this.key = key;
        this.value = value;
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    /** 是否为 ** 解包条目 */
    public boolean isUnpacking() {
        return key == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitKeyValue(this, context);
    }
}
