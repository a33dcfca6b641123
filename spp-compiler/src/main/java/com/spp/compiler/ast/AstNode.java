package com.spp.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>节点构建后不可变：子节点列表在构造时复制为只读列表。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /** 复制为只读列表，null 视为空列表 */
    protected static <T> List<T> immutable(List<? extends T> items) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<T>(items));
    }
}
