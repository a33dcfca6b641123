package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * with 语句
 */
public class WithStmt extends Statement {
    private final List<WithItem> items;
    private final List<Statement> body;
    private final boolean async;

    public WithStmt(SourceLocation location, List<WithItem> items, List<Statement> body, boolean async) {
        super(location);
        this.items = immutable(items);
        this.body = immutable(body);
        this.async = async;
    }

    public List<WithItem> getItems() {
        return items;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithStmt(this, context);
    }
}
