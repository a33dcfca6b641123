package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * try 语句
 */
public class TryStmt extends Statement {
    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orelse;
    private final List<Statement> finalBody;

    public TryStmt(SourceLocation location, List<Statement> body, List<ExceptHandler> handlers,
                   List<Statement> orelse, List<Statement> finalBody) {
        super(location);
        this.body = immutable(body);
        this.handlers = immutable(handlers);
        this.orelse = immutable(orelse);
        this.finalBody = immutable(finalBody);
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    public List<Statement> getFinalBody() {
        return finalBody;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
