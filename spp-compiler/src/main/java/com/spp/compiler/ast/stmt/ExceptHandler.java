package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

import java.util.List;

/**
 * except 子句 {@code except [type [as name]]: body}
 */
public class ExceptHandler extends AstNode {
    private final Expression type;
    private final String name;
    private final List<Statement> body;

    public ExceptHandler(SourceLocation location, Expression type, String name, List<Statement> body) {
        super(location);
        this.type = type;
        this.name = name;
        this.body = immutable(body);
    }

    public Expression getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExceptHandler(this, context);
    }
}
