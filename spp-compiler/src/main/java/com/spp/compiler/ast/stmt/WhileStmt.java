package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;

import java.util.List;

/**
 * while 循环，orelse 为循环正常结束时执行的 else 分支
 */
public class WhileStmt extends Statement {
    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public WhileStmt(SourceLocation location, Expression test, List<Statement> body, List<Statement> orelse) {
        super(location);
        this.test = test;
        this.body = immutable(body);
        this.orelse = immutable(orelse);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
