package com.spp.compiler.ast.decl;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.CallArgument;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 类定义；bases 与调用实参同构（支持 {@code metaclass=...} 等关键字）
 */
public class ClassDecl extends Statement {
    private final String name;
    private final List<CallArgument> bases;
    private final List<Statement> body;
    private final List<Expression> decorators;

    public ClassDecl(SourceLocation location, String name, List<CallArgument> bases,
                     List<Statement> body, List<Expression> decorators) {
        super(location);
        this.name = name;
        this.bases = immutable(bases);
        this.body = immutable(body);
        this.decorators = immutable(decorators);
    }

    public String getName() {
        return name;
    }

    public List<CallArgument> getBases() {
        return bases;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
