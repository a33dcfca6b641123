package com.spp.compiler.ast.decl;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.expr.Expression;
import com.spp.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 函数定义 {@code [async] def name(args) -> returns: body}
 */
public class FunctionDecl extends Statement {
    private final String name;
    private final Arguments args;
    private final List<Statement> body;
    private final List<Expression> decorators;
    private final Expression returns;
    private final boolean async;

    public FunctionDecl(SourceLocation location, String name, Arguments args, List<Statement> body,
                        List<Expression> decorators, Expression returns, boolean async) {
        super(location);
        this.name = name;
        this.args = args;
        this.body = immutable(body);
        this.decorators = immutable(decorators);
        this.returns = returns;
        this.async = async;
    }

    public String getName() {
        return name;
    }

    public Arguments getArgs() {
        return args;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    /** 返回类型注解，可为 null */
    public Expression getReturns() {
        return returns;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
