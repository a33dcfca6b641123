package com.spp.compiler.ast.decl;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 模块（AST 根节点）
 */
public class ModuleDecl extends AstNode {
    private final List<Statement> body;

    public ModuleDecl(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = immutable(body);
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
