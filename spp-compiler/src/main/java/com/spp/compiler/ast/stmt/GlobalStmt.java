package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * global 声明
 */
public class GlobalStmt extends Statement {
    private final List<String> names;

    public GlobalStmt(SourceLocation location, List<String> names) {
        super(location);
        this.names = immutable(names);
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalStmt(this, context);
    }
}
