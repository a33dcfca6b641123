package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * nonlocal 声明
 */
public class NonlocalStmt extends Statement {
    private final List<String> names;

    public NonlocalStmt(SourceLocation location, List<String> names) {
        super(location);
        this.names = immutable(names);
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNonlocalStmt(this, context);
    }
}
