package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * import 语句
 */
public class ImportStmt extends Statement {
    private final List<Alias> names;

    public ImportStmt(SourceLocation location, List<Alias> names) {
        super(location);
        this.names = immutable(names);
    }

    public List<Alias> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}
