package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

import java.util.List;

/**
 * {@code from [.]*module import names}
 */
public class ImportFromStmt extends Statement {
    private final String module;
    private final List<Alias> names;
    private final int level;

    public ImportFromStmt(SourceLocation location, String module, List<Alias> names, int level) {
        super(location);
        this.module = module;
        this.names = immutable(names);
        this.level = level;
    }

    /** 模块名，{@code from . import x} 时为 null */
    public String getModule() {
        return module;
    }

    public List<Alias> getNames() {
        return names;
    }

    /** 相对导入的层级（前导点的个数） */
    public int getLevel() {
        return level;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportFromStmt(this, context);
    }
}
