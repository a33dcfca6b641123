package com.spp.compiler.ast.stmt;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.AstVisitor;
import com.spp.compiler.ast.SourceLocation;

/**
 * 导入项 {@code name [as asname]}
 */
public class Alias extends AstNode {
    private final String name;
    private final String asName;

    public Alias(SourceLocation location, String name, String asName) {
        super(location);
        this.name = name;
        this.asName = asName;
    }

    public String getName() {
        return name;
    }

    public String getAsName() {
        return asName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAlias(this, context);
    }
}
