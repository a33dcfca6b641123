package com.spp.compiler.analysis;

import com.spp.compiler.ast.AstNode;
import com.spp.compiler.ast.SourceLocation;

/**
 * 树校验错误
 */
public final class ValidationError {

    public enum Kind {
        DUPLICATE_ARGUMENT("Duplicate argument in function definition"),
        NOT_ASSIGNABLE("Cannot assign to left hand-side"),
        ARGUMENT_MUST_BE_NAME("Argument must be a name"),
        NESTING_TOO_DEEP("Maximum nesting depth exceeded");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Kind kind;
    private final AstNode node;

    public ValidationError(Kind kind, AstNode node) {
        this.kind = kind;
        this.node = node;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return kind.getMessage();
    }

    /** 出错的节点 */
    public AstNode getNode() {
        return node;
    }

    public SourceLocation getLocation() {
        return node != null ? node.getLocation() : SourceLocation.UNKNOWN;
    }

    @Override
    public String toString() {
        return getLocation() + ": " + getMessage();
    }
}
