package com.spp.compiler.analysis;

/**
 * 树校验失败
 */
public class ValidationException extends RuntimeException {
    private final ValidationError error;

    public ValidationException(ValidationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (error.getLocation().isKnown()) {
            sb.append(" at line ").append(error.getLocation().getLine());
            sb.append(", column ").append(error.getLocation().getColumn());
        }
        return sb.toString();
    }
}
