package com.spp.cli.json;

/**
 * JSON 语法树格式错误：未知节点类型、缺少字段或字段类型不对
 */
public class AstJsonException extends RuntimeException {

    private final String path;

    public AstJsonException(String message, String path) {
        super(message);
        this.path = path;
    }

    public AstJsonException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错位置的 JSON 路径，例如 {@code $.body[0].value} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return path != null ? super.getMessage() + " at " + path : super.getMessage();
    }
}
