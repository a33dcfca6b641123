package com.spp.compiler.ast;

/**
 * 源码位置：文件名、行列号（均从 1 开始）、字符偏移和长度
 *
 * <p>行号为 0 表示位置未知，例如手工构造或从不带位置的 JSON 读入的节点。</p>
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    /** 只有行列号的位置 */
    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column, 0, 0);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column
                && offset == that.offset && length == that.length
                && (file == null ? that.file == null : file.equals(that.file));
    }

    @Override
    public int hashCode() {
        int result = file != null ? file.hashCode() : 0;
        result = 31 * result + line;
        result = 31 * result + column;
        result = 31 * result + offset;
        return 31 * result + length;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return file;
        }
        return column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
