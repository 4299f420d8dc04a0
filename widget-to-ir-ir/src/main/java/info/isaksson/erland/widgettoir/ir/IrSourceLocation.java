package info.isaksson.erland.widgettoir.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Provenance of an IR node or component: the file plus a 1-based line/column and the byte span.
 */
@JsonPropertyOrder({"file","line","column","offset","length"})
public final class IrSourceLocation {
    public final String file;
    public final int line;
    public final int column;
    public final int offset;
    public final int length;

    public IrSourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file == null ? "" : file;
        this.line = Math.max(1, line);
        this.column = Math.max(1, column);
        this.offset = Math.max(0, offset);
        this.length = Math.max(0, length);
    }

    /** Location used when a node has no usable span (e.g. a synthesized fallback). */
    public static IrSourceLocation unknown(String file) {
        return new IrSourceLocation(file, 1, 1, 0, 0);
    }

    /** {@code file:line:column}, the format warnings and reports use. */
    public String humanReadable() {
        return file + ":" + line + ":" + column;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSourceLocation)) return false;
        IrSourceLocation that = (IrSourceLocation) o;
        return line == that.line &&
                column == that.column &&
                offset == that.offset &&
                length == that.length &&
                Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, line, column, offset, length);
    }

    @Override public String toString() {
        return humanReadable() + "[" + offset + "+" + length + "]";
    }
}
