package info.isaksson.erland.widgettoir.core;

import info.isaksson.erland.widgettoir.syntax.CompilationUnit;

/** One parsed source file: its path, its text (for line/column mapping) and its syntax tree. */
public final class FileInput {
    public final String filePath;
    public final String content;
    public final CompilationUnit unit;

    public FileInput(String filePath, String content, CompilationUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        this.filePath = filePath == null ? "" : filePath;
        this.content = content == null ? "" : content;
        this.unit = unit;
    }
}
