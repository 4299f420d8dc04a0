package info.isaksson.erland.widgettoir.source;

import info.isaksson.erland.widgettoir.ir.IrSourceLocation;
import info.isaksson.erland.widgettoir.syntax.Span;
import info.isaksson.erland.widgettoir.syntax.SyntaxNode;

import java.util.Arrays;

/**
 * Maps character offsets of one source file to 1-based line/column locations.
 *
 * <p>Line-break positions are collected once; lookups binary-search them. The answer is the same
 * as counting {@code '\n'} characters from the start of the buffer. Offsets past the end of the
 * buffer clamp to its end and negative offsets clamp to zero.</p>
 */
public final class LocationMapper {
    private final String file;
    private final int contentLength;
    /** Offsets of every '\n', ascending. */
    private final int[] lineBreaks;

    public LocationMapper(String file, String content) {
        this.file = file == null ? "" : file;
        String text = content == null ? "" : content;
        this.contentLength = text.length();
        this.lineBreaks = scanLineBreaks(text);
    }

    public String file() {
        return file;
    }

    public IrSourceLocation locate(int offset, int length) {
        int clamped = Math.max(0, Math.min(offset, contentLength));
        // Number of line breaks strictly before the offset.
        int idx = Arrays.binarySearch(lineBreaks, clamped);
        int breaksBefore = idx >= 0 ? idx : -idx - 1;
        int line = breaksBefore + 1;
        int lineStart = breaksBefore == 0 ? 0 : lineBreaks[breaksBefore - 1] + 1;
        int column = clamped - lineStart + 1;
        return new IrSourceLocation(file, line, column, clamped, Math.max(0, length));
    }

    public IrSourceLocation locate(Span span) {
        if (span == null) return IrSourceLocation.unknown(file);
        return locate(span.offset(), span.length());
    }

    public IrSourceLocation locate(SyntaxNode node) {
        return node == null ? IrSourceLocation.unknown(file) : locate(node.span());
    }

    public int lineCount() {
        return lineBreaks.length + 1;
    }

    private static int[] scanLineBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        int[] out = new int[count];
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') out[n++] = i;
        }
        return out;
    }
}
