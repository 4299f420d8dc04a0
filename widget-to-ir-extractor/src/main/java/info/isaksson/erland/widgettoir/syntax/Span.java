package info.isaksson.erland.widgettoir.syntax;

/** Character range of a node in the source buffer. */
public record Span(int offset, int length) {

    /** Span of nodes built programmatically, without source text behind them. */
    public static final Span NONE = new Span(0, 0);

    public Span {
        if (offset < 0) offset = 0;
        if (length < 0) length = 0;
    }

    public int end() {
        return offset + length;
    }
}
