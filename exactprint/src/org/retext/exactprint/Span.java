package org.retext.exactprint;

/** Contiguous source range. The end position is exclusive. */
public final class Span implements Comparable<Span> {

/** Span of elements which do not come from the source, e.g. nodes created by a transformation. */
public static final Span NONE = new Span();

public final Position start, end;

public
Span(Position start, Position end)
{
    if (end.IsBefore(start)) {
        throw new IllegalArgumentException(
            String.format("Span end precedes its start: %s - %s", start, end));
    }
    this.start = start;
    this.end = end;
}

public
Span(int startLine, int startCol, int endLine, int endCol)
{
    this(new Position(startLine, startCol), new Position(endLine, endCol));
}

public boolean
IsGood()
{
    return this != NONE;
}

/** Zero width span. The lexer injects such spans for virtual tokens (e.g. layout braces), they
 * never correspond to user text.
 */
public boolean
IsPoint()
{
    return IsGood() && start.equals(end);
}

/** Check if this span lies fully inside the specified one. */
public boolean
IsSubspanOf(Span other)
{
    if (!IsGood() || !other.IsGood()) {
        return false;
    }
    return other.start.compareTo(start) <= 0 && end.compareTo(other.end) <= 0;
}

public Span
Union(Span other)
{
    if (!IsGood()) {
        return other;
    }
    if (!other.IsGood()) {
        return this;
    }
    Position s = start.compareTo(other.start) <= 0 ? start : other.start;
    return new Span(s, Position.Max(end, other.end));
}

/** Number of columns the span occupies, -1 if it spans several lines. */
public int
Length()
{
    if (!IsGood() || start.line != end.line) {
        return -1;
    }
    return end.col - start.col;
}

@Override public int
compareTo(Span other)
{
    if (this == other) {
        return 0;
    }
    /* Spans with no location sort first. */
    if (!IsGood()) {
        return -1;
    }
    if (!other.IsGood()) {
        return 1;
    }
    int c = start.compareTo(other.start);
    if (c != 0) {
        return c;
    }
    return end.compareTo(other.end);
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof Span)) {
        return false;
    }
    Span s = (Span)o;
    if (!IsGood() || !s.IsGood()) {
        return this == s;
    }
    return start.equals(s.start) && end.equals(s.end);
}

@Override public int
hashCode()
{
    if (!IsGood()) {
        return 0;
    }
    return start.hashCode() * 17 + end.hashCode();
}

@Override public String
toString()
{
    if (!IsGood()) {
        return "<no span>";
    }
    return String.format("(%d,%d)-(%d,%d)", start.line, start.col, end.line, end.col);
}

private
Span()
{
    start = null;
    end = null;
}
}
