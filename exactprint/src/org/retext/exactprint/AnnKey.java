package org.retext.exactprint;

/** Identity of an annotated node: its source span and its shape tag. */
public final class AnnKey implements Comparable<AnnKey> {

public final Span span;
public final String shape;

public
AnnKey(Span span, String shape)
{
    this.span = span;
    this.shape = shape;
}

@Override public int
compareTo(AnnKey other)
{
    int c = span.compareTo(other.span);
    if (c != 0) {
        return c;
    }
    return shape.compareTo(other.shape);
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof AnnKey)) {
        return false;
    }
    AnnKey k = (AnnKey)o;
    return span.equals(k.span) && shape.equals(k.shape);
}

@Override public int
hashCode()
{
    return span.hashCode() * 31 + shape.hashCode();
}

@Override public String
toString()
{
    return "AnnKey " + span + " " + shape;
}
}
