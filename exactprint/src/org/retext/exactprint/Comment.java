package org.retext.exactprint;

import java.util.Objects;

/** Source comment. */
public final class Comment implements Comparable<Comment> {

/** Contents including the delimiters. */
public final String contents;
/** Also distinguishes comments with the same contents. */
public final Span span;
/** Set when the comment was made from a piece of syntax which the tree does not preserve. */
public final Keyword origin;

public
Comment(String contents, Span span, Keyword origin)
{
    this.contents = contents;
    this.span = span;
    this.origin = origin;
}

public
Comment(String contents, Span span)
{
    this(contents, span, null);
}

@Override public int
compareTo(Comment other)
{
    int c = span.compareTo(other.span);
    if (c != 0) {
        return c;
    }
    return contents.compareTo(other.contents);
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof Comment)) {
        return false;
    }
    Comment c = (Comment)o;
    return contents.equals(c.contents) && span.equals(c.span) && Objects.equals(origin, c.origin);
}

@Override public int
hashCode()
{
    return Objects.hash(contents, span, origin);
}

@Override public String
toString()
{
    if (origin != null) {
        return String.format("Comment %s %s (from %s)", span, contents, origin);
    }
    return String.format("Comment %s %s", span, contents);
}
}
