package org.retext.exactprint;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.List;

/** Absolute position token facts supplied by the parser, indexed by the span of the node they
 * belong to and the keyword. Each fact is consumed at most once.
 */
public class RawFacts {

public static class Fact {
    public final Span nodeSpan;
    public final Keyword keyword;
    public final Span span;

    Fact(Span nodeSpan, Keyword keyword, Span span)
    {
        this.nodeSpan = nodeSpan;
        this.keyword = keyword;
        this.span = span;
    }

    public boolean
    IsConsumed()
    {
        return consumed;
    }

    @Override public String
    toString()
    {
        return String.format("%s at %s", keyword, span);
    }

    boolean consumed;
}

/** Register a keyword occurrence.
 *
 * @param nodeSpan Span of the node the keyword belongs to.
 * @param keyword Keyword kind.
 * @param span Span of the keyword in the source.
 */
public RawFacts
Add(Span nodeSpan, Keyword keyword, Span span)
{
    List<Fact> facts = index.get(new FactKey(nodeSpan, keyword));
    int pos = 0;
    while (pos < facts.size() && facts.get(pos).span.compareTo(span) <= 0) {
        pos++;
    }
    facts.add(pos, new Fact(nodeSpan, keyword, span));
    return this;
}

/** Register end of input position. */
public RawFacts
AddEof(Position pos)
{
    return Add(Span.NONE, Keyword.EOF, new Span(pos, pos));
}

/** @return All facts of the keyword for the node in position order, including consumed ones. */
public List<Fact>
Get(Span nodeSpan, Keyword keyword)
{
    return index.get(new FactKey(nodeSpan, keyword));
}

/** @return Unconsumed facts of the keyword for the node which have a width. */
public ArrayList<Fact>
Available(Span nodeSpan, Keyword keyword)
{
    ArrayList<Fact> result = new ArrayList<>();
    for (Fact f: Get(nodeSpan, keyword)) {
        if (!f.consumed && !f.span.IsPoint()) {
            result.add(f);
        }
    }
    return result;
}

/** @return Unconsumed facts which have a width, the end of input markers excluded. */
public ArrayList<Fact>
Residue()
{
    ArrayList<Fact> result = new ArrayList<>();
    for (Fact f: index.values()) {
        if (!f.consumed && !f.span.IsPoint() && !f.keyword.equals(Keyword.EOF)) {
            result.add(f);
        }
    }
    return result;
}

public int
Size()
{
    return index.size();
}

public int
ConsumedCount()
{
    int n = 0;
    for (Fact f: index.values()) {
        if (f.consumed) {
            n++;
        }
    }
    return n;
}

// /////////////////////////////////////////////////////////////////////////////////////////////////

private static class FactKey implements Comparable<FactKey> {
    final Span nodeSpan;
    final Keyword keyword;

    FactKey(Span nodeSpan, Keyword keyword)
    {
        this.nodeSpan = nodeSpan;
        this.keyword = keyword;
    }

    @Override public int
    compareTo(FactKey other)
    {
        int c = nodeSpan.compareTo(other.nodeSpan);
        if (c != 0) {
            return c;
        }
        return keyword.compareTo(other.keyword);
    }

    @Override public boolean
    equals(Object o)
    {
        if (!(o instanceof FactKey)) {
            return false;
        }
        FactKey k = (FactKey)o;
        return nodeSpan.equals(k.nodeSpan) && keyword.equals(k.keyword);
    }

    @Override public int
    hashCode()
    {
        return nodeSpan.hashCode() * 31 + keyword.hashCode();
    }
}

private final ListMultimap<FactKey, Fact> index =
    MultimapBuilder.treeKeys().arrayListValues().build();
}
