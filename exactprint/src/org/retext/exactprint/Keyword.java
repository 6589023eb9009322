package org.retext.exactprint;

import java.util.EnumSet;

/** Kind of a keyword or punctuation token which is not represented in the syntax tree itself.
 * Keywords are identified by name.
 */
public final class Keyword implements Comparable<Keyword> {

public enum Flag {
    /** Separating comma or semicolon. A comment must not be moved after it. */
    SEPARATOR,
    /** Lexer may inject the token out of source order (e.g. closing layout punctuation). Such
     * tokens are dropped when they lie behind the current position.
     */
    VIRTUAL
}

/** End of input marker. */
public static final Keyword EOF = new Keyword("<eof>", "");
/** Text of the node itself, taken from the node value when printing. */
public static final Keyword VALUE = new Keyword("<value>", "");
/** Offset of a layout region baseline, recorded in the node owning the region. Not printed. */
public static final Keyword LAYOUT = new Keyword("<layout>", "");

public final String name;
/** Text printed for the keyword. */
public final String text;

public
Keyword(String name, String text)
{
    this.name = name;
    this.text = text;
}

/** Same meaning glyph used when the source spells the keyword in Unicode syntax. */
public Keyword
Unicode(String glyph)
{
    unicode = glyph;
    return this;
}

public Keyword
Flags(Flag... flags)
{
    for (Flag f: flags) {
        this.flags.add(f);
    }
    return this;
}

public String
GetUnicode()
{
    return unicode;
}

public boolean
Is(Flag flag)
{
    return flags.contains(flag);
}

@Override public int
compareTo(Keyword other)
{
    return name.compareTo(other.name);
}

@Override public boolean
equals(Object o)
{
    return o instanceof Keyword && ((Keyword)o).name.equals(name);
}

@Override public int
hashCode()
{
    return name.hashCode();
}

@Override public String
toString()
{
    return name;
}

private String unicode;
private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
}
