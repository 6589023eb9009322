package org.retext.exactprint;

import java.util.Objects;

/** Identifies an element recorded in the token list of an annotation. */
public final class TokenId {

public enum Type {
    /** Normal keyword. */
    KEYWORD,
    /** Keyword which was spelled with its Unicode glyph. */
    UNICODE,
    /** Separator marked outside of its node. */
    SEPARATOR,
    /** Explicit text to print. */
    STRING,
    /** Comment interleaved between the node's own tokens. */
    COMMENT
}

public final Type type;
public final Keyword keyword;
public final String string;
public final Comment comment;

public static TokenId
Keyword(Keyword keyword)
{
    return new TokenId(Type.KEYWORD, keyword, null, null);
}

public static TokenId
Unicode(Keyword keyword)
{
    return new TokenId(Type.UNICODE, keyword, null, null);
}

public static TokenId
Separator(Keyword keyword)
{
    return new TokenId(Type.SEPARATOR, keyword, null, null);
}

/** Keyword printed with the specified text. */
public static TokenId
String(Keyword keyword, String string)
{
    return new TokenId(Type.STRING, keyword, string, null);
}

public static TokenId
Comment(Comment comment)
{
    return new TokenId(Type.COMMENT, null, null, comment);
}

/** Check if the token stands for the specified keyword. */
public boolean
Matches(Keyword kw)
{
    return type != Type.COMMENT && keyword.equals(kw);
}

/** Text which this token prints when no other text is supplied. */
public String
GetText()
{
    switch (type) {
    case UNICODE:
        return keyword.GetUnicode();
    case STRING:
        return string;
    case COMMENT:
        return comment.contents;
    default:
        return keyword.text;
    }
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof TokenId)) {
        return false;
    }
    TokenId t = (TokenId)o;
    return type == t.type && Objects.equals(keyword, t.keyword) &&
        Objects.equals(string, t.string) && Objects.equals(comment, t.comment);
}

@Override public int
hashCode()
{
    return Objects.hash(type, keyword, string, comment);
}

@Override public String
toString()
{
    switch (type) {
    case KEYWORD:
        return "(G " + keyword + ")";
    case UNICODE:
        return "(Unicode " + keyword + ")";
    case SEPARATOR:
        return "(Sep " + keyword + ")";
    case STRING:
        return "(String " + string + ")";
    default:
        return "(" + comment + ")";
    }
}

private
TokenId(Type type, Keyword keyword, String string, Comment comment)
{
    this.type = type;
    this.keyword = keyword;
    this.string = string;
    this.comment = comment;
}
}
