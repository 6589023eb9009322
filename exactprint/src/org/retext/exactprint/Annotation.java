package org.retext.exactprint;

import java.util.ArrayList;

/** Relative layout information of one node. Fully determines how the node prints, except its
 * children which have their own annotations.
 */
public class Annotation {

public static class CommentDelta {
    public final Comment comment;
    public final DeltaPos delta;

    public
    CommentDelta(Comment comment, DeltaPos delta)
    {
        this.comment = comment;
        this.delta = delta;
    }

    @Override public String
    toString()
    {
        return "(" + comment + ", " + delta + ")";
    }
}

public static class TokenDelta {
    public final TokenId token;
    public final DeltaPos delta;

    public
    TokenDelta(TokenId token, DeltaPos delta)
    {
        this.token = token;
        this.delta = delta;
    }

    @Override public String
    toString()
    {
        return "(" + token + ", " + delta + ")";
    }
}

/** Offset from the previous output to the node start, after the prior comments are emitted. */
public DeltaPos entryDelta;
/** Comments emitted before the node. If changed, entryDelta must be updated to match. */
public final ArrayList<CommentDelta> priorComments = new ArrayList<>();
/** Comments emitted after the node. Populated by comment balancing or by tree transformations. */
public final ArrayList<CommentDelta> followingComments = new ArrayList<>();
/** Own tokens of the node in emission order. */
public final ArrayList<TokenDelta> tokens = new ArrayList<>();
/** Source order of children which the tree does not store in source order. Null if not needed. */
public ArrayList<Span> sortKey;
/** Key of a synthesized node grouping children which have no location of their own. */
public AnnKey capturedSpan;

public
Annotation(DeltaPos entryDelta)
{
    this.entryDelta = entryDelta;
}

public
Annotation()
{
    this(DeltaPos.ZERO);
}

public Annotation
Copy()
{
    Annotation ann = new Annotation(entryDelta);
    ann.priorComments.addAll(priorComments);
    ann.followingComments.addAll(followingComments);
    ann.tokens.addAll(tokens);
    if (sortKey != null) {
        ann.sortKey = new ArrayList<>(sortKey);
    }
    ann.capturedSpan = capturedSpan;
    return ann;
}

/** Offset of the node from the last syntactic element before it, ignoring prior comments. */
public DeltaPos
TrueEntryDelta()
{
    DeltaPos dp = DeltaPos.ZERO;
    for (CommentDelta cd: priorComments) {
        dp = dp.Add(cd.delta).Add(DeltaPos.Of(cd.comment.contents));
    }
    return dp.Add(entryDelta);
}

@Override public String
toString()
{
    return String.format("(Ann (%s) %s %s %s %s %s)", entryDelta, priorComments,
                         followingComments, tokens, sortKey, capturedSpan);
}
}
