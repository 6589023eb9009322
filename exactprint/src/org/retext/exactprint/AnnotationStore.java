package org.retext.exactprint;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Complete set of annotations for a tree. Not safe for concurrent modification, each run should
 * own its store.
 */
public class AnnotationStore {

/** @return Annotation for the key, null if the node was not present in the original source. */
public Annotation
Get(AnnKey key)
{
    if (!key.span.IsGood()) {
        return null;
    }
    return anns.get(key);
}

public Annotation
Get(Ast.Node node)
{
    return Get(node.Key());
}

public void
Put(AnnKey key, Annotation ann)
{
    if (!key.span.IsGood()) {
        throw new IllegalArgumentException("Annotation key without location: " + key);
    }
    anns.put(key, ann);
}

public Annotation
Remove(AnnKey key)
{
    return anns.remove(key);
}

/** Copy the annotation from the old key to the new one. Used when a transformation changes the
 * span of a node while keeping its shape.
 *
 * @return True if there was an annotation to copy.
 */
public boolean
Relocate(AnnKey oldKey, AnnKey newKey)
{
    Annotation ann = Get(oldKey);
    if (ann == null) {
        return false;
    }
    Put(newKey, ann.Copy());
    return true;
}

public boolean
Contains(AnnKey key)
{
    return Get(key) != null;
}

public Set<AnnKey>
Keys()
{
    return anns.keySet();
}

public int
Size()
{
    return anns.size();
}

/** All comments attached anywhere in the store. */
public ArrayList<Comment>
AllComments()
{
    ArrayList<Comment> result = new ArrayList<>();
    for (Annotation ann: anns.values()) {
        for (Annotation.CommentDelta cd: ann.priorComments) {
            result.add(cd.comment);
        }
        for (Annotation.TokenDelta td: ann.tokens) {
            if (td.token.type == TokenId.Type.COMMENT) {
                result.add(td.token.comment);
            }
        }
        for (Annotation.CommentDelta cd: ann.followingComments) {
            result.add(cd.comment);
        }
    }
    return result;
}

/** All recorded tokens except comments. */
public ArrayList<TokenId>
AllTokens()
{
    ArrayList<TokenId> result = new ArrayList<>();
    for (Annotation ann: anns.values()) {
        for (Annotation.TokenDelta td: ann.tokens) {
            if (td.token.type != TokenId.Type.COMMENT) {
                result.add(td.token);
            }
        }
    }
    return result;
}

@Override public String
toString()
{
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<AnnKey, Annotation> e: anns.entrySet()) {
        sb.append(e.getKey());
        sb.append(" -> ");
        sb.append(e.getValue());
        sb.append('\n');
    }
    return sb.toString();
}

private final TreeMap<AnnKey, Annotation> anns = new TreeMap<>();
}
