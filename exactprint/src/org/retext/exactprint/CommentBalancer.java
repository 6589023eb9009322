package org.retext.exactprint;

import java.util.ArrayList;
import java.util.List;

/** Moves comments which trail a construct on its last line from the prior comments of the next
 * node to the following comments of the construct they trail. Printed output does not change.
 */
public class CommentBalancer {

public
CommentBalancer(AnnotationStore store, Summary summary)
{
    this.store = store;
    this.summary = summary;
}

public
CommentBalancer(AnnotationStore store)
{
    this(store, new Summary());
}

/** Rebalance comments of all nodes in the tree.
 *
 * @return Number of comment runs moved.
 */
public int
Balance(Ast.Node root)
{
    ArrayList<Ast.Node> nodes = new ArrayList<>();
    Ast.VisitPostOrder(root, n -> {
        if (n.span.IsGood()) {
            nodes.add(n);
        }
    });
    int numMoved = 0;
    for (Ast.Node node: nodes) {
        if (BalanceNode(node, nodes)) {
            numMoved++;
        }
    }
    return numMoved;
}

// /////////////////////////////////////////////////////////////////////////////////////////////////

private final AnnotationStore store;
private final Summary summary;

private boolean
BalanceNode(Ast.Node node, List<Ast.Node> nodes)
{
    Annotation ann = store.Get(node);
    if (ann == null || ann.priorComments.isEmpty()) {
        return false;
    }
    int runLength = 0;
    for (Annotation.CommentDelta cd: ann.priorComments) {
        if (cd.delta.lines != 0 || cd.comment.origin != null) {
            break;
        }
        runLength++;
    }
    if (runLength == 0) {
        return false;
    }
    Annotation.CommentDelta first = ann.priorComments.get(0);
    Comment c = first.comment;

    Ast.Node target = FindPreceding(c.span, nodes);
    if (target == null || target.span.end.line != c.span.start.line) {
        return false;
    }
    /* Output cursor before the comment must be exactly at the end of the target. */
    Position cursor = new Position(c.span.start.line, c.span.start.col - first.delta.cols);
    if (!cursor.equals(target.span.end)) {
        return false;
    }
    Ast.Node enclosing = FindEnclosing(c.span, nodes);
    if (enclosing != null && !target.span.IsSubspanOf(enclosing.span)) {
        return false;
    }
    Annotation targetAnn = store.Get(target);
    if (targetAnn == null || EndsWithSeparator(targetAnn)) {
        return false;
    }

    List<Annotation.CommentDelta> run = ann.priorComments.subList(0, runLength);
    targetAnn.followingComments.addAll(run);
    run.clear();
    summary.Verbose(c.span.start, "%d comment(s) moved from %s to %s", runLength, node, target);
    return true;
}

/** Node ending closest before the position, the innermost one among those ending at the same
 * position.
 */
private static Ast.Node
FindPreceding(Span span, List<Ast.Node> nodes)
{
    Ast.Node best = null;
    for (Ast.Node n: nodes) {
        if (span.start.IsBefore(n.span.end)) {
            continue;
        }
        if (best == null || best.span.end.IsBefore(n.span.end)) {
            best = n;
        }
    }
    return best;
}

/** Smallest node enclosing the span. */
private static Ast.Node
FindEnclosing(Span span, List<Ast.Node> nodes)
{
    Ast.Node best = null;
    for (Ast.Node n: nodes) {
        if (span.IsSubspanOf(n.span) && (best == null || n.span.IsSubspanOf(best.span))) {
            best = n;
        }
    }
    return best;
}

private static boolean
EndsWithSeparator(Annotation ann)
{
    if (ann.tokens.isEmpty()) {
        return false;
    }
    TokenId last = ann.tokens.get(ann.tokens.size() - 1).token;
    return last.type == TokenId.Type.SEPARATOR ||
        (last.keyword != null && last.keyword.Is(Keyword.Flag.SEPARATOR));
}
}
