package org.retext.exactprint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/** Converts absolute position facts and comments into relative annotations by walking the tree
 * according to the annotation schedule. Each instance performs one run and owns all its state.
 *
 * Only deltas between elements are recorded, so whitespace which is not followed by an element
 * (trailing spaces, carriage returns, whitespace-only lines) is lost unless the caller reports it
 * as comments.
 */
public class Relativizer {

public interface ErrorCode {
    int UNSUPPORTED_CONSTRUCT = 0;
}

public interface WarnCode {
    int AMBIGUOUS_FACT = 0,
        TRAILING_EOF_FACT = 1,
        RESIDUAL_FACT = 2,
        RESIDUAL_COMMENT = 3;
}

public
Relativizer(Schedule schedule, RawFacts facts, Collection<Comment> comments, Summary summary)
{
    this.schedule = schedule;
    this.facts = facts;
    this.comments = new ArrayList<>(comments);
    Collections.sort(this.comments);
    this.summary = summary;
}

public
Relativizer(Schedule schedule, RawFacts facts, Collection<Comment> comments)
{
    this(schedule, facts, comments, new Summary());
}

/** Add comments which were not produced by the parser, e.g. source lines removed by a
 * preprocessor which should still be printed.
 */
public Relativizer
InjectComments(Collection<Comment> injected)
{
    for (Comment c: injected) {
        InsertComment(c);
    }
    return this;
}

/** Produce annotations for the tree.
 *
 * @param root Tree root.
 * @param start Position the tree text starts at.
 * @return Annotations for all nodes of the tree.
 * @throws UnsupportedConstructException if the tree contains a node which can not be annotated.
 */
public AnnotationStore
Relativize(Ast.Node root, Position start)
{
    if (store != null) {
        throw new IllegalStateException("Relativizer instance already used");
    }
    store = new AnnotationStore();
    priorEnd = start;
    rootKey = root.Key();
    try {
        VisitNode(root);
    } catch (UnsupportedConstructException e) {
        summary.Error(e.span.IsGood() ? e.span.start : null, ErrorCode.UNSUPPORTED_CONSTRUCT,
                      e.getMessage());
        throw e;
    }
    if (!eofSeen) {
        ConvertResidue();
        Annotation rootAnn = store.Get(rootKey);
        if (rootAnn != null) {
            FlushComments(rootAnn.followingComments);
        } else if (!comments.isEmpty()) {
            throw new IllegalStateException("Root node has no location for residual comments");
        }
    }
    return store;
}

public Summary
GetSummary()
{
    return summary;
}

/** Number of virtual tokens dropped because they were located behind the current position. */
public int
GetSkippedCount()
{
    return numSkipped;
}

// /////////////////////////////////////////////////////////////////////////////////////////////////

/** Annotation being built for the node currently visited. */
private static class Frame {
    final AnnKey key;
    /** Node owning slots and value. Synthesized group frames refer to their parent node. */
    final Ast.Node node;
    final ArrayList<Annotation.TokenDelta> tokens = new ArrayList<>();
    final ArrayList<Annotation.CommentDelta> following = new ArrayList<>();
    ArrayList<Span> sortKey;
    AnnKey captured;

    Frame(AnnKey key, Ast.Node node)
    {
        this.key = key;
        this.node = node;
    }
}

private final Schedule schedule;
private final RawFacts facts;
/** Comments not yet allocated, in position order. */
private final ArrayList<Comment> comments;
private final Summary summary;
private AnnotationStore store;
private AnnKey rootKey;
/** Position reached when processing the last element. */
private Position priorEnd;
/** Set when entering a layout region, the next element establishes its baseline. */
private boolean markLayout = false;
private int layoutStart = 0;
private Frame cur;
private boolean eofSeen = false;
private int numSkipped = 0;

private void
VisitNode(Ast.Node node)
{
    WithAst(node.Key(), node, schedule.Instructions(node));
}

/** Enter an element, run its instructions and store the resulting annotation. */
private void
WithAst(AnnKey key, Ast.Node node, List<Schedule.Instruction> instructions)
{
    Span ss = key.span;
    ArrayList<Annotation.CommentDelta> prior = new ArrayList<>();
    DeltaPos edp = DeltaPos.ZERO;
    if (ss.IsGood()) {
        MarkLayoutStart(ss.start);
        if (priorEnd.IsBefore(ss.start)) {
            prior = AllocateComments(ss.start);
        }
        edp = AdjustDelta(priorEnd.DeltaTo(ss.start));
        priorEnd = Position.Max(priorEnd, ss.start);
    }

    Frame parent = cur;
    cur = new Frame(key, node);
    Run(instructions);
    MarkTrailing();
    Frame frame = cur;
    cur = parent;

    if (ss.IsGood()) {
        Annotation ann = new Annotation(edp);
        ann.priorComments.addAll(prior);
        ann.followingComments.addAll(frame.following);
        ann.tokens.addAll(frame.tokens);
        ann.sortKey = frame.sortKey;
        ann.capturedSpan = frame.captured;
        store.Put(key, ann);
        priorEnd = Position.Max(priorEnd, ss.end);
    } else if (parent != null) {
        /* No key to store the annotation under, keep at least its comments. */
        for (Annotation.TokenDelta td: frame.tokens) {
            if (td.token.type == TokenId.Type.COMMENT) {
                parent.tokens.add(td);
            }
        }
        parent.following.addAll(frame.following);
    }
}

private void
Run(List<Schedule.Instruction> instructions)
{
    for (Schedule.Instruction instr: instructions) {
        Interpret(instr);
    }
}

private void
Run(Schedule.Instruction[] instructions)
{
    for (Schedule.Instruction instr: instructions) {
        Interpret(instr);
    }
}

private void
Interpret(Schedule.Instruction instr)
{
    switch (instr.type) {
    case MARK:
    case MARK_OPTIONAL:
        MarkOne((Schedule.KeywordInstruction)instr);
        break;
    case MARK_OFFSET:
        MarkOffset((Schedule.KeywordInstruction)instr);
        break;
    case MARK_MANY:
    case MARK_INSIDE:
    case MARK_OUTSIDE:
        MarkAll((Schedule.KeywordInstruction)instr);
        break;
    case VALUE:
        MarkValue();
        break;
    case CHILD: {
        Ast.Node child = cur.node.Child(((Schedule.SlotInstruction)instr).slots[0]);
        if (child != null) {
            VisitNode(child);
        }
        break;
    }
    case CHILDREN:
        for (String slot: ((Schedule.SlotInstruction)instr).slots) {
            for (Ast.Node child: cur.node.Slot(slot)) {
                VisitNode(child);
            }
        }
        break;
    case SORTED:
        MarkSorted((Schedule.SlotInstruction)instr);
        break;
    case GROUP:
        MarkGroup((Schedule.BlockInstruction)instr);
        break;
    case LAYOUT:
        WithLayout(((Schedule.BlockInstruction)instr).body);
        break;
    case WHEN_COUNT: {
        Schedule.BlockInstruction bi = (Schedule.BlockInstruction)instr;
        if (facts.Available(cur.key.span, bi.keyword).size() >= bi.minCount) {
            Run(bi.body);
        }
        break;
    }
    case TO_COMMENTS:
        ToComments((Schedule.CommentsInstruction)instr);
        break;
    case EOF:
        MarkEof();
        break;
    default:
        throw new IllegalStateException("Unhandled instruction type: " + instr.type);
    }
}

private void
WithLayout(Schedule.Instruction[] body)
{
    int oldStart = layoutStart;
    markLayout = true;
    Run(body);
    markLayout = false;
    layoutStart = oldStart;
}

/** The first element of a layout region establishes its baseline. Its offset is recorded as a
 * token of the node owning the region, so the region keeps its indentation when that element is
 * removed or replaced. Deltas of the element itself and of comments preceding it are relative
 * to the new baseline.
 */
private void
MarkLayoutStart(Position start)
{
    if (!markLayout) {
        return;
    }
    markLayout = false;
    DeltaPos dp = AdjustDelta(priorEnd.DeltaTo(start));
    if (cur != null) {
        cur.tokens.add(new Annotation.TokenDelta(TokenId.Keyword(Keyword.LAYOUT), dp));
    }
    layoutStart = start.col;
}

/** Make the column of a delta which starts a new line relative to the layout baseline. */
private DeltaPos
AdjustDelta(DeltaPos dp)
{
    dp = dp.Saturate();
    if (dp.lines == 0) {
        return dp;
    }
    return new DeltaPos(dp.lines, dp.cols - layoutStart);
}

private void
MarkOne(Schedule.KeywordInstruction instr)
{
    ArrayList<RawFacts.Fact> candidates = facts.Available(cur.key.span, instr.keyword);
    if (candidates.isEmpty()) {
        /* Optional element absent in this source. */
        return;
    }
    /* Later candidates are claimed by the following marks of the same keyword. */
    RawFacts.Fact fact = candidates.get(0);
    int numConflicts = 0;
    for (RawFacts.Fact f: candidates) {
        if (f.span.equals(fact.span)) {
            f.consumed = true;
        } else if (f.span.start.equals(fact.span.start)) {
            numConflicts++;
        }
    }
    if (numConflicts > 0) {
        summary.Warning(fact.span.start, WarnCode.AMBIGUOUS_FACT,
                        "Ambiguous `%s` for %s, %d other candidates at the same position, " +
                        "taking the first one", instr.keyword, cur.key, numConflicts);
    }
    AddToken(MakeToken(instr), fact.span);
}

private void
MarkOffset(Schedule.KeywordInstruction instr)
{
    ArrayList<RawFacts.Fact> inside = new ArrayList<>();
    for (RawFacts.Fact f: facts.Get(cur.key.span, instr.keyword)) {
        if (f.span.IsSubspanOf(cur.key.span)) {
            inside.add(f);
        }
    }
    if (instr.offset >= inside.size()) {
        return;
    }
    RawFacts.Fact fact = inside.get(instr.offset);
    if (fact.consumed || fact.span.IsPoint()) {
        return;
    }
    fact.consumed = true;
    AddToken(MakeToken(instr), fact.span);
}

private void
MarkAll(Schedule.KeywordInstruction instr)
{
    for (RawFacts.Fact f: facts.Available(cur.key.span, instr.keyword)) {
        boolean inside = f.span.IsSubspanOf(cur.key.span);
        if ((instr.type == Schedule.Type.MARK_INSIDE && !inside) ||
            (instr.type == Schedule.Type.MARK_OUTSIDE && inside)) {
            continue;
        }
        f.consumed = true;
        AddToken(MakeToken(instr), f.span);
    }
}

/** Trailing separators are attached to each node and located just after it. */
private void
MarkTrailing()
{
    for (Keyword kw: schedule.GetTrailing()) {
        for (RawFacts.Fact f: facts.Available(cur.key.span, kw)) {
            if (f.span.IsSubspanOf(cur.key.span)) {
                continue;
            }
            f.consumed = true;
            AddToken(TokenId.Keyword(kw), f.span);
        }
    }
}

private void
MarkValue()
{
    if (cur.node == null || !cur.node.span.IsGood()) {
        return;
    }
    AddToken(TokenId.Keyword(Keyword.VALUE), cur.node.span);
}

private TokenId
MakeToken(Schedule.KeywordInstruction instr)
{
    if (instr.separator) {
        return TokenId.Separator(instr.keyword);
    }
    if (instr.text != null) {
        return TokenId.String(instr.keyword, instr.text);
    }
    return TokenId.Keyword(instr.keyword);
}

/** Record a token at the specified span and advance the current position past it. */
private void
AddToken(TokenId token, Span span)
{
    /* Zero-width spans are virtual tokens injected by a layout-sensitive lexer. */
    if (span.IsPoint()) {
        return;
    }
    if (!priorEnd.DeltaTo(span.start).IsGood() && token.keyword.Is(Keyword.Flag.VIRTUAL)) {
        summary.Verbose(span.start, "Virtual `%s` behind current position %s skipped",
                        token.keyword, priorEnd);
        numSkipped++;
        return;
    }
    MarkLayoutStart(span.start);
    for (Annotation.CommentDelta cd: AllocateComments(span.start)) {
        cur.tokens.add(new Annotation.TokenDelta(TokenId.Comment(cd.comment), cd.delta));
    }
    DeltaPos dp = AdjustDelta(priorEnd.DeltaTo(span.start));
    cur.tokens.add(new Annotation.TokenDelta(CheckUnicode(token, span), dp));
    priorEnd = Position.Max(priorEnd, span.end);
}

/** Detect keyword spelled with its Unicode glyph. */
private TokenId
CheckUnicode(TokenId token, Span span)
{
    if (token.type != TokenId.Type.KEYWORD || token.keyword.GetUnicode() == null) {
        return token;
    }
    if (span.Length() != token.keyword.text.length()) {
        return TokenId.Unicode(token.keyword);
    }
    return token;
}

private void
MarkSorted(Schedule.SlotInstruction instr)
{
    ArrayList<Ast.Node> nodes = new ArrayList<>();
    for (String slot: instr.slots) {
        nodes.addAll(cur.node.Slot(slot));
    }
    nodes.sort(Comparator.comparing(n -> n.span));
    ArrayList<Span> sortKey = new ArrayList<>();
    for (Ast.Node n: nodes) {
        sortKey.add(n.span);
    }
    cur.sortKey = sortKey;
    for (Ast.Node n: nodes) {
        VisitNode(n);
    }
}

private void
MarkGroup(Schedule.BlockInstruction instr)
{
    ArrayList<String> slots = new ArrayList<>();
    CollectSlots(instr.body, slots);
    Span span = Span.NONE;
    for (String slot: slots) {
        for (Ast.Node n: cur.node.Slot(slot)) {
            span = span.Union(n.span);
        }
    }
    if (!span.IsGood()) {
        return;
    }
    AnnKey key = new AnnKey(span, instr.shape);
    cur.captured = key;
    WithAst(key, cur.node, Arrays.asList(instr.body));
}

private static void
CollectSlots(Schedule.Instruction[] body, ArrayList<String> slots)
{
    for (Schedule.Instruction instr: body) {
        if (instr instanceof Schedule.SlotInstruction) {
            Collections.addAll(slots, ((Schedule.SlotInstruction)instr).slots);
        } else if (instr instanceof Schedule.BlockInstruction) {
            CollectSlots(((Schedule.BlockInstruction)instr).body, slots);
        }
    }
}

/** Keywords which can not be placed by the schedule are interleaved into the output as
 * comments.
 */
private void
ToComments(Schedule.CommentsInstruction instr)
{
    for (Keyword kw: instr.keywords) {
        for (RawFacts.Fact f: facts.Available(cur.key.span, kw)) {
            f.consumed = true;
            InsertComment(new Comment(kw.text, f.span, kw));
        }
    }
}

private void
MarkEof()
{
    ArrayList<RawFacts.Fact> eofs = new ArrayList<>();
    for (RawFacts.Fact f: facts.Get(Span.NONE, Keyword.EOF)) {
        if (!f.consumed) {
            f.consumed = true;
            eofs.add(f);
        }
    }
    if (eofs.isEmpty()) {
        return;
    }
    eofSeen = true;
    RawFacts.Fact eof = eofs.get(0);
    for (int i = 1; i < eofs.size(); i++) {
        summary.Warning(eofs.get(i).span.start, WarnCode.TRAILING_EOF_FACT,
                        "Trailing end of input marker after %s", eof.span.start);
    }
    ConvertResidue();
    for (Annotation.CommentDelta cd: AllocateComments(eof.span.start)) {
        cur.tokens.add(new Annotation.TokenDelta(TokenId.Comment(cd.comment), cd.delta));
    }
    DeltaPos dp = AdjustDelta(priorEnd.DeltaTo(eof.span.start));
    cur.tokens.add(new Annotation.TokenDelta(TokenId.Keyword(Keyword.EOF), dp));
    priorEnd = Position.Max(priorEnd, eof.span.end);
    FlushComments(cur.following);
}

/** Turn facts nobody claimed into comments so that no source content is lost. */
private void
ConvertResidue()
{
    for (RawFacts.Fact f: facts.Residue()) {
        summary.Warning(f.span.start, WarnCode.RESIDUAL_FACT,
                        "Unclaimed `%s` of node %s kept as a comment", f.keyword, f.nodeSpan);
        f.consumed = true;
        InsertComment(new Comment(f.keyword.text, f.span, f.keyword));
    }
}

/** Attach all remaining comments after the current position. */
private void
FlushComments(ArrayList<Annotation.CommentDelta> target)
{
    for (Comment c: comments) {
        summary.Warning(c.span.start, WarnCode.RESIDUAL_COMMENT,
                        "Comment after end of input: %s", c.contents);
        target.add(new Annotation.CommentDelta(c, AdjustDelta(priorEnd.DeltaTo(c.span.start))));
        priorEnd = Position.Max(priorEnd, c.span.end);
    }
    comments.clear();
}

/** Take all comments starting before the specified position, with deltas relative to the
 * running position.
 */
private ArrayList<Annotation.CommentDelta>
AllocateComments(Position before)
{
    ArrayList<Annotation.CommentDelta> result = new ArrayList<>();
    while (!comments.isEmpty() && comments.get(0).span.start.IsBefore(before)) {
        Comment c = comments.remove(0);
        result.add(new Annotation.CommentDelta(c, AdjustDelta(priorEnd.DeltaTo(c.span.start))));
        priorEnd = Position.Max(priorEnd, c.span.end);
    }
    return result;
}

private void
InsertComment(Comment c)
{
    int pos = Collections.binarySearch(comments, c);
    if (pos >= 0) {
        /* Already known. */
        return;
    }
    comments.add(-pos - 1, c);
}
}
