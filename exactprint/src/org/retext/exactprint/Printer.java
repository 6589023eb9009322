package org.retext.exactprint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Reproduces source text from a tree and its annotations by interpreting the same schedule the
 * relativizer used. Nodes without annotations (created by transformations) are printed with
 * default spacing. A new item following another item of a separated slot gets the slot separator
 * unless the preceding item recorded its own one.
 */
public class Printer {

public interface ErrorCode {
    int UNSUPPORTED_CONSTRUCT = 0;
}

public interface WarnCode {
    int UNPRINTED_TOKEN = 0;
}

public
Printer(Schedule schedule, AnnotationStore store, Summary summary)
{
    this.schedule = schedule;
    this.store = store;
    this.summary = summary;
}

public
Printer(Schedule schedule, AnnotationStore store)
{
    this(schedule, store, new Summary());
}

public Printer
SetHook(PrintHook hook)
{
    this.hook = hook;
    return this;
}

/** Print the tree. The printer instance can be reused for several calls. */
public String
Print(Ast.Node root)
{
    out = new StringBuilder();
    line = 1;
    col = 0;
    layoutStart = 0;
    markLayout = false;
    pendingLayout = null;
    fresh = true;
    cur = null;
    try {
        PrintNode(root.Key(), root, schedule.Instructions(root), false, true);
    } catch (UnsupportedConstructException e) {
        summary.Error(e.span.IsGood() ? e.span.start : null, ErrorCode.UNSUPPORTED_CONSTRUCT,
                      e.getMessage());
        throw e;
    }
    return out.toString();
}

// /////////////////////////////////////////////////////////////////////////////////////////////////

private static final DeltaPos DEFAULT_GAP = new DeltaPos(0, 1);
private static final DeltaPos DEFAULT_NEWLINE = new DeltaPos(1, 0);

private static class Frame {
    final Ast.Node node;
    final Annotation ann;
    /** Tokens not yet printed. */
    final ArrayList<Annotation.TokenDelta> tokens = new ArrayList<>();

    Frame(Ast.Node node, Annotation ann)
    {
        this.node = node;
        this.ann = ann;
        if (ann != null) {
            tokens.addAll(ann.tokens);
        }
    }
}

private final Schedule schedule;
private final AnnotationStore store;
private final Summary summary;
private PrintHook hook;

private StringBuilder out;
/** Output cursor, hook decorations excluded. */
private int line, col;
private int layoutStart;
/** Layout region entered without a recorded baseline, the next element establishes it. */
private boolean markLayout;
/** Recorded baseline offset of the layout region entered, applied by its first element. */
private DeltaPos pendingLayout;
/** Nothing printed yet since the last default gap, so no further gap is needed. */
private boolean fresh;
private Frame cur;

/**
 * @param layoutItem The node is an item of a layout sensitive list.
 * @param hooked Apply print hook to the node output.
 */
private void
PrintNode(AnnKey key, Ast.Node node, List<Schedule.Instruction> instructions,
          boolean layoutItem, boolean hooked)
{
    int chunkStart = out.length();
    Annotation ann = store.Get(key);
    if (ann != null) {
        ApplyLayout();
        for (Annotation.CommentDelta cd: ann.priorComments) {
            PrintComment(cd);
        }
        EmitDelta(ann.entryDelta);
    } else if (pendingLayout != null) {
        /* New first element of a layout region. Blank lines preceding the original one are not
         * carried over.
         */
        DeltaPos dp = pendingLayout;
        ApplyLayout();
        EmitDelta(dp.lines > 0 ? DEFAULT_NEWLINE : dp);
        fresh = true;
    } else {
        if (layoutItem && !markLayout) {
            EmitDelta(DEFAULT_NEWLINE);
            fresh = true;
        } else {
            EmitDefaultGap();
        }
    }
    SetBaseline();

    Frame parent = cur;
    cur = new Frame(node, ann);
    Run(instructions, false);
    for (Keyword kw: schedule.GetTrailing()) {
        PrintRun(kw);
    }
    for (Annotation.TokenDelta td: cur.tokens) {
        if (td.token.type == TokenId.Type.COMMENT) {
            EmitDelta(td.delta);
            Emit(td.token.comment.contents);
        } else {
            summary.Warning(WarnCode.UNPRINTED_TOKEN, "Token %s of %s has no place in the schedule",
                            td.token, key);
        }
    }
    if (ann != null) {
        for (Annotation.CommentDelta cd: ann.followingComments) {
            PrintComment(cd);
        }
    }
    cur = parent;

    if (hooked && hook != null) {
        String text = out.substring(chunkStart);
        out.setLength(chunkStart);
        out.append(hook.Wrap(node, text));
    }
}

private void
VisitNode(Ast.Node node, boolean layoutItem)
{
    PrintNode(node.Key(), node, schedule.Instructions(node), layoutItem, true);
}

private void
Run(List<Schedule.Instruction> instructions, boolean layoutBody)
{
    for (Schedule.Instruction instr: instructions) {
        Interpret(instr, layoutBody);
    }
}

private void
Interpret(Schedule.Instruction instr, boolean layoutBody)
{
    switch (instr.type) {
    case MARK:
        PrintMark((Schedule.KeywordInstruction)instr);
        break;
    case MARK_OPTIONAL:
    case MARK_OFFSET:
        PrintToken(((Schedule.KeywordInstruction)instr).keyword);
        break;
    case MARK_MANY:
    case MARK_INSIDE:
    case MARK_OUTSIDE:
        PrintRun(((Schedule.KeywordInstruction)instr).keyword);
        break;
    case VALUE:
        if (cur.ann == null) {
            EmitDefaultGap();
            SetBaseline();
            Emit(cur.node.value);
        } else {
            PrintToken(Keyword.VALUE);
        }
        break;
    case CHILD: {
        Ast.Node child = cur.node.Child(((Schedule.SlotInstruction)instr).slots[0]);
        if (child != null) {
            VisitNode(child, false);
        }
        break;
    }
    case CHILDREN: {
        Schedule.SlotInstruction si = (Schedule.SlotInstruction)instr;
        Ast.Node prev = null;
        for (String slot: si.slots) {
            for (Ast.Node child: cur.node.Slot(slot)) {
                if (prev != null && si.separator != null && store.Get(child) == null &&
                    !HasToken(prev, si.separator)) {

                    Emit(si.separator.text);
                }
                VisitNode(child, layoutBody);
                prev = child;
            }
        }
        break;
    }
    case SORTED:
        for (Ast.Node child: SortedChildren((Schedule.SlotInstruction)instr)) {
            VisitNode(child, layoutBody);
        }
        break;
    case GROUP:
        PrintGroup((Schedule.BlockInstruction)instr);
        break;
    case LAYOUT: {
        int oldStart = layoutStart;
        pendingLayout = TakeLayoutToken();
        markLayout = pendingLayout == null;
        Run(Arrays.asList(((Schedule.BlockInstruction)instr).body), true);
        markLayout = false;
        pendingLayout = null;
        layoutStart = oldStart;
        break;
    }
    case WHEN_COUNT: {
        Schedule.BlockInstruction bi = (Schedule.BlockInstruction)instr;
        if (CountTokens(bi.keyword) >= bi.minCount) {
            Run(Arrays.asList(bi.body), layoutBody);
        }
        break;
    }
    case TO_COMMENTS:
        /* Converted keywords are recorded as comments. */
        break;
    case EOF:
        PrintToken(Keyword.EOF);
        break;
    default:
        throw new IllegalStateException("Unhandled instruction type: " + instr.type);
    }
}

/** Mandatory keyword, printed even if the node has no annotation. */
private void
PrintMark(Schedule.KeywordInstruction instr)
{
    if (cur.ann != null) {
        PrintToken(instr.keyword);
        return;
    }
    EmitDefaultGap();
    SetBaseline();
    Emit(instr.text != null ? instr.text : instr.keyword.text);
}

/** Print the next recorded token if it is the specified keyword, together with the comments
 * recorded before it.
 *
 * @return True if the token was printed.
 */
private boolean
PrintToken(Keyword kw)
{
    int idx = 0;
    while (idx < cur.tokens.size() && cur.tokens.get(idx).token.type == TokenId.Type.COMMENT) {
        idx++;
    }
    if (idx == cur.tokens.size() || !cur.tokens.get(idx).token.Matches(kw)) {
        return false;
    }
    ApplyLayout();
    for (int i = 0; i < idx; i++) {
        Annotation.TokenDelta td = cur.tokens.get(i);
        EmitDelta(td.delta);
        Emit(td.token.comment.contents);
    }
    Annotation.TokenDelta td = cur.tokens.get(idx);
    cur.tokens.subList(0, idx + 1).clear();
    EmitDelta(td.delta);
    SetBaseline();
    if (kw.equals(Keyword.VALUE)) {
        Emit(cur.node.value);
    } else {
        Emit(td.token.GetText());
    }
    return true;
}

private void
PrintRun(Keyword kw)
{
    boolean printed;
    do {
        printed = PrintToken(kw);
    } while (printed);
}

/** Recorded baseline offset of the layout region starting at the current token position. */
private DeltaPos
TakeLayoutToken()
{
    if (cur.ann == null) {
        return null;
    }
    for (int i = 0; i < cur.tokens.size(); i++) {
        Annotation.TokenDelta td = cur.tokens.get(i);
        if (td.token.type == TokenId.Type.COMMENT) {
            continue;
        }
        if (!td.token.Matches(Keyword.LAYOUT)) {
            return null;
        }
        cur.tokens.remove(i);
        return td.delta;
    }
    return null;
}

/** Whether the node has a recorded token of the specified keyword. */
private boolean
HasToken(Ast.Node node, Keyword kw)
{
    Annotation ann = store.Get(node);
    if (ann == null) {
        return false;
    }
    for (Annotation.TokenDelta td: ann.tokens) {
        if (td.token.Matches(kw)) {
            return true;
        }
    }
    return false;
}

private int
CountTokens(Keyword kw)
{
    int n = 0;
    for (Annotation.TokenDelta td: cur.tokens) {
        if (td.token.Matches(kw)) {
            n++;
        }
    }
    return n;
}

/** Children in their original source order, children unknown to the source order follow. */
private List<Ast.Node>
SortedChildren(Schedule.SlotInstruction instr)
{
    ArrayList<Ast.Node> remaining = new ArrayList<>();
    for (String slot: instr.slots) {
        remaining.addAll(cur.node.Slot(slot));
    }
    if (cur.ann == null || cur.ann.sortKey == null) {
        return remaining;
    }
    ArrayList<Ast.Node> result = new ArrayList<>();
    for (Span span: cur.ann.sortKey) {
        for (int i = 0; i < remaining.size(); i++) {
            if (remaining.get(i).span.equals(span)) {
                result.add(remaining.remove(i));
                break;
            }
        }
    }
    result.addAll(remaining);
    return result;
}

private void
PrintGroup(Schedule.BlockInstruction instr)
{
    AnnKey key = null;
    if (cur.ann != null && cur.ann.capturedSpan != null &&
        cur.ann.capturedSpan.shape.equals(instr.shape)) {

        key = cur.ann.capturedSpan;
    }
    if (key == null) {
        key = new AnnKey(Span.NONE, instr.shape);
    }
    PrintNode(key, cur.node, Arrays.asList(instr.body), false, false);
}

private void
PrintComment(Annotation.CommentDelta cd)
{
    EmitDelta(cd.delta);
    Emit(cd.comment.contents);
}

/** Establish the baseline of the layout region entered from its recorded offset. The offset is
 * relative to the enclosing baseline if it starts a new line, to the current column otherwise.
 */
private void
ApplyLayout()
{
    if (pendingLayout == null) {
        return;
    }
    if (pendingLayout.lines > 0) {
        layoutStart += pendingLayout.cols;
    } else {
        layoutStart = col + pendingLayout.cols;
    }
    pendingLayout = null;
}

private void
SetBaseline()
{
    if (markLayout) {
        markLayout = false;
        layoutStart = col;
    }
}

private void
EmitDefaultGap()
{
    if (!fresh) {
        EmitDelta(DEFAULT_GAP);
        fresh = true;
    }
}

private void
EmitDelta(DeltaPos dp)
{
    if (dp.lines > 0) {
        for (int i = 0; i < dp.lines; i++) {
            out.append('\n');
        }
        line += dp.lines;
        col = 0;
        AppendSpaces(layoutStart + dp.cols);
    } else {
        AppendSpaces(dp.cols);
    }
}

private void
AppendSpaces(int n)
{
    for (int i = 0; i < n; i++) {
        out.append(' ');
    }
    if (n > 0) {
        col += n;
    }
}

private void
Emit(String text)
{
    if (text == null || text.isEmpty()) {
        return;
    }
    out.append(text);
    Position p = new Position(line, col).Advance(text);
    line = p.line;
    col = p.col;
    fresh = false;
}
}
