package org.retext.exactprint;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.retext.exactprint.ExactPrintUtil.*;
import static utils.Utils.AssertThrows;

public class RelativizerTest {

Keyword SEMI, COLON, ARROW, OPEN, CLOSE, VCLOSE, INLINE, OPEN_P, CLOSE_P, COMMA;

Schedule schedule = new Schedule() {{
    SEMI = Keyword("SEMI", ";");
    COLON = Keyword("COLON", ":");
    ARROW = Keyword("ARROW", "->").Unicode("→");
    OPEN = Keyword("OPEN", "{");
    CLOSE = Keyword("CLOSE", "}");
    VCLOSE = Keyword("VCLOSE", "}", Keyword.Flag.VIRTUAL);
    INLINE = Keyword("INLINE", "{-# INLINE #-}");
    OPEN_P = Keyword("OPEN_P", "(");
    CLOSE_P = Keyword("CLOSE_P", ")");
    COMMA = Keyword("COMMA", ",", Keyword.Flag.SEPARATOR);

    Shape("Var").Sequence(Value());
    Shape("Semi").Sequence(Mark(SEMI));
    Shape("Offsets").Sequence(MarkOffset(SEMI, 0), Mark(COLON), MarkOffset(SEMI, 1));
    Shape("Arrow").Sequence(Mark(ARROW));
    Shape("Block").Sequence(Mark(OPEN), Child("body"), Mark(VCLOSE));
    Shape("StrictBlock").Sequence(Mark(OPEN), Child("body"), Mark(CLOSE));
    Shape("Counted").Sequence(Child("name"), WhenCount(SEMI, 2, MarkMany(SEMI)));
    Shape("Pragma").Sequence(ToComments(INLINE), Child("name"));
    Shape("File").Sequence(Child("body"), Eof());
    Shape("Seps").Sequence(Child("body"), MarkInside(SEMI), MarkOutside(SEMI, true));
    Shape("Decl").Sequence(MarkOptional(SEMI), MarkWithString(COLON, "::"), Child("body"));
    Shape("Triple").Sequence(Mark(OPEN_P), Child("a"), Mark(COMMA), Child("b"), Mark(COMMA),
                             Child("c"), Mark(CLOSE_P));
    Shape("Macro").Unsupported("Macro calls are not supported");
}};

Ast ast = new Ast();
RawFacts facts = new RawFacts();
Summary summary = new Summary();

AnnotationStore
Relativize(Ast.Node root, Comment... comments)
{
    Relativizer relativizer = new Relativizer(schedule, facts, Arrays.asList(comments), summary);
    return Relativize(relativizer, root);
}

AnnotationStore
Relativize(Relativizer relativizer, Ast.Node root)
{
    AnnotationStore store = relativizer.Relativize(root, ExactPrint.INPUT_START);
    System.out.println(summary);
    System.out.println(store);
    return store;
}

String
Print(Ast.Node root, AnnotationStore store)
{
    return new Printer(schedule, store).Print(root);
}

Ast.Node
Var(String name, Span span)
{
    return ast.CreateNode("Var", span, name);
}

static Annotation.TokenDelta
Token(TokenId token, int lines, int cols)
{
    return new Annotation.TokenDelta(token, new DeltaPos(lines, cols));
}

static void
VerifyTokens(Annotation ann, Annotation.TokenDelta... expected)
{
    assertEquals(expected.length, ann.tokens.size());
    for (int i = 0; i < expected.length; i++) {
        assertEquals("Token #" + i, expected[i].token, ann.tokens.get(i).token);
        assertEquals("Token #" + i + " delta", expected[i].delta, ann.tokens.get(i).delta);
    }
}

@Test public void
AmbiguousFact()
{
    Ast.Node root = ast.CreateNode("Semi", new Span(1, 0, 1, 3));
    facts.Add(root.span, SEMI, new Span(1, 1, 1, 3)).Add(root.span, SEMI, new Span(1, 1, 1, 2));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary,
                  new Warning(Relativizer.WarnCode.AMBIGUOUS_FACT, 1, 1),
                  new Warning(Relativizer.WarnCode.RESIDUAL_FACT, 1, 1),
                  new Warning(Relativizer.WarnCode.RESIDUAL_COMMENT, 1, 1));
    Annotation ann = store.Get(root);
    VerifyTokens(ann, Token(TokenId.Keyword(SEMI), 0, 1));
    assertEquals(1, ann.followingComments.size());
    assertEquals(new Span(1, 1, 1, 3), ann.followingComments.get(0).comment.span);
    assertEquals(" ;;", Print(root, store));
}

@Test public void
SurplusFact()
{
    Ast.Node root = ast.CreateNode("Semi", new Span(1, 0, 1, 5));
    facts.Add(root.span, SEMI, new Span(1, 1, 1, 2)).Add(root.span, SEMI, new Span(1, 3, 1, 4));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary,
                  new Warning(Relativizer.WarnCode.RESIDUAL_FACT, 1, 3),
                  new Warning(Relativizer.WarnCode.RESIDUAL_COMMENT, 1, 3));
    Annotation ann = store.Get(root);
    VerifyTokens(ann, Token(TokenId.Keyword(SEMI), 0, 1));
    assertEquals(1, ann.followingComments.size());
    assertEquals(SEMI, ann.followingComments.get(0).comment.origin);
    /* Residual fact lies behind the node end. */
    assertEquals(DeltaPos.ZERO, ann.followingComments.get(0).delta);
    assertEquals(" ;;", Print(root, store));
}

@Test public void
RepeatedKeywordsTakenInOrder()
{
    Ast.Node root = ast.CreateNode("Triple", new Span(1, 0, 1, 9));
    root.AppendChild("a", Var("a", new Span(1, 1, 1, 2)))
        .AppendChild("b", Var("b", new Span(1, 4, 1, 5)))
        .AppendChild("c", Var("c", new Span(1, 7, 1, 8)));
    facts.Add(root.span, OPEN_P, new Span(1, 0, 1, 1))
        .Add(root.span, COMMA, new Span(1, 5, 1, 6))
        .Add(root.span, COMMA, new Span(1, 2, 1, 3))
        .Add(root.span, CLOSE_P, new Span(1, 8, 1, 9));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    assertEquals(4, facts.ConsumedCount());
    VerifyTokens(store.Get(root),
                 Token(TokenId.Keyword(OPEN_P), 0, 0),
                 Token(TokenId.Keyword(COMMA), 0, 0),
                 Token(TokenId.Keyword(COMMA), 0, 0),
                 Token(TokenId.Keyword(CLOSE_P), 0, 0));
    assertEquals(new DeltaPos(0, 1), store.Get(root.Child("c")).entryDelta);
    assertEquals("(a, b, c)", Print(root, store));
}

@Test public void
DuplicatedFactMerged()
{
    Ast.Node root = ast.CreateNode("Semi", new Span(1, 0, 1, 2));
    facts.Add(root.span, SEMI, new Span(1, 1, 1, 2)).Add(root.span, SEMI, new Span(1, 1, 1, 2));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root), Token(TokenId.Keyword(SEMI), 0, 1));
    assertEquals(2, facts.ConsumedCount());
    for (RawFacts.Fact f: facts.Get(root.span, SEMI)) {
        assertTrue(f.IsConsumed());
    }
    assertEquals(" ;", Print(root, store));
}

@Test public void
VirtualTokenBehindSkipped()
{
    Ast.Node root = ast.CreateNode("Block", new Span(1, 0, 1, 3));
    root.AppendChild("body", Var("x", new Span(1, 2, 1, 3)));
    facts.Add(root.span, OPEN, new Span(1, 0, 1, 1)).Add(root.span, VCLOSE, new Span(1, 1, 1, 2));
    Relativizer relativizer = new Relativizer(schedule, facts, Collections.emptyList(), summary);
    AnnotationStore store = Relativize(relativizer, root);
    VerifySummary(summary);
    assertEquals(1, relativizer.GetSkippedCount());
    assertEquals(2, facts.ConsumedCount());
    assertEquals(1, summary.Find(Summary.RecordType.VERBOSE, -1).size());
    VerifyTokens(store.Get(root), Token(TokenId.Keyword(OPEN), 0, 0));
    assertEquals("{ x", Print(root, store));
}

@Test public void
NonVirtualTokenBehindKept()
{
    Ast.Node root = ast.CreateNode("StrictBlock", new Span(1, 0, 1, 3));
    root.AppendChild("body", Var("x", new Span(1, 2, 1, 3)));
    facts.Add(root.span, OPEN, new Span(1, 0, 1, 1)).Add(root.span, CLOSE, new Span(1, 1, 1, 2));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root),
                 Token(TokenId.Keyword(OPEN), 0, 0),
                 Token(TokenId.Keyword(CLOSE), 0, 0));
    assertEquals("{ x}", Print(root, store));
}

@Test public void
ZeroWidthFactIgnored()
{
    Ast.Node root = ast.CreateNode("Block", new Span(1, 0, 1, 3));
    root.AppendChild("body", Var("x", new Span(1, 2, 1, 3)));
    facts.Add(root.span, OPEN, new Span(1, 0, 1, 0));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root));
    assertEquals(0, facts.ConsumedCount());
    assertEquals("  x", Print(root, store));
}

@Test public void
UnicodeGlyphDetected()
{
    Ast.Node unicode = ast.CreateNode("Arrow", new Span(1, 0, 1, 1));
    facts.Add(unicode.span, ARROW, new Span(1, 0, 1, 1));
    AnnotationStore store = Relativize(unicode);
    VerifyTokens(store.Get(unicode), Token(TokenId.Unicode(ARROW), 0, 0));
    assertEquals("→", Print(unicode, store));
}

@Test public void
AsciiKeywordNotUnicode()
{
    Ast.Node ascii = ast.CreateNode("Arrow", new Span(1, 0, 1, 2));
    facts.Add(ascii.span, ARROW, new Span(1, 0, 1, 2));
    AnnotationStore store = Relativize(ascii);
    VerifyTokens(store.Get(ascii), Token(TokenId.Keyword(ARROW), 0, 0));
    assertEquals("->", Print(ascii, store));
}

@Test public void
OffsetMarks()
{
    Ast.Node root = ast.CreateNode("Offsets", new Span(1, 0, 1, 5));
    facts.Add(root.span, SEMI, new Span(1, 4, 1, 5))
        .Add(root.span, COLON, new Span(1, 2, 1, 3))
        .Add(root.span, SEMI, new Span(1, 0, 1, 1));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root),
                 Token(TokenId.Keyword(SEMI), 0, 0),
                 Token(TokenId.Keyword(COLON), 0, 1),
                 Token(TokenId.Keyword(SEMI), 0, 1));
    assertEquals("; : ;", Print(root, store));
}

@Test public void
CountedMarksApplied()
{
    Ast.Node root = ast.CreateNode("Counted", new Span(1, 0, 1, 5));
    root.AppendChild("name", Var("x", new Span(1, 0, 1, 1)));
    facts.Add(root.span, SEMI, new Span(1, 2, 1, 3)).Add(root.span, SEMI, new Span(1, 4, 1, 5));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    assertEquals(2, store.Get(root).tokens.size());
    assertEquals("x ; ;", Print(root, store));
}

@Test public void
CountedMarksBelowThreshold()
{
    Ast.Node root = ast.CreateNode("Counted", new Span(1, 0, 1, 3));
    root.AppendChild("name", Var("x", new Span(1, 0, 1, 1)));
    facts.Add(root.span, SEMI, new Span(1, 2, 1, 3));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary,
                  new Warning(Relativizer.WarnCode.RESIDUAL_FACT, 1, 2),
                  new Warning(Relativizer.WarnCode.RESIDUAL_COMMENT, 1, 2));
    VerifyTokens(store.Get(root));
    assertTrue(Print(root, store).contains(";"));
}

@Test public void
InsideAndOutsideMarks()
{
    Ast.Node root = ast.CreateNode("Seps", new Span(1, 0, 1, 3));
    root.AppendChild("body", Var("x", new Span(1, 0, 1, 1)));
    facts.Add(root.span, SEMI, new Span(1, 4, 1, 5)).Add(root.span, SEMI, new Span(1, 2, 1, 3));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root),
                 Token(TokenId.Keyword(SEMI), 0, 1),
                 Token(TokenId.Separator(SEMI), 0, 1));
    assertEquals("x ; ;", Print(root, store));
}

@Test public void
OptionalAndStringMarks()
{
    Ast.Node root = ast.CreateNode("Decl", new Span(1, 0, 1, 6));
    root.AppendChild("body", Var("x", new Span(1, 5, 1, 6)));
    facts.Add(root.span, SEMI, new Span(1, 0, 1, 1)).Add(root.span, COLON, new Span(1, 2, 1, 4));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    VerifyTokens(store.Get(root),
                 Token(TokenId.Keyword(SEMI), 0, 0),
                 Token(TokenId.String(COLON, "::"), 0, 1));
    assertEquals("; :: x", Print(root, store));

    /* New node omits the optional keyword. */
    Ast.Node decl = ast.CreateNode("Decl")
        .AppendChild("body", ast.CreateNode("Var", Span.NONE, "y"));
    assertEquals(":: y", Print(decl, store));
}

@Test public void
KeywordConvertedToComment()
{
    Ast.Node root = ast.CreateNode("Pragma", new Span(1, 0, 1, 16));
    Ast.Node name = Var("x", new Span(1, 15, 1, 16));
    root.AppendChild("name", name);
    facts.Add(root.span, INLINE, new Span(1, 0, 1, 14));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary);
    Annotation ann = store.Get(name);
    assertEquals(1, ann.priorComments.size());
    assertEquals(INLINE, ann.priorComments.get(0).comment.origin);
    assertEquals(new DeltaPos(0, 1), ann.entryDelta);

    /* Converted keywords are never moved by balancing. */
    new CommentBalancer(store, summary).Balance(root);
    assertEquals(1, ann.priorComments.size());
    assertEquals("{-# INLINE #-} x", Print(root, store));
}

@Test public void
UnclaimedFactsAfterEndOfInput()
{
    Ast.Node root = ast.CreateNode("File", new Span(1, 0, 2, 0));
    root.AppendChild("body", Var("x", new Span(1, 0, 1, 1)));
    facts.AddEof(new Position(2, 0)).AddEof(new Position(2, 0))
        .Add(new Span(9, 0, 9, 1), SEMI, new Span(2, 0, 2, 1));
    AnnotationStore store = Relativize(root);
    VerifySummary(summary,
                  new Warning(Relativizer.WarnCode.TRAILING_EOF_FACT, 2, 0),
                  new Warning(Relativizer.WarnCode.RESIDUAL_FACT, 2, 0),
                  new Warning(Relativizer.WarnCode.RESIDUAL_COMMENT, 2, 0));
    assertEquals(0, summary.GetErrorsCount());
    assertEquals("x\n;", Print(root, store));
}

@Test public void
InjectedComments()
{
    Ast.Node root = ast.CreateNode("File", new Span(1, 0, 2, 1));
    root.AppendChild("body", Var("x", new Span(2, 0, 2, 1)));
    facts.AddEof(new Position(2, 1));
    Relativizer relativizer = new Relativizer(schedule, facts, Collections.emptyList(), summary)
        .InjectComments(Collections.singletonList(
            new Comment("#define X", new Span(1, 0, 1, 9))));
    AnnotationStore store = Relativize(relativizer, root);
    VerifySummary(summary);
    assertEquals("#define X\nx", Print(root, store));
}

@Test public void
UnsupportedShape()
{
    Ast.Node root = ast.CreateNode("File", new Span(1, 0, 1, 3));
    root.AppendChild("body", ast.CreateNode("Macro", new Span(1, 0, 1, 3)));
    UnsupportedConstructException e =
        AssertThrows(UnsupportedConstructException.class, () -> Relativize(root));
    assertEquals("Macro", e.shape);
    VerifySummary(summary,
                  new ExactPrintUtil.Error(Relativizer.ErrorCode.UNSUPPORTED_CONSTRUCT, 1, 0));
    assertTrue(summary.records.get(0).message.contains("Macro calls are not supported"));
}

@Test public void
UnknownShape()
{
    Ast.Node root = ast.CreateNode("Unknown", new Span(1, 0, 1, 3));
    UnsupportedConstructException e =
        AssertThrows(UnsupportedConstructException.class, () -> Relativize(root));
    assertEquals("Unknown", e.shape);
    assertEquals(1, summary.GetErrorsCount());
}

@Test public void
UnsupportedShapePrinted()
{
    Ast.Node root = ast.CreateNode("File");
    root.AppendChild("body", ast.CreateNode("Macro"));
    AssertThrows(UnsupportedConstructException.class,
                 () -> new Printer(schedule, new AnnotationStore(), summary).Print(root));
    VerifySummary(summary, new ExactPrintUtil.Error(Printer.ErrorCode.UNSUPPORTED_CONSTRUCT));
}

@Test public void
SingleRunOnly()
{
    Ast.Node root = Var("x", new Span(1, 0, 1, 1));
    Relativizer relativizer = new Relativizer(schedule, facts, Collections.emptyList(), summary);
    Relativize(relativizer, root);
    assertSame(summary, relativizer.GetSummary());
    AssertThrows(IllegalStateException.class,
                 () -> relativizer.Relativize(root, ExactPrint.INPUT_START));
}

@Test public void
LayoutRelativeDeltas()
{
    Processed p = Process("main = do\n  foo x\n  bar\n");
    Ast.Node first = FindNode(p.Root(), "App", null);
    Ast.Node second = FindNode(p.Root(), "Var", "bar");
    Annotation doAnn = p.store.Get(FindNode(p.Root(), "Do", null));
    assertEquals(new DeltaPos(1, 2), doAnn.tokens.get(FindToken(doAnn, Keyword.LAYOUT)).delta);
    assertEquals(new DeltaPos(1, 0), p.store.Get(first).entryDelta);
    assertEquals(new DeltaPos(1, 0), p.store.Get(second).entryDelta);
}

@Test public void
LayoutOffsetBeforeComments()
{
    Processed p = Process("main = do\n  -- c\n  foo\n");
    Annotation doAnn = p.store.Get(FindNode(p.Root(), "Do", null));
    VerifyTokens(doAnn,
                 Token(TokenId.Keyword(TestLang.schedule.DO), 0, 0),
                 Token(TokenId.Keyword(Keyword.LAYOUT), 2, 2));
    Annotation foo = p.store.Get(FindNode(p.Root(), "Var", "foo"));
    assertEquals(new DeltaPos(1, 0), foo.priorComments.get(0).delta);
    assertEquals(new DeltaPos(1, 0), foo.entryDelta);
}

@Test public void
GroupCaptured()
{
    Processed p = Process("f = let a = 1\n        b = 2\n    in a\n");
    Ast.Node let = FindNode(p.Root(), "Let", null);
    AnnKey captured = p.store.Get(let).capturedSpan;
    assertNotNull(captured);
    assertEquals(new AnnKey(new Span(1, 8, 2, 13), "LetBinds"), captured);
    Annotation group = p.store.Get(captured);
    assertEquals(new DeltaPos(0, 1), group.entryDelta);
    assertNull(p.store.Get(new AnnKey(Span.NONE, "LetBinds")));
    VerifyText(p.printed, "f = let a = 1\n        b = 2\n    in a\n");
}
}
