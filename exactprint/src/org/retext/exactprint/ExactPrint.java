package org.retext.exactprint;

import java.util.Collection;

/** Entry points combining the processing passes. */
public final class ExactPrint {

/** Position of the first character of an input. */
public static final Position INPUT_START = new Position(1, 0);

/** Produce annotations for a freshly parsed tree: relativization followed by comment balancing.
 *
 * @param schedule Annotation schedule of the language.
 * @param root Tree root.
 * @param facts Token positions reported by the parser.
 * @param comments Comments collected by the lexer.
 * @param summary Receives diagnostics of all passes.
 */
public static AnnotationStore
Relativize(Schedule schedule, Ast.Node root, RawFacts facts, Collection<Comment> comments,
           Summary summary)
{
    AnnotationStore store =
        new Relativizer(schedule, facts, comments, summary).Relativize(root, INPUT_START);
    new CommentBalancer(store, summary).Balance(root);
    return store;
}

public static String
Print(Schedule schedule, Ast.Node root, AnnotationStore store)
{
    return new Printer(schedule, store).Print(root);
}

public static String
Print(Schedule schedule, Ast.Node root, AnnotationStore store, PrintHook hook)
{
    return new Printer(schedule, store).SetHook(hook).Print(root);
}

private
ExactPrint()
{}
}
