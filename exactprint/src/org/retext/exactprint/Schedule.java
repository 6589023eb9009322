package org.retext.exactprint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;

/** Annotation schedule table. For each node shape describes which keywords and child nodes the node
 * has and in what order. Both the relativizer and the printer interpret the same schedule.
 */
public class Schedule {

private static final String INSTR_STR_INDENT = "    ";

public enum Type {
    /** Keyword expected to be present. */
    MARK,
    /** Keyword which new nodes do not print. */
    MARK_OPTIONAL,
    /** Specific occurrence of a keyword repeated at known offsets. */
    MARK_OFFSET,
    /** All occurrences of a keyword. */
    MARK_MANY,
    /** All occurrences of a keyword enclosed by the node span. */
    MARK_INSIDE,
    /** All occurrences of a keyword attached to the node but located outside of its span. */
    MARK_OUTSIDE,
    /** Node own text located at the node span. */
    VALUE,
    CHILD,
    CHILDREN,
    /** Children of one or more slots, emitted in source order. */
    SORTED,
    /** Synthesized node wrapping children which have no common location in the tree. */
    GROUP,
    /** Layout sensitive region. */
    LAYOUT,
    /** Nested instructions applied only if a keyword is present enough times. */
    WHEN_COUNT,
    /** Keywords which are turned into comments. */
    TO_COMMENTS,
    EOF
}

/** Schedule element. */
public static abstract class Instruction {
    public final Type type;

    @Override public String
    toString()
    {
        return toString("");
    }

    protected
    Instruction(Type type)
    {
        this.type = type;
    }

    protected String
    toString(String indent)
    {
        return indent + type;
    }
}

public static class KeywordInstruction extends Instruction {
    public final Keyword keyword;
    /** Text to print instead of the keyword text, null if not specified. */
    public final String text;
    /** Occurrence index for MARK_OFFSET. */
    public final int offset;
    /** MARK_OUTSIDE records the tokens as separators. */
    public final boolean separator;

    @Override protected String
    toString(String indent)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(type).append(' ').append(keyword);
        if (text != null) {
            sb.append(" \"").append(text).append('"');
        }
        if (type == Type.MARK_OFFSET) {
            sb.append(" #").append(offset);
        }
        return sb.toString();
    }

    private
    KeywordInstruction(Type type, Keyword keyword, String text, int offset, boolean separator)
    {
        super(type);
        this.keyword = keyword;
        this.text = text;
        this.offset = offset;
        this.separator = separator;
    }
}

public static class SlotInstruction extends Instruction {
    public final String[] slots;
    /** Keyword printed between new items and their predecessors, null if none. */
    public final Keyword separator;

    @Override protected String
    toString(String indent)
    {
        String s = indent + type + " " + String.join(", ", slots);
        return separator != null ? s + " SEP " + separator : s;
    }

    private
    SlotInstruction(Type type, Keyword separator, String... slots)
    {
        super(type);
        if (slots.length == 0) {
            throw new IllegalArgumentException("At least one slot should be specified");
        }
        this.slots = slots;
        this.separator = separator;
    }
}

public static class BlockInstruction extends Instruction {
    public final Instruction[] body;
    /** Shape of the synthesized node for GROUP. */
    public final String shape;
    /** Counted keyword for WHEN_COUNT. */
    public final Keyword keyword;
    public final int minCount;

    @Override protected String
    toString(String indent)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(type);
        if (shape != null) {
            sb.append(" `").append(shape).append('`');
        }
        if (keyword != null) {
            sb.append(' ').append(keyword).append(" >= ").append(minCount);
        }
        sb.append('\n');
        for (Instruction instr: body) {
            sb.append(instr.toString(indent + INSTR_STR_INDENT)).append('\n');
        }
        return sb.toString();
    }

    private
    BlockInstruction(Type type, String shape, Keyword keyword, int minCount, Instruction... body)
    {
        super(type);
        this.body = body;
        this.shape = shape;
        this.keyword = keyword;
        this.minCount = minCount;
    }
}

public static class CommentsInstruction extends Instruction {
    public final Keyword[] keywords;

    @Override protected String
    toString(String indent)
    {
        return indent + type + " " + Arrays.toString(keywords);
    }

    private
    CommentsInstruction(Keyword... keywords)
    {
        super(Type.TO_COMMENTS);
        this.keywords = keywords;
    }
}

/** Provides instructions for a node. Shapes whose schedule depends on the node content (e.g. on
 * a flag stored in the tree) register their own handler.
 */
@FunctionalInterface
public interface Handler {

    List<Instruction>
    Instructions(Ast.Node node);
}

public class ShapeBuilder {

    /** Fixed instruction sequence. */
    public Handler
    Sequence(Instruction... instructions)
    {
        List<Instruction> list = Arrays.asList(instructions);
        return Handler(node -> list);
    }

    public Handler
    Handler(Handler handler)
    {
        if (handlers.containsKey(shape)) {
            throw new IllegalArgumentException("Duplicated shape: " + shape);
        }
        handlers.put(shape, handler);
        return handler;
    }

    /** The shape can not be annotated, e.g. it only occurs in later compiler phases. */
    public void
    Unsupported(String reason)
    {
        Handler(node -> {
            throw new UnsupportedConstructException(node.shape, node.span, reason);
        });
    }

    private
    ShapeBuilder(String shape)
    {
        this.shape = shape;
    }

    private final String shape;
}

public ShapeBuilder
Shape(String shape)
{
    return new ShapeBuilder(shape);
}

/** Define a keyword. */
public Keyword
Keyword(String name, String text, Keyword.Flag... flags)
{
    if (keywords.containsKey(name)) {
        throw new IllegalArgumentException("Duplicated keyword: " + name);
    }
    Keyword kw = new Keyword(name, text).Flags(flags);
    keywords.put(name, kw);
    return kw;
}

/** Keywords attached to a node but located after it, e.g. a comma following a list element.
 * Marked outside of every node when it is left.
 */
public void
Trailing(Keyword... keywords)
{
    trailing.addAll(Arrays.asList(keywords));
}

public Instruction
Mark(Keyword keyword)
{
    return new KeywordInstruction(Type.MARK, keyword, null, 0, false);
}

/** Keyword printed with the specified text instead of its default one. */
public Instruction
MarkWithString(Keyword keyword, String text)
{
    return new KeywordInstruction(Type.MARK, keyword, text, 0, false);
}

public Instruction
MarkOptional(Keyword keyword)
{
    return new KeywordInstruction(Type.MARK_OPTIONAL, keyword, null, 0, false);
}

/** Occurrence of a keyword by its index among all occurrences inside the node. */
public Instruction
MarkOffset(Keyword keyword, int offset)
{
    return new KeywordInstruction(Type.MARK_OFFSET, keyword, null, offset, false);
}

public Instruction
MarkMany(Keyword keyword)
{
    return new KeywordInstruction(Type.MARK_MANY, keyword, null, 0, false);
}

public Instruction
MarkInside(Keyword keyword)
{
    return new KeywordInstruction(Type.MARK_INSIDE, keyword, null, 0, false);
}

/**
 * @param separator Record the tokens as separators.
 */
public Instruction
MarkOutside(Keyword keyword, boolean separator)
{
    return new KeywordInstruction(Type.MARK_OUTSIDE, keyword, null, 0, separator);
}

public Instruction
Value()
{
    return new Instruction(Type.VALUE) {};
}

public Instruction
Child(String slot)
{
    return new SlotInstruction(Type.CHILD, null, slot);
}

public Instruction
Children(String slot)
{
    return new SlotInstruction(Type.CHILDREN, null, slot);
}

/** Children of a slot whose items are separated by the specified keyword. The separators are
 * recorded as trailing keywords of the items, the schedule should list the keyword in
 * {@link #Trailing}.
 */
public Instruction
Children(String slot, Keyword separator)
{
    return new SlotInstruction(Type.CHILDREN, separator, slot);
}

/** Children of the specified slots emitted in their source order. */
public Instruction
Sorted(String... slots)
{
    return new SlotInstruction(Type.SORTED, null, slots);
}

/** Synthesized node spanning everything the body annotates. */
public Instruction
Group(String shape, Instruction... body)
{
    return new BlockInstruction(Type.GROUP, shape, null, 0, body);
}

public Instruction
Layout(Instruction... body)
{
    return new BlockInstruction(Type.LAYOUT, null, null, 0, body);
}

public Instruction
WhenCount(Keyword keyword, int minCount, Instruction... body)
{
    return new BlockInstruction(Type.WHEN_COUNT, null, keyword, minCount, body);
}

public Instruction
ToComments(Keyword... keywords)
{
    return new CommentsInstruction(keywords);
}

public Instruction
Eof()
{
    return new KeywordInstruction(Type.EOF, Keyword.EOF, null, 0, false);
}

/** Get handler for the shape.
 *
 * @throws UnsupportedConstructException if the shape is unknown.
 */
public Handler
Lookup(String shape, Span span)
{
    Handler h = handlers.get(shape);
    if (h == null) {
        throw new UnsupportedConstructException(shape, span, "No annotation schedule for shape");
    }
    return h;
}

public List<Instruction>
Instructions(Ast.Node node)
{
    return Lookup(node.shape, node.span).Instructions(node);
}

/** Get keyword by name, built-in keywords included. Null if not defined. */
public Keyword
FindKeyword(String name)
{
    if (Keyword.EOF.name.equals(name)) {
        return Keyword.EOF;
    }
    if (Keyword.VALUE.name.equals(name)) {
        return Keyword.VALUE;
    }
    if (Keyword.LAYOUT.name.equals(name)) {
        return Keyword.LAYOUT;
    }
    return keywords.get(name);
}

public List<Keyword>
GetTrailing()
{
    return trailing;
}

/** Describe schedule of the node shape. */
public String
Describe(Ast.Node node)
{
    StringBuilder sb = new StringBuilder();
    sb.append('`').append(node.shape).append("`:\n");
    for (Instruction instr: Instructions(node)) {
        sb.append(instr.toString(INSTR_STR_INDENT));
        if (sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
    }
    return sb.toString();
}

/** Keywords indexed by name. */
private final TreeMap<String, Keyword> keywords = new TreeMap<>();
private final TreeMap<String, Handler> handlers = new TreeMap<>();
private final ArrayList<Keyword> trailing = new ArrayList<>();
}
