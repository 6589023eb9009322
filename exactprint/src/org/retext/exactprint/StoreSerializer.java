package org.retext.exactprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/** Persists annotation store as JSON document. Keywords are stored by name and resolved against the
 * schedule when reading.
 */
public class StoreSerializer {

public
StoreSerializer(Schedule schedule)
{
    this.schedule = schedule;
}

public void
Write(AnnotationStore store, Writer writer) throws IOException
{
    mapper.writer(new DefaultPrettyPrinter().withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE))
          .writeValue(writer, ToTree(store));
}

public String
ToJson(AnnotationStore store)
{
    try {
        return mapper.writeValueAsString(ToTree(store));
    } catch (JsonProcessingException e) {
        throw new IllegalStateException("Failed to serialize annotations", e);
    }
}

/**
 * @throws IllegalArgumentException if the document is not a valid annotations document.
 */
public AnnotationStore
Read(Reader reader) throws IOException
{
    return FromTree(mapper.readTree(reader));
}

public AnnotationStore
FromJson(String json)
{
    JsonNode root;
    try {
        root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Malformed annotations document", e);
    }
    return FromTree(root);
}

// /////////////////////////////////////////////////////////////////////////////////////////////////

private static final String F_ANNOTATIONS = "annotations",
    F_SPAN = "span",
    F_SHAPE = "shape",
    F_ENTRY = "entry",
    F_PRIOR = "prior",
    F_FOLLOWING = "following",
    F_TOKENS = "tokens",
    F_SORT_KEY = "sortKey",
    F_CAPTURED = "captured",
    F_CONTENTS = "contents",
    F_ORIGIN = "origin",
    F_DELTA = "delta",
    F_TYPE = "type",
    F_KEYWORD = "keyword",
    F_STRING = "string",
    F_COMMENT = "comment";

private final Schedule schedule;
private final ObjectMapper mapper = new ObjectMapper();

private JsonNode
ToTree(AnnotationStore store)
{
    ObjectNode root = mapper.createObjectNode();
    ArrayNode anns = root.putArray(F_ANNOTATIONS);
    for (AnnKey key: store.Keys()) {
        Annotation ann = store.Get(key);
        ObjectNode node = anns.addObject();
        node.set(F_SPAN, SpanToTree(key.span));
        node.put(F_SHAPE, key.shape);
        node.set(F_ENTRY, DeltaToTree(ann.entryDelta));
        node.set(F_PRIOR, CommentsToTree(ann.priorComments));
        node.set(F_FOLLOWING, CommentsToTree(ann.followingComments));
        ArrayNode tokens = node.putArray(F_TOKENS);
        for (Annotation.TokenDelta td: ann.tokens) {
            ObjectNode token = tokens.addObject();
            token.put(F_TYPE, td.token.type.name());
            if (td.token.type == TokenId.Type.COMMENT) {
                token.set(F_COMMENT, CommentToTree(td.token.comment));
            } else {
                token.put(F_KEYWORD, td.token.keyword.name);
            }
            if (td.token.string != null) {
                token.put(F_STRING, td.token.string);
            }
            token.set(F_DELTA, DeltaToTree(td.delta));
        }
        if (ann.sortKey != null) {
            ArrayNode sortKey = node.putArray(F_SORT_KEY);
            for (Span span: ann.sortKey) {
                sortKey.add(SpanToTree(span));
            }
        }
        if (ann.capturedSpan != null) {
            ObjectNode captured = node.putObject(F_CAPTURED);
            captured.set(F_SPAN, SpanToTree(ann.capturedSpan.span));
            captured.put(F_SHAPE, ann.capturedSpan.shape);
        }
    }
    return root;
}

private AnnotationStore
FromTree(JsonNode root)
{
    JsonNode anns = root.get(F_ANNOTATIONS);
    if (anns == null || !anns.isArray()) {
        throw new IllegalArgumentException("Annotations array expected");
    }
    AnnotationStore store = new AnnotationStore();
    for (JsonNode node: anns) {
        AnnKey key = new AnnKey(SpanFromTree(Required(node, F_SPAN)),
                                Required(node, F_SHAPE).asText());
        Annotation ann = new Annotation(DeltaFromTree(Required(node, F_ENTRY)));
        ann.priorComments.addAll(CommentsFromTree(Required(node, F_PRIOR)));
        ann.followingComments.addAll(CommentsFromTree(Required(node, F_FOLLOWING)));
        for (JsonNode token: Required(node, F_TOKENS)) {
            ann.tokens.add(new Annotation.TokenDelta(TokenFromTree(token),
                                                     DeltaFromTree(Required(token, F_DELTA))));
        }
        JsonNode sortKey = node.get(F_SORT_KEY);
        if (sortKey != null) {
            ann.sortKey = new ArrayList<>();
            for (JsonNode span: sortKey) {
                ann.sortKey.add(SpanFromTree(span));
            }
        }
        JsonNode captured = node.get(F_CAPTURED);
        if (captured != null) {
            ann.capturedSpan = new AnnKey(SpanFromTree(Required(captured, F_SPAN)),
                                          Required(captured, F_SHAPE).asText());
        }
        store.Put(key, ann);
    }
    return store;
}

private TokenId
TokenFromTree(JsonNode node)
{
    TokenId.Type type;
    try {
        type = TokenId.Type.valueOf(Required(node, F_TYPE).asText());
    } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown token type: " + node.get(F_TYPE), e);
    }
    if (type == TokenId.Type.COMMENT) {
        return TokenId.Comment(CommentFromTree(Required(node, F_COMMENT)));
    }
    Keyword kw = KeywordFromName(Required(node, F_KEYWORD).asText());
    switch (type) {
    case KEYWORD:
        return TokenId.Keyword(kw);
    case UNICODE:
        return TokenId.Unicode(kw);
    case SEPARATOR:
        return TokenId.Separator(kw);
    case STRING:
        return TokenId.String(kw, Required(node, F_STRING).asText());
    default:
        throw new IllegalStateException("Unhandled token type: " + type);
    }
}

private Keyword
KeywordFromName(String name)
{
    Keyword kw = schedule.FindKeyword(name);
    if (kw == null) {
        throw new IllegalArgumentException("Keyword not defined in the schedule: " + name);
    }
    return kw;
}

private ArrayNode
CommentsToTree(List<Annotation.CommentDelta> comments)
{
    ArrayNode result = mapper.createArrayNode();
    for (Annotation.CommentDelta cd: comments) {
        ObjectNode node = CommentToTree(cd.comment);
        node.set(F_DELTA, DeltaToTree(cd.delta));
        result.add(node);
    }
    return result;
}

private ArrayList<Annotation.CommentDelta>
CommentsFromTree(JsonNode node)
{
    ArrayList<Annotation.CommentDelta> result = new ArrayList<>();
    for (JsonNode c: node) {
        result.add(new Annotation.CommentDelta(CommentFromTree(c),
                                               DeltaFromTree(Required(c, F_DELTA))));
    }
    return result;
}

private ObjectNode
CommentToTree(Comment c)
{
    ObjectNode node = mapper.createObjectNode();
    node.put(F_CONTENTS, c.contents);
    node.set(F_SPAN, SpanToTree(c.span));
    if (c.origin != null) {
        node.put(F_ORIGIN, c.origin.name);
    }
    return node;
}

private Comment
CommentFromTree(JsonNode node)
{
    JsonNode origin = node.get(F_ORIGIN);
    return new Comment(Required(node, F_CONTENTS).asText(),
                       SpanFromTree(Required(node, F_SPAN)),
                       origin != null ? KeywordFromName(origin.asText()) : null);
}

private ArrayNode
SpanToTree(Span span)
{
    ArrayNode node = mapper.createArrayNode();
    node.add(span.start.line).add(span.start.col).add(span.end.line).add(span.end.col);
    return node;
}

private static Span
SpanFromTree(JsonNode node)
{
    if (!node.isArray() || node.size() != 4) {
        throw new IllegalArgumentException("Span expected: " + node);
    }
    return new Span(node.get(0).asInt(), node.get(1).asInt(), node.get(2).asInt(),
                    node.get(3).asInt());
}

private ArrayNode
DeltaToTree(DeltaPos dp)
{
    return mapper.createArrayNode().add(dp.lines).add(dp.cols);
}

private static DeltaPos
DeltaFromTree(JsonNode node)
{
    if (!node.isArray() || node.size() != 2) {
        throw new IllegalArgumentException("Delta expected: " + node);
    }
    return new DeltaPos(node.get(0).asInt(), node.get(1).asInt());
}

private static JsonNode
Required(JsonNode node, String field)
{
    JsonNode value = node.get(field);
    if (value == null) {
        throw new IllegalArgumentException(
            String.format("Missing field `%s` in %s", field, node));
    }
    return value;
}
}
