package org.retext.exactprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** Syntax tree handed over by the parser. Nodes are identified for annotation purposes by their
 * span and shape tag, children are kept in named slots referred by the annotation schedule.
 */
public class Ast {

public class Node {

    /** Shape tag, selects the annotation schedule and is a part of the annotation key. */
    public final String shape;
    /** Source span, Span.NONE for nodes created after parsing. */
    public Span span;
    /** Text of leaf nodes (identifiers, literals). */
    public String value;
    public Node parent;

    public AnnKey
    Key()
    {
        return new AnnKey(span, shape);
    }

    /** @return Children in the slot, empty list if none. The returned list is read-only. */
    public List<Node>
    Slot(String name)
    {
        ArrayList<Node> nodes = slots.get(name);
        if (nodes == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(nodes);
    }

    /** @return The only child in the slot, null if the slot is empty. */
    public Node
    Child(String name)
    {
        List<Node> nodes = Slot(name);
        if (nodes.isEmpty()) {
            return null;
        }
        if (nodes.size() > 1) {
            throw new IllegalStateException(
                String.format("Slot `%s` of %s has %d children", name, shape, nodes.size()));
        }
        return nodes.get(0);
    }

    public Node
    AppendChild(String slot, Node child)
    {
        slots.computeIfAbsent(slot, k -> new ArrayList<>()).add(child);
        child.parent = this;
        return this;
    }

    public Node
    InsertChild(String slot, int index, Node child)
    {
        slots.computeIfAbsent(slot, k -> new ArrayList<>()).add(index, child);
        child.parent = this;
        return this;
    }

    public boolean
    RemoveChild(Node child)
    {
        for (ArrayList<Node> nodes: slots.values()) {
            if (nodes.remove(child)) {
                child.parent = null;
                return true;
            }
        }
        return false;
    }

    /** Replace the slot content. */
    public Node
    SetSlot(String slot, List<Node> children)
    {
        ArrayList<Node> old = slots.get(slot);
        if (old != null) {
            for (Node n: old) {
                n.parent = null;
            }
        }
        ArrayList<Node> nodes = new ArrayList<>(children);
        for (Node n: nodes) {
            n.parent = this;
        }
        slots.put(slot, nodes);
        return this;
    }

    /** All children, slot by slot in the order slots were first populated. */
    public List<Node>
    Children()
    {
        ArrayList<Node> result = new ArrayList<>();
        for (ArrayList<Node> nodes: slots.values()) {
            result.addAll(nodes);
        }
        return result;
    }

    /** Check if the specified node is ancestor of this node. Returns also true for the same node. */
    public boolean
    IsAncestor(Node ancestor)
    {
        Node node = this;
        while (node != null) {
            if (node == ancestor) {
                return true;
            }
            node = node.parent;
        }
        return false;
    }

    @Override public String
    toString()
    {
        if (value != null) {
            return String.format("%s %s `%s`", shape, span, value);
        }
        return shape + " " + span;
    }

    private
    Node(String shape, Span span, String value)
    {
        this.shape = shape;
        this.span = span;
        this.value = value;
    }

    private final LinkedHashMap<String, ArrayList<Node>> slots = new LinkedHashMap<>();
}

public Node root;

public Node
CreateNode(String shape, Span span, String value)
{
    return new Node(shape, span, value);
}

public Node
CreateNode(String shape, Span span)
{
    return new Node(shape, span, null);
}

/** Create a node which has no original source location. */
public Node
CreateNode(String shape)
{
    return new Node(shape, Span.NONE, null);
}

/** Visit all nodes, children before their parent. */
public static void
VisitPostOrder(Node node, Consumer<Node> visitor)
{
    for (Node child: node.Children()) {
        VisitPostOrder(child, visitor);
    }
    visitor.accept(node);
}

/** Dump the tree structure, one node per line. */
public static String
Describe(Node node)
{
    StringBuilder sb = new StringBuilder();
    Describe(node, "", sb);
    return sb.toString();
}

private static void
Describe(Node node, String indent, StringBuilder sb)
{
    sb.append(indent).append(node).append('\n');
    for (Map.Entry<String, ArrayList<Node>> e: node.slots.entrySet()) {
        for (Node child: e.getValue()) {
            sb.append(indent).append("  ").append(e.getKey()).append(":\n");
            Describe(child, indent + "    ", sb);
        }
    }
}
}
