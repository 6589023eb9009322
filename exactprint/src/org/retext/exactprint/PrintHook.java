package org.retext.exactprint;

/** Allows decorating the printed text of each node, e.g. for markup generation. Positions used for
 * layout are computed from the undecorated text.
 */
@FunctionalInterface
public interface PrintHook {

/**
 * @param node Printed node.
 * @param text Text printed for the node, including its comments and children.
 * @return Text to output instead.
 */
String
Wrap(Ast.Node node, String text);
}
