package org.retext.exactprint;

/** Thrown when a node shape has no sensible annotation. Aborts processing of the tree. */
public class UnsupportedConstructException extends RuntimeException {

public final String shape;
public final Span span;

public
UnsupportedConstructException(String shape, Span span, String reason)
{
    super(String.format("%s at %s: %s", shape, span, reason));
    this.shape = shape;
    this.span = span;
}
}
