package org.retext.exactprint;

/** Relative position: offset from wherever output has reached to the next emitted element. If
 * lines is zero, cols is relative to the current output column. Otherwise cols is the column on
 * the new line, relative to the active layout baseline.
 */
public final class DeltaPos {

public static final DeltaPos ZERO = new DeltaPos(0, 0);

public final int lines, cols;

public
DeltaPos(int lines, int cols)
{
    this.lines = lines;
    this.cols = cols;
}

/** Whether the delta can be emitted, i.e. does not point backwards. */
public boolean
IsGood()
{
    return lines >= 0 && cols >= 0;
}

public DeltaPos
Saturate()
{
    return IsGood() ? this : ZERO;
}

/** Delta equivalent to emitting this delta followed by the specified one. */
public DeltaPos
Add(DeltaPos next)
{
    if (next.lines > 0) {
        return new DeltaPos(lines + next.lines, next.cols);
    }
    return new DeltaPos(lines, cols + next.cols);
}

/** Delta occupied by the specified text when emitted. */
public static DeltaPos
Of(String text)
{
    Position p = new Position(1, 0).Advance(text);
    return new DeltaPos(p.line - 1, p.col);
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof DeltaPos)) {
        return false;
    }
    DeltaPos dp = (DeltaPos)o;
    return lines == dp.lines && cols == dp.cols;
}

@Override public int
hashCode()
{
    return lines * 31 + cols;
}

@Override public String
toString()
{
    return String.format("DP (%d,%d)", lines, cols);
}
}
