package org.retext.exactprint;

/** Absolute position in source text. Lines are counted from 1, columns from 0. */
public final class Position implements Comparable<Position> {

public final int line, col;

public
Position(int line, int col)
{
    this.line = line;
    this.col = col;
}

/** Relative position of the specified position from this one. When both are on the same line the
 * column is relative to this column, otherwise it is the absolute column on the new line.
 */
public DeltaPos
DeltaTo(Position pos)
{
    int lines = pos.line - line;
    if (lines == 0) {
        return new DeltaPos(0, pos.col - col);
    }
    return new DeltaPos(lines, pos.col);
}

/** Position reached after the specified text is emitted starting from this position. */
public Position
Advance(String text)
{
    int l = line, c = col;
    for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == '\n') {
            l++;
            c = 0;
        } else {
            c++;
        }
    }
    return new Position(l, c);
}

public boolean
IsBefore(Position pos)
{
    return compareTo(pos) < 0;
}

public static Position
Max(Position p1, Position p2)
{
    return p1.compareTo(p2) >= 0 ? p1 : p2;
}

@Override public int
compareTo(Position other)
{
    if (line != other.line) {
        return Integer.compare(line, other.line);
    }
    return Integer.compare(col, other.col);
}

@Override public boolean
equals(Object o)
{
    if (!(o instanceof Position)) {
        return false;
    }
    Position p = (Position)o;
    return line == p.line && col == p.col;
}

@Override public int
hashCode()
{
    return line * 31 + col;
}

@Override public String
toString()
{
    return String.format("Line %d column %d", line, col);
}
}
