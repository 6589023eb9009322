package org.retext.exactprint;

import java.util.ArrayList;

/** Diagnostics of relativization, balancing and printing passes are reported into this class.
 * Processing can be monitored in real time if this class is subclassed and Add() overridden.
 */
public class Summary {

public enum RecordType {
    ERROR,
    WARNING,
    VERBOSE
}

public static class Record {
    public final RecordType type;
    /* -1 if not specified. */
    public final int code;
    /* May be null if not position-bound. */
    public final Position position;
    public final String message;

    public
    Record(RecordType type, int code, Position position, String message, Object... fmtArgs)
    {
        this.type = type;
        this.code = code;
        this.position = position;
        this.message = fmtArgs.length == 0 ? message : String.format(message, fmtArgs);
    }

    @Override public String
    toString()
    {
        StringBuilder sb = new StringBuilder();
        if (position != null) {
            sb.append(position);
            sb.append(": ");
        }
        switch (type) {
        case ERROR:
            sb.append(code != -1 ? "Error E" + code : "Error");
            sb.append(": ");
            break;
        case WARNING:
            sb.append(code != -1 ? "Warning W" + code : "Warning");
            sb.append(": ");
            break;
        case VERBOSE:
            break;
        default:
            throw new RuntimeException("Unhandled record type: " + type);
        }
        sb.append(message);
        return sb.toString();
    }
}

public final ArrayList<Record> records = new ArrayList<>();

public void
Add(Record rec)
{
    records.add(rec);
    if (rec.type == RecordType.ERROR) {
        numErrors++;
    } else if (rec.type == RecordType.WARNING) {
        numWarnings++;
    }
}

public void
Error(Position position, int code, String message, Object... fmtArgs)
{
    Add(new Record(RecordType.ERROR, code, position, message, fmtArgs));
}

public void
Warning(Position position, int code, String message, Object... fmtArgs)
{
    Add(new Record(RecordType.WARNING, code, position, message, fmtArgs));
}

public void
Warning(int code, String message, Object... fmtArgs)
{
    Warning(null, code, message, fmtArgs);
}

public void
Verbose(Position position, String message, Object... fmtArgs)
{
    Add(new Record(RecordType.VERBOSE, -1, position, message, fmtArgs));
}

/** @return Records of the specified type and code, any code if code is -1. */
public ArrayList<Record>
Find(RecordType type, int code)
{
    ArrayList<Record> result = new ArrayList<>();
    for (Record rec: records) {
        if (rec.type == type && (code == -1 || rec.code == code)) {
            result.add(rec);
        }
    }
    return result;
}

@Override public String
toString()
{
    StringBuilder sb = new StringBuilder();
    for (Record rec: records) {
        sb.append(rec.toString());
        sb.append('\n');
    }
    sb.append("===========================================================\n");
    sb.append(String.format("%d errors, %d warnings", numErrors, numWarnings));
    return sb.toString();
}

public final int
GetErrorsCount()
{
    return numErrors;
}

public final int
GetWarningsCount()
{
    return numWarnings;
}

private int numErrors, numWarnings;
}
