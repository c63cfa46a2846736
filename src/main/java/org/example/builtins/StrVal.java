package org.example.builtins;

/**
 * Unicode text. Length and indexing count codepoints, so a character outside
 * the BMP is one position even though Java stores it as two chars.
 */
public final class StrVal implements Value {

    final String v;
    private int[] codePoints;

    public StrVal(String v){ this.v = v == null ? "" : v; }

    public Type type(){ return Type.STRING; }

    public String value(){ return v; }

    /** Number of codepoints. */
    public int length(){ return codePoints().length; }

    public int codePointAt(int index){ return codePoints()[index]; }

    int[] codePoints(){
        if (codePoints == null) codePoints = v.codePoints().toArray();
        return codePoints;
    }

    @Override
    public boolean equals(Object o){
        return o instanceof StrVal && ((StrVal) o).v.equals(v);
    }

    @Override public int hashCode(){ return v.hashCode(); }
    @Override public String toString(){ return v; }
}
