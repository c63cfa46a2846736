package org.example.builtins;

import java.util.*;

/**
 * {@code search(query, table[, cardinality[, column]])}.
 *
 * <p>Returns positions in {@code table} that hold {@code query}. The table is
 * either a string, searched codepoint by codepoint, or a vector whose rows are
 * compared on {@code column}. The cardinality decides both how many matches are
 * kept per query element and the shape of the result:
 * <ul>
 *   <li>{@code 1} (default): the first match only, as a bare index;</li>
 *   <li>{@code 0}: every match, as a nested vector per query element;</li>
 *   <li>{@code k > 1}: at most {@code k} matches, nested.</li>
 * </ul>
 * A number query always gives a flat list of row indices. Query elements that
 * match nothing are reported through the context's warning sink.
 */
final class TableSearch {

    private TableSearch(){}

    static Value invoke(Context ctx, List<Value> a){
        if (a.size() < 2 || a.size() > 4) return UndefVal.INSTANCE;
        int cardinality = a.size() > 2 ? Coerce.toIndex(a.get(2)) : 1;
        int column = a.size() > 3 ? Coerce.toIndex(a.get(3)) : 0;
        if (cardinality < 0 || column < 0) return UndefVal.INSTANCE;
        return search(a.get(0), a.get(1), cardinality, column, ctx.warnings);
    }

    static Value search(Value query, Value table, int cardinality, int column, WarningSink warnings){
        switch (query.type()) {
            case NUMBER:
                return new VecVal(matchRows(query, Coerce.toVector(table), cardinality, column));
            case STRING:
                return new VecVal(matchCodePoints((StrVal) query, tableCodePoints(table, column), cardinality, warnings));
            case VECTOR:
                return new VecVal(matchEach(Coerce.toVector(query), Coerce.toVector(table), cardinality, column, warnings));
            case UNDEFINED:
            default:
                warnings.warn("search: none performed on input " + ValuePrinter.print(query));
                return UndefVal.INSTANCE;
        }
    }

    // ---------- row matching ----------

    /** Indices of the rows matching {@code find}, at most {@code cardinality} of them (0 = all). */
    private static List<Value> matchRows(Value find, List<Value> rows, int cardinality, int column){
        List<Value> found = new ArrayList<>();
        for (int j = 0; j < rows.size(); j++) {
            if (!rowMatches(find, rows.get(j), column)) continue;
            found.add(NumVal.ofInt(j));
            if (cardinality != 0 && found.size() >= cardinality) break;
        }
        return found;
    }

    /**
     * With column 0 a row also matches when it equals the query as a whole, so
     * a plain list of scalars can be searched like a one-column table.
     */
    private static boolean rowMatches(Value find, Value row, int column){
        if (column == 0 && find.equals(row)) return true;
        List<Value> fields = Coerce.toVector(row);
        return column < fields.size() && find.equals(fields.get(column));
    }

    private static List<Value> matchEach(List<Value> queries, List<Value> rows, int cardinality, int column,
                                         WarningSink warnings){
        List<Value> out = new ArrayList<>(queries.size());
        for (Value find : queries) {
            List<Value> found = matchRows(find, rows, cardinality, column);
            if (cardinality != 1) {
                out.add(new VecVal(found));
                continue;
            }
            if (!found.isEmpty()) {
                out.add(found.get(0));
                continue;
            }
            // a miss keeps its slot as an empty vector so positions still line up
            warnNotFound(find, warnings);
            out.add(VecVal.EMPTY);
        }
        return out;
    }

    private static void warnNotFound(Value find, WarningSink warnings){
        if (find.type() == Value.Type.NUMBER) {
            warnings.warn("search term not found: " + ValuePrinter.print(find));
        } else if (find.type() == Value.Type.STRING) {
            warnings.warn("search term not found: \"" + ((StrVal) find).v + "\"");
        }
    }

    // ---------- codepoint matching ----------

    /**
     * The codepoints a string query is matched against: every codepoint of a
     * string table, or for a vector table the first codepoint of each row's
     * column field. Rows with nothing to compare hold -1.
     */
    private static int[] tableCodePoints(Value table, int column){
        if (table.type() == Value.Type.STRING) return ((StrVal) table).codePoints();
        List<Value> rows = Coerce.toVector(table);
        int[] out = new int[rows.size()];
        for (int j = 0; j < rows.size(); j++) {
            Value field = field(rows.get(j), column);
            String text = field == null ? "" : ValuePrinter.print(field);
            out[j] = text.isEmpty() ? -1 : text.codePointAt(0);
        }
        return out;
    }

    private static Value field(Value row, int column){
        if (row.type() != Value.Type.VECTOR) return column == 0 ? row : null;
        List<Value> fields = ((VecVal) row).v;
        return column < fields.size() ? fields.get(column) : null;
    }

    private static List<Value> matchCodePoints(StrVal find, int[] table, int cardinality, WarningSink warnings){
        List<Value> out = new ArrayList<>();
        for (int i = 0; i < find.length(); i++) {
            int cp = find.codePointAt(i);
            List<Value> found = new ArrayList<>();
            for (int j = 0; j < table.length; j++) {
                if (table[j] != cp) continue;
                found.add(NumVal.ofInt(j));
                if (cardinality != 0 && found.size() >= cardinality) break;
            }
            if (found.isEmpty()) {
                warnings.warn("search term not found: \"" + new String(Character.toChars(cp)) + "\"");
            }
            if (cardinality == 1) {
                if (!found.isEmpty()) out.add(found.get(0));
            } else {
                out.add(new VecVal(found));
            }
        }
        return out;
    }
}
