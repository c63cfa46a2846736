package org.example.builtins;

import java.util.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Conversion between Jackson trees and {@link Value}s.
 *
 * <pre>
 *   null    &lt;-&gt; undef
 *   number  &lt;-&gt; number   (NaN and infinities are written as null)
 *   string  &lt;-&gt; string
 *   array   &lt;-&gt; vector
 * </pre>
 * Booleans and objects have no value counterpart and are rejected.
 */
public final class ValueJson {

    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson(){}

    public static Value toValue(JsonNode node){
        if (node == null || node.isNull() || node.isMissingNode()) return UndefVal.INSTANCE;
        if (node.isNumber()) return new NumVal(node.doubleValue());
        if (node.isTextual()) return new StrVal(node.asText());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode child : node) items.add(toValue(child));
            return new VecVal(items);
        }
        throw new EvalException("PARSE_ERROR: no value for JSON " + node.getNodeType().name().toLowerCase(Locale.ROOT) + ": " + node);
    }

    /** Converts every element of a JSON array, e.g. an argument list. */
    public static List<Value> toValues(JsonNode array){
        if (array == null || array.isNull() || array.isMissingNode()) return Collections.emptyList();
        if (!array.isArray()) throw new EvalException("PARSE_ERROR: expected a JSON array but got " + array);
        List<Value> out = new ArrayList<>(array.size());
        for (JsonNode child : array) out.add(toValue(child));
        return out;
    }

    public static JsonNode toJson(Value val){
        switch (val.type()) {
            case NUMBER: {
                double d = ((NumVal) val).v;
                if (Double.isNaN(d) || Double.isInfinite(d)) return NODES.nullNode();
                if (d == Math.rint(d) && Math.abs(d) < 1e15) return NODES.numberNode((long) d);
                return NODES.numberNode(d);
            }
            case STRING:
                return NODES.textNode(((StrVal) val).v);
            case VECTOR: {
                ArrayNode arr = NODES.arrayNode();
                for (Value item : ((VecVal) val).v) arr.add(toJson(item));
                return arr;
            }
            case UNDEFINED:
            default:
                return NODES.nullNode();
        }
    }

    /** Parses JSON text straight into a value, e.g. {@code [["a",1],["b",2]]}. */
    public static Value parse(String json){
        try {
            return toValue(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new EvalException("PARSE_ERROR: " + e.getOriginalMessage(), e);
        }
    }
}
