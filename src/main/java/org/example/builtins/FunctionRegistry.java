package org.example.builtins;

import java.util.*;

/**
 * Name to builtin mapping. Names are case-sensitive.
 */
public final class FunctionRegistry {
    private final Map<String, Function> map = new LinkedHashMap<>();

    public void register(String name, Function f){ map.put(name, f); }

    public Function resolve(String name){
        Function f = map.get(name);
        if (f == null) throw new EvalException("UNKNOWN_FUNCTION: '" + name + "'");
        return f;
    }

    public boolean contains(String name){ return map.containsKey(name); }

    public Set<String> names(){ return Collections.unmodifiableSet(map.keySet()); }

    public Value call(Context ctx, String name, List<Value> args){
        return resolve(name).invoke(ctx, args);
    }
}
